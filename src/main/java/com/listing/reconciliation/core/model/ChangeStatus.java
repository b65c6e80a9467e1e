package com.listing.reconciliation.core.model;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/**
 * Review status of a change.
 *
 * <pre>
 * PENDING  -> APPROVED | REJECTED | APPLIED | DISCARDED
 * APPROVED -> APPLIED | DISCARDED
 * REJECTED, APPLIED, DISCARDED are terminal
 * </pre>
 */
public enum ChangeStatus {
    PENDING,
    APPROVED,
    REJECTED,
    APPLIED,
    DISCARDED;

    public boolean canTransitionTo(ChangeStatus target) {
        return allowedTargets().contains(target);
    }

    public boolean isTerminal() {
        return allowedTargets().isEmpty();
    }

    public Set<ChangeStatus> allowedTargets() {
        return switch (this) {
            case PENDING -> EnumSet.of(APPROVED, REJECTED, APPLIED, DISCARDED);
            case APPROVED -> EnumSet.of(APPLIED, DISCARDED);
            case REJECTED, APPLIED, DISCARDED -> EnumSet.noneOf(ChangeStatus.class);
        };
    }

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static ChangeStatus fromWireName(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Change status is required");
        }
        return ChangeStatus.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
