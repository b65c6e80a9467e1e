package com.listing.reconciliation.core.model;

import java.util.Locale;

/**
 * Classification of a reconciliation change. Declaration order is the order in which changes
 * are listed for review.
 */
public enum ChangeType {
    CREATE,
    UPDATE,
    DELETE,
    UNCHANGED,
    /**
     * The candidate references a taxonomy entry (typically a model) that does not exist yet.
     * Informational until the missing entry is registered.
     */
    MISSING_REFERENCE;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Returns true for types that a reviewer may select for application.
     */
    public boolean isApplicable() {
        return this == CREATE || this == UPDATE || this == DELETE;
    }

    /**
     * Parses a wire name such as {@code missing_reference}, case-insensitively.
     */
    public static ChangeType fromWireName(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Change type is required");
        }
        return ChangeType.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
