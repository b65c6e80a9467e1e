package com.listing.reconciliation.api;

import com.listing.reconciliation.core.model.Change;
import com.listing.reconciliation.core.model.ChangeStatus;
import com.listing.reconciliation.core.model.ChangeType;

import java.util.EnumSet;
import java.util.Set;

/**
 * Restricts {@code listChanges} to some change types and/or statuses. An empty set means
 * "any".
 */
public record ChangeFilter(Set<ChangeType> types, Set<ChangeStatus> statuses) {

    public ChangeFilter {
        types = types == null || types.isEmpty() ? Set.of() : Set.copyOf(EnumSet.copyOf(types));
        statuses = statuses == null || statuses.isEmpty() ? Set.of() : Set.copyOf(EnumSet.copyOf(statuses));
    }

    public static ChangeFilter all() {
        return new ChangeFilter(Set.of(), Set.of());
    }

    public static ChangeFilter ofTypes(ChangeType first, ChangeType... rest) {
        return new ChangeFilter(EnumSet.of(first, rest), Set.of());
    }

    public static ChangeFilter ofStatuses(ChangeStatus first, ChangeStatus... rest) {
        return new ChangeFilter(Set.of(), EnumSet.of(first, rest));
    }

    public boolean matches(Change change) {
        return (types.isEmpty() || types.contains(change.getChangeType()))
                && (statuses.isEmpty() || statuses.contains(change.getStatus()));
    }
}
