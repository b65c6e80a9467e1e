package com.listing.reconciliation.core.model;

import java.util.Collection;

/**
 * Per-type change counts of a comparison session.
 *
 * <p>The per-type counts are always derived from the changes currently stored for the session
 * ({@link #recount(Collection)}); {@code totalExtracted} and {@code totalExisting} describe the
 * inputs of the build and never change afterwards.</p>
 */
public record SessionSummary(
        int totalNew,
        int totalUpdated,
        int totalDeleted,
        int totalUnchanged,
        int totalMissingReferences,
        int totalExtracted,
        int totalMatched,
        int totalExisting,
        int exactMatches,
        int fuzzyMatches
) {

    public static SessionSummary empty() {
        return new SessionSummary(0, 0, 0, 0, 0, 0, 0, 0, 0, 0);
    }

    /**
     * Computes a summary from the given changes and build inputs.
     */
    public static SessionSummary of(Collection<Change> changes, int totalExtracted, int totalExisting) {
        int created = 0;
        int updated = 0;
        int deleted = 0;
        int unchanged = 0;
        int missing = 0;
        int exact = 0;
        int fuzzy = 0;
        for (Change change : changes) {
            switch (change.getChangeType()) {
                case CREATE -> created++;
                case UPDATE -> updated++;
                case DELETE -> deleted++;
                case UNCHANGED -> unchanged++;
                case MISSING_REFERENCE -> missing++;
            }
            if (change.getMatchMethod() == MatchMethod.EXACT) {
                exact++;
            } else if (change.getMatchMethod() == MatchMethod.FUZZY) {
                fuzzy++;
            }
        }
        return new SessionSummary(created, updated, deleted, unchanged, missing,
                totalExtracted, updated + unchanged, totalExisting, exact, fuzzy);
    }

    /**
     * Recomputes the per-type counts from {@code changes}, keeping the build inputs.
     */
    public SessionSummary recount(Collection<Change> changes) {
        return of(changes, totalExtracted, totalExisting);
    }

    public int countOf(ChangeType type) {
        return switch (type) {
            case CREATE -> totalNew;
            case UPDATE -> totalUpdated;
            case DELETE -> totalDeleted;
            case UNCHANGED -> totalUnchanged;
            case MISSING_REFERENCE -> totalMissingReferences;
        };
    }

    public int totalChanges() {
        return totalNew + totalUpdated + totalDeleted + totalUnchanged + totalMissingReferences;
    }
}
