package com.listing.reconciliation.apply;

import java.util.List;

/**
 * Partial-success report of one {@code applySelected} call.
 *
 * @param sessionId         the session
 * @param appliedCount      selected changes committed to the store
 * @param appliedCreates    of which creates
 * @param appliedUpdates    of which updates
 * @param appliedDeletes    of which deletes
 * @param discardedCount    unselected changes moved to discarded
 * @param totalProcessed    distinct ids in the selection
 * @param appliedChangeIds  ids of the committed changes
 * @param failures          selected changes that were skipped or failed
 * @param cancelled         true if the call was interrupted; remaining selected changes were
 *                          not attempted and nothing was discarded
 */
public record ApplyResult(
        String sessionId,
        int appliedCount,
        int appliedCreates,
        int appliedUpdates,
        int appliedDeletes,
        int discardedCount,
        int totalProcessed,
        List<String> appliedChangeIds,
        List<ApplyFailure> failures,
        boolean cancelled
) {
    public ApplyResult {
        appliedChangeIds = List.copyOf(appliedChangeIds);
        failures = List.copyOf(failures);
    }

    public boolean hasFailures() {
        return !failures.isEmpty();
    }
}
