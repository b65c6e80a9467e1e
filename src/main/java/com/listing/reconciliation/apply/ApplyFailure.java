package com.listing.reconciliation.apply;

import com.listing.reconciliation.core.model.ChangeType;

/**
 * A selected change that was not applied.
 *
 * @param changeId   the selected id
 * @param changeType type of the change, null when the id is unknown
 * @param listingId  listing the change targets, if any
 * @param message    why it was not applied
 */
public record ApplyFailure(String changeId, ChangeType changeType, String listingId, String message) {
}
