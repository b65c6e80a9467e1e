package com.listing.reconciliation.classify;

import com.listing.reconciliation.core.model.ChangePayload;
import com.listing.reconciliation.core.model.ChangeType;
import com.listing.reconciliation.core.model.MatchMethod;

import java.util.Objects;

/**
 * A classified change before it is persisted in a session.
 *
 * @param position          candidate extraction order; deletes follow all candidates
 * @param payload           type-specific content
 * @param existingListingId matched or deleted listing, null for creates and missing references
 * @param matchMethod       how the listing was matched
 * @param confidence        match confidence, 0.0 when unmatched
 * @param summary           one-line description for reviewers
 */
public record ProposedChange(
        int position,
        ChangePayload payload,
        String existingListingId,
        MatchMethod matchMethod,
        double confidence,
        String summary
) {
    public ProposedChange {
        Objects.requireNonNull(payload, "payload is required");
        Objects.requireNonNull(matchMethod, "matchMethod is required");
    }

    public ChangeType type() {
        return payload.type();
    }
}
