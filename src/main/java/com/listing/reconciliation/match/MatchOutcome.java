package com.listing.reconciliation.match;

import com.listing.reconciliation.core.model.ExistingListing;
import com.listing.reconciliation.core.model.MatchMethod;

/**
 * Result of matching one candidate: the matched listing, how it was found and how confident
 * the matcher is.
 */
public record MatchOutcome(ExistingListing listing, MatchMethod method, double confidence) {

    private static final MatchOutcome NONE = new MatchOutcome(null, MatchMethod.NONE, 0.0);

    public MatchOutcome {
        if (method == null) {
            throw new IllegalArgumentException("method is required");
        }
        if ((listing == null) != (method == MatchMethod.NONE)) {
            throw new IllegalArgumentException("A listing is required exactly when a match was found");
        }
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("confidence must be between 0.0 and 1.0");
        }
    }

    public static MatchOutcome exact(ExistingListing listing) {
        return new MatchOutcome(listing, MatchMethod.EXACT, 1.0);
    }

    public static MatchOutcome fuzzy(ExistingListing listing, double confidence) {
        return new MatchOutcome(listing, MatchMethod.FUZZY, confidence);
    }

    public static MatchOutcome none() {
        return NONE;
    }

    public boolean isMatched() {
        return listing != null;
    }
}
