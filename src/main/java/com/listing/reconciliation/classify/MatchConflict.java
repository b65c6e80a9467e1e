package com.listing.reconciliation.classify;

/**
 * Two candidates matched the same existing listing. The winner keeps the match; the loser is
 * classified as if it had matched nothing.
 */
public record MatchConflict(
        String existingListingId,
        int winnerPosition,
        double winnerConfidence,
        int loserPosition,
        double loserConfidence
) {
}
