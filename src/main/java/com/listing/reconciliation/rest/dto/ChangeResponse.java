package com.listing.reconciliation.rest.dto;

import com.listing.reconciliation.core.model.Candidate;
import com.listing.reconciliation.core.model.Change;
import com.listing.reconciliation.core.model.FieldChange;
import com.listing.reconciliation.core.model.OfferReplacement;
import com.listing.reconciliation.core.model.UpdatePayload;

import java.time.Instant;
import java.util.Locale;
import java.util.Map;

/**
 * REST response DTO for a change under review.
 */
public record ChangeResponse(
        String id,
        String sessionId,
        int position,
        String changeType,
        String status,
        String existingListingId,
        String matchMethod,
        double confidenceScore,
        String changeSummary,
        Candidate extractedData,
        Map<String, FieldChange> fieldChanges,
        OfferReplacement offersReplacement,
        String reviewNotes,
        String reviewedBy,
        Instant reviewedAt,
        Instant createdAt
) {
    public static ChangeResponse from(Change change) {
        OfferReplacement replacement = change.getPayload() instanceof UpdatePayload update
                ? update.offersReplacement() : null;
        return new ChangeResponse(
                change.getId(),
                change.getSessionId(),
                change.getPosition(),
                change.getChangeType().wireName(),
                change.getStatus().wireName(),
                change.getExistingListingId(),
                change.getMatchMethod().name().toLowerCase(Locale.ROOT),
                change.getConfidenceScore(),
                change.getChangeSummary(),
                change.getExtractedData(),
                change.getFieldChanges(),
                replacement,
                change.getReviewNotes(),
                change.getReviewedBy(),
                change.getReviewedAt(),
                change.getCreatedAt()
        );
    }
}
