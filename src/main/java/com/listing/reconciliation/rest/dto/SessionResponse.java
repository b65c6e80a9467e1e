package com.listing.reconciliation.rest.dto;

import com.listing.reconciliation.core.model.ComparisonSession;
import com.listing.reconciliation.core.model.ExtractionMetadata;
import com.listing.reconciliation.core.model.SessionSummary;

import java.time.Instant;
import java.util.Locale;

/**
 * REST response DTO for a comparison session.
 */
public record SessionResponse(
        String id,
        String sessionName,
        String sellerId,
        String extractionType,
        String status,
        SessionSummary summary,
        ExtractionMetadata extractionMetadata,
        String failureReason,
        Instant createdAt,
        Instant appliedAt
) {
    public static SessionResponse from(ComparisonSession session) {
        return new SessionResponse(
                session.getId(),
                session.getSessionName(),
                session.getSellerId(),
                session.getExtractionType().name().toLowerCase(Locale.ROOT),
                session.getStatus().name().toLowerCase(Locale.ROOT),
                session.getSummary(),
                session.getExtractionMetadata(),
                session.getFailureReason(),
                session.getCreatedAt(),
                session.getAppliedAt()
        );
    }
}
