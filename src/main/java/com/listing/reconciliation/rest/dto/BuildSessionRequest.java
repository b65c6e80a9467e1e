package com.listing.reconciliation.rest.dto;

import com.listing.reconciliation.core.model.Candidate;
import com.listing.reconciliation.core.model.ExtractionMetadata;

import java.util.List;

/**
 * Request DTO for building a comparison session from extracted candidates.
 *
 * @param extractionType {@code create} or {@code update}; defaults to {@code update}
 */
public record BuildSessionRequest(
        String sellerId,
        String sessionName,
        String extractionType,
        List<Candidate> candidates,
        ExtractionMetadata extractionMetadata
) {
    public BuildSessionRequest {
        if (sellerId == null || sellerId.isBlank()) {
            throw new IllegalArgumentException("sellerId is required");
        }
        if (sessionName == null || sessionName.isBlank()) {
            throw new IllegalArgumentException("sessionName is required");
        }
        candidates = candidates != null ? List.copyOf(candidates) : List.of();
    }
}
