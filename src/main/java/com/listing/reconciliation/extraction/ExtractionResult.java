package com.listing.reconciliation.extraction;

import com.listing.reconciliation.core.model.Candidate;
import com.listing.reconciliation.core.model.ExtractionMetadata;
import com.listing.reconciliation.core.model.ExtractionType;

import java.util.List;

/**
 * Candidates produced by one extraction run, with what the run cost.
 */
public record ExtractionResult(List<Candidate> candidates, ExtractionType extractionType,
                               ExtractionMetadata metadata) {

    public ExtractionResult {
        candidates = candidates != null ? List.copyOf(candidates) : List.of();
        extractionType = extractionType != null ? extractionType : ExtractionType.UPDATE;
        metadata = metadata != null ? metadata : ExtractionMetadata.none();
    }

    public static ExtractionResult of(List<Candidate> candidates) {
        return new ExtractionResult(candidates, ExtractionType.UPDATE, ExtractionMetadata.none());
    }
}
