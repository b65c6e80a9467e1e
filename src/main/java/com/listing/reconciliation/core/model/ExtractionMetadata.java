package com.listing.reconciliation.core.model;

/**
 * Cost and timing reported by the extractor for the price list a session was built from.
 *
 * @param extractorName    name of the extractor or model that produced the candidates
 * @param cost             extraction cost in USD, null when unknown
 * @param tokensUsed       tokens consumed, null when unknown
 * @param processingTimeMs wall-clock extraction time, null when unknown
 */
public record ExtractionMetadata(String extractorName, Double cost, Integer tokensUsed, Long processingTimeMs) {

    public ExtractionMetadata {
        if (cost != null && cost < 0) {
            throw new IllegalArgumentException("cost must be >= 0");
        }
        if (tokensUsed != null && tokensUsed < 0) {
            throw new IllegalArgumentException("tokensUsed must be >= 0");
        }
        if (processingTimeMs != null && processingTimeMs < 0) {
            throw new IllegalArgumentException("processingTimeMs must be >= 0");
        }
    }

    public static ExtractionMetadata none() {
        return new ExtractionMetadata(null, null, null, null);
    }
}
