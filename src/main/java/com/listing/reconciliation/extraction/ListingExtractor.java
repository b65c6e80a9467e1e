package com.listing.reconciliation.extraction;

/**
 * Source of extracted price-list records, such as a document extraction pipeline.
 * The engine only consumes its results.
 */
@FunctionalInterface
public interface ListingExtractor {

    /**
     * Extracts candidates from a raw document.
     *
     * @throws ExtractionException if the document cannot be read
     */
    ExtractionResult extract(byte[] document, String sellerId);
}
