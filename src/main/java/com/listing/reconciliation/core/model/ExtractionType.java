package com.listing.reconciliation.core.model;

/**
 * Whether a price list was extracted for a first import or for updating an existing catalogue.
 */
public enum ExtractionType {
    CREATE,
    UPDATE
}
