package com.listing.reconciliation.taxonomy;

/**
 * Reference tables a listing's names are resolved against.
 */
public enum TaxonomyKind {
    MAKE("make"),
    MODEL("model"),
    BODY_TYPE("body_type"),
    FUEL_TYPE("fuel_type"),
    TRANSMISSION("transmission");

    private final String attributeName;

    TaxonomyKind(String attributeName) {
        this.attributeName = attributeName;
    }

    /**
     * Listing attribute the kind is resolved from.
     */
    public String attributeName() {
        return attributeName;
    }
}
