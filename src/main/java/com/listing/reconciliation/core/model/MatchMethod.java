package com.listing.reconciliation.core.model;

/**
 * How a candidate was matched to an existing listing.
 */
public enum MatchMethod {
    /** Normalized make, model and variant are identical. */
    EXACT,
    /** Same make and model, variant accepted by similarity scoring. */
    FUZZY,
    /** No existing listing was matched. */
    NONE
}
