package com.listing.reconciliation.core.model;

/**
 * Required taxonomy lookup that failed for a candidate.
 */
public enum MissingReferenceKind {
    MAKE,
    MODEL
}
