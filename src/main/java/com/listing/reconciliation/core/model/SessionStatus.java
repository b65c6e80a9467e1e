package com.listing.reconciliation.core.model;

/**
 * Build status of a comparison session.
 */
public enum SessionStatus {
    PROCESSING,
    COMPLETED,
    FAILED
}
