package com.listing.reconciliation.core.model;

import java.util.Objects;

/**
 * An existing listing no candidate matched. Only the listing's attributes are kept,
 * for display.
 */
public record DeletePayload(ListingAttributes existing, String reason) implements ChangePayload {

    public DeletePayload {
        Objects.requireNonNull(existing, "existing is required");
    }

    @Override
    public ChangeType type() {
        return ChangeType.DELETE;
    }

    @Override
    public Candidate extracted() {
        return null;
    }
}
