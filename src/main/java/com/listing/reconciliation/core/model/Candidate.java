package com.listing.reconciliation.core.model;

import java.util.List;
import java.util.Objects;

/**
 * A listing as produced by the external extractor. Candidates have no persistent identity;
 * they live for the duration of one comparison pass and are snapshotted into the changes
 * they produce.
 */
public record Candidate(ListingAttributes attributes, List<Offer> offers) {

    public Candidate {
        Objects.requireNonNull(attributes, "attributes is required");
        offers = offers != null ? List.copyOf(offers) : List.of();
    }

    public static Candidate of(ListingAttributes attributes) {
        return new Candidate(attributes, List.of());
    }

    public String make() {
        return attributes.make();
    }

    public String model() {
        return attributes.model();
    }

    public String variant() {
        return attributes.variant();
    }

    public String displayName() {
        return attributes.displayName();
    }
}
