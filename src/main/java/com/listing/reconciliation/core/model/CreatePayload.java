package com.listing.reconciliation.core.model;

import java.util.List;
import java.util.Objects;

/**
 * A new listing to insert. {@code unresolvedAttributes} names optional taxonomy attributes
 * (body type, fuel type, transmission) whose value could not be resolved to an id.
 */
public record CreatePayload(Candidate extracted, TaxonomyRefs refs, List<String> unresolvedAttributes)
        implements ChangePayload {

    public CreatePayload {
        Objects.requireNonNull(extracted, "extracted is required");
        Objects.requireNonNull(refs, "refs is required");
        unresolvedAttributes = unresolvedAttributes != null ? List.copyOf(unresolvedAttributes) : List.of();
    }

    @Override
    public ChangeType type() {
        return ChangeType.CREATE;
    }
}
