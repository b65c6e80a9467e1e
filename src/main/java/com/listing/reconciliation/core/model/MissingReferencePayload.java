package com.listing.reconciliation.core.model;

import java.util.Objects;

public record MissingReferencePayload(Candidate extracted, MissingReference missing) implements ChangePayload {

    public MissingReferencePayload {
        Objects.requireNonNull(extracted, "extracted is required");
        Objects.requireNonNull(missing, "missing is required");
    }

    @Override
    public ChangeType type() {
        return ChangeType.MISSING_REFERENCE;
    }
}
