package com.listing.reconciliation.core.model;

import java.util.Objects;

public record UnchangedPayload(Candidate extracted) implements ChangePayload {

    public UnchangedPayload {
        Objects.requireNonNull(extracted, "extracted is required");
    }

    @Override
    public ChangeType type() {
        return ChangeType.UNCHANGED;
    }
}
