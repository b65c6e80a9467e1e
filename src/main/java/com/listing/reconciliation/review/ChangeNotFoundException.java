package com.listing.reconciliation.review;

public class ChangeNotFoundException extends RuntimeException {

    private final String changeId;

    public ChangeNotFoundException(String changeId) {
        super("Change not found: " + changeId);
        this.changeId = changeId;
    }

    public String getChangeId() {
        return changeId;
    }
}
