package com.listing.reconciliation.rest.dto;

import java.util.List;

public record MarkForDeletionRequest(
        List<String> listingIds,
        String reason
) {
    public MarkForDeletionRequest {
        if (listingIds == null || listingIds.isEmpty()) {
            throw new IllegalArgumentException("listingIds is required");
        }
        listingIds = List.copyOf(listingIds);
    }
}
