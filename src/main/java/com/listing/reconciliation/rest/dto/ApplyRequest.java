package com.listing.reconciliation.rest.dto;

import java.util.List;

/**
 * Request DTO for applying the selected changes of a session.
 */
public record ApplyRequest(
        List<String> changeIds,
        String appliedBy
) {
    public ApplyRequest {
        changeIds = changeIds != null ? List.copyOf(changeIds) : List.of();
    }
}
