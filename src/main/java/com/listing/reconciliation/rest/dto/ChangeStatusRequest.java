package com.listing.reconciliation.rest.dto;

/**
 * Request DTO for approving, rejecting or discarding a change.
 *
 * @param status     target status wire name, e.g. {@code approved}
 * @param reviewerId optional; the configured default reviewer is used when absent
 */
public record ChangeStatusRequest(
        String status,
        String reviewerId,
        String notes
) {
    public ChangeStatusRequest {
        if (status == null || status.isBlank()) {
            throw new IllegalArgumentException("status is required");
        }
    }
}
