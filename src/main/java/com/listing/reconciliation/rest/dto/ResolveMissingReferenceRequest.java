package com.listing.reconciliation.rest.dto;

/**
 * Request DTO for re-classifying missing-reference changes after a model was added.
 *
 * @param register when true the model is registered in the taxonomy first
 */
public record ResolveMissingReferenceRequest(
        String makeId,
        String modelName,
        boolean register
) {
    public ResolveMissingReferenceRequest {
        if (makeId == null || makeId.isBlank()) {
            throw new IllegalArgumentException("makeId is required");
        }
        if (modelName == null || modelName.isBlank()) {
            throw new IllegalArgumentException("modelName is required");
        }
    }
}
