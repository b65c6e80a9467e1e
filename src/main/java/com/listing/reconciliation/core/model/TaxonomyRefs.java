package com.listing.reconciliation.core.model;

/**
 * Stable taxonomy ids resolved for a listing. Make and model are always present on a
 * persisted listing; the remaining references are null when the name could not be resolved.
 */
public record TaxonomyRefs(
        String makeId,
        String modelId,
        String bodyTypeId,
        String fuelTypeId,
        String transmissionId
) {

    /**
     * Returns a copy where every null reference is filled from {@code fallback}.
     */
    public TaxonomyRefs orElse(TaxonomyRefs fallback) {
        if (fallback == null) {
            return this;
        }
        return new TaxonomyRefs(
                makeId != null ? makeId : fallback.makeId,
                modelId != null ? modelId : fallback.modelId,
                bodyTypeId != null ? bodyTypeId : fallback.bodyTypeId,
                fuelTypeId != null ? fuelTypeId : fallback.fuelTypeId,
                transmissionId != null ? transmissionId : fallback.transmissionId);
    }
}
