package com.listing.reconciliation.core.model;

import java.util.Objects;

/**
 * Describes the taxonomy entry a candidate needs but that does not exist yet.
 *
 * @param kind      which lookup failed
 * @param rawMake   make as extracted
 * @param rawModel  model as extracted
 * @param rawVariant variant as extracted, for display
 * @param makeId    resolved make id, null when {@code kind == MAKE}
 */
public record MissingReference(
        MissingReferenceKind kind,
        String rawMake,
        String rawModel,
        String rawVariant,
        String makeId
) {
    public MissingReference {
        Objects.requireNonNull(kind, "kind is required");
    }

    /**
     * Returns true if registering {@code modelName} under {@code makeId} satisfies this reference.
     */
    public boolean isSatisfiedBy(String makeId, String modelName) {
        if (kind != MissingReferenceKind.MODEL || this.makeId == null || rawModel == null || modelName == null) {
            return false;
        }
        return this.makeId.equals(makeId) && rawModel.trim().equalsIgnoreCase(modelName.trim());
    }
}
