package com.listing.reconciliation.taxonomy;

import java.util.Optional;

/**
 * Resolves make, model and attribute names to stable ids. Name matching is case-insensitive
 * and ignores surrounding whitespace.
 */
public interface TaxonomyLookup {

    Optional<String> resolveMake(String makeName);

    /**
     * Resolves a model name within a make.
     */
    Optional<String> resolveModel(String makeId, String modelName);

    /**
     * Resolves an unscoped attribute name (body type, fuel type or transmission).
     *
     * @throws IllegalArgumentException for {@link TaxonomyKind#MAKE} and {@link TaxonomyKind#MODEL}
     */
    Optional<String> resolveAttribute(TaxonomyKind kind, String name);

    /**
     * Creates a model under {@code makeId}, or returns the id of the existing model with that
     * name.
     *
     * @throws IllegalArgumentException if the make does not exist
     */
    String registerModel(String makeId, String modelName);

    /**
     * Forgets anything remembered about the models of {@code makeId}, so the next lookup sees
     * models created outside this lookup. Lookups that remember nothing ignore it.
     */
    default void invalidateModels(String makeId) {
    }
}
