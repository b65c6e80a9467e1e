package com.listing.reconciliation.rules;

/**
 * Technical specs parsed out of a free-text variant name.
 *
 * @param coreVariant  the variant with specs, fuel markers and engine codes removed, normalized
 * @param horsepower   horsepower mentioned in the variant, or null
 * @param transmission {@code automatic}, {@code manual}, or null when not mentioned
 * @param awd          true if the variant names an all-wheel-drive system
 */
public record VariantSpecs(String coreVariant, Integer horsepower, String transmission, boolean awd) {

    public VariantSpecs {
        coreVariant = coreVariant != null ? coreVariant : "";
    }
}
