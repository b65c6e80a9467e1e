package com.listing.reconciliation.rules;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Canonical form of identity strings used for matching: case-folded, trimmed, with runs of
 * whitespace collapsed to a single space.
 */
public final class KeyNormalizer {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private KeyNormalizer() {
    }

    /**
     * Normalizes a single value. Null and blank values normalize to the empty string.
     */
    public static String normalize(String value) {
        if (value == null || value.isBlank()) {
            return "";
        }
        return WHITESPACE.matcher(value.trim().toLowerCase(Locale.ROOT)).replaceAll(" ");
    }

    /**
     * Builds the exact-match key {@code make|model|variant}.
     */
    public static String exactKey(String make, String model, String variant) {
        return normalize(make) + "|" + normalize(model) + "|" + normalize(variant);
    }

    /**
     * Builds the {@code make|model} key that scopes fuzzy matching.
     */
    public static String makeModelKey(String make, String model) {
        return normalize(make) + "|" + normalize(model);
    }

    /**
     * Returns true if both values are equal after normalization.
     */
    public static boolean equivalent(String a, String b) {
        return normalize(a).equals(normalize(b));
    }
}
