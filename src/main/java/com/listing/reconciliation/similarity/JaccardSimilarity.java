package com.listing.reconciliation.similarity;

import java.util.HashSet;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Token overlap: {@code |A ∩ B| / |A ∪ B|} over whitespace-separated, lower-cased tokens.
 */
public class JaccardSimilarity implements SimilarityAlgorithm {

    private static final Pattern SEPARATOR = Pattern.compile("\\s+");

    @Override
    public double compute(String s1, String s2) {
        if (s1 == null || s2 == null) {
            return 0.0;
        }
        if (s1.equals(s2)) {
            return 1.0;
        }
        Set<String> left = tokenize(s1);
        Set<String> right = tokenize(s2);
        if (left.isEmpty() || right.isEmpty()) {
            return left.isEmpty() && right.isEmpty() ? 1.0 : 0.0;
        }

        int shared = 0;
        for (String token : left) {
            if (right.contains(token)) {
                shared++;
            }
        }
        return (double) shared / (left.size() + right.size() - shared);
    }

    @Override
    public String getName() {
        return "Jaccard";
    }

    private Set<String> tokenize(String s) {
        Set<String> tokens = new HashSet<>();
        for (String token : SEPARATOR.split(s.toLowerCase(Locale.ROOT))) {
            if (!token.isBlank()) {
                tokens.add(token);
            }
        }
        return tokens;
    }
}
