package com.listing.reconciliation.similarity;

/**
 * A string similarity measure returning a score between 0.0 (unrelated) and 1.0 (identical).
 */
public interface SimilarityAlgorithm {

    double compute(String s1, String s2);

    String getName();
}
