package com.listing.reconciliation.similarity;

import com.listing.reconciliation.core.model.ListingAttributes;
import com.listing.reconciliation.rules.VariantSpecExtractor;
import com.listing.reconciliation.rules.VariantSpecs;

import java.util.List;

/**
 * Scores how likely two listings of the same make and model describe the same variant.
 *
 * <p>The base score is the best of the configured string algorithms on the core variants.
 * It is then reduced when the listings disagree on specs that separate trims in practice:</p>
 * <ul>
 *   <li>horsepower differing by more than the tolerance: x{@value #HORSEPOWER_PENALTY}</li>
 *   <li>conflicting transmission: x{@value #TRANSMISSION_PENALTY}</li>
 *   <li>one side all-wheel drive, the other not: x{@value #AWD_PENALTY}</li>
 * </ul>
 * Missing specs never penalize.
 */
public class VariantSimilarityScorer {

    static final double HORSEPOWER_PENALTY = 0.5;
    static final double TRANSMISSION_PENALTY = 0.6;
    static final double AWD_PENALTY = 0.8;

    private final VariantSpecExtractor extractor;
    private final List<SimilarityAlgorithm> algorithms;
    private final int horsepowerTolerance;

    public VariantSimilarityScorer(VariantSpecExtractor extractor, int horsepowerTolerance) {
        this(extractor, List.of(new JaccardSimilarity(), new LevenshteinSimilarity()), horsepowerTolerance);
    }

    public VariantSimilarityScorer(VariantSpecExtractor extractor, List<SimilarityAlgorithm> algorithms,
                                   int horsepowerTolerance) {
        if (algorithms == null || algorithms.isEmpty()) {
            throw new IllegalArgumentException("At least one similarity algorithm is required");
        }
        this.extractor = extractor;
        this.algorithms = List.copyOf(algorithms);
        this.horsepowerTolerance = horsepowerTolerance;
    }

    public double score(ListingAttributes candidate, ListingAttributes existing) {
        VariantSpecs left = extractor.extract(candidate.variant());
        VariantSpecs right = extractor.extract(existing.variant());

        double score = coreSimilarity(left.coreVariant(), right.coreVariant());

        Integer leftHp = candidate.horsepower() != null ? candidate.horsepower() : left.horsepower();
        Integer rightHp = existing.horsepower() != null ? existing.horsepower() : right.horsepower();
        if (leftHp != null && rightHp != null && Math.abs(leftHp - rightHp) > horsepowerTolerance) {
            score *= HORSEPOWER_PENALTY;
        }

        String leftTrans = transmissionOf(candidate, left);
        String rightTrans = transmissionOf(existing, right);
        if (leftTrans != null && rightTrans != null && !leftTrans.equals(rightTrans)) {
            score *= TRANSMISSION_PENALTY;
        }

        if (left.awd() != right.awd()) {
            score *= AWD_PENALTY;
        }
        return score;
    }

    double coreSimilarity(String left, String right) {
        if (left.isEmpty() && right.isEmpty()) {
            return 1.0;
        }
        double best = 0.0;
        for (SimilarityAlgorithm algorithm : algorithms) {
            best = Math.max(best, algorithm.compute(left, right));
        }
        return best;
    }

    private static String transmissionOf(ListingAttributes attributes, VariantSpecs specs) {
        String explicit = VariantSpecExtractor.canonicalTransmission(attributes.transmission());
        return explicit != null ? explicit : specs.transmission();
    }
}
