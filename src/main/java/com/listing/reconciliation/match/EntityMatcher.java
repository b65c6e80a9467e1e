package com.listing.reconciliation.match;

import com.listing.reconciliation.api.ReconciliationOptions;
import com.listing.reconciliation.core.model.Candidate;
import com.listing.reconciliation.core.model.ExistingListing;
import com.listing.reconciliation.core.model.ListingAttributes;
import com.listing.reconciliation.rules.KeyNormalizer;
import com.listing.reconciliation.rules.VariantSpecExtractor;
import com.listing.reconciliation.similarity.VariantSimilarityScorer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Finds the existing listing a candidate describes.
 *
 * <p>Strategies are tried in order and the first hit wins:</p>
 * <ol>
 *   <li><b>Exact</b>: exactly one listing has the same normalized make, model and variant.
 *       Confidence 1.0.</li>
 *   <li><b>Fuzzy</b>: among listings with the same normalized make and model, the one whose
 *       variant scores highest, if the score reaches the confidence floor. A listing with the
 *       same composite key (core variant plus horsepower, transmission and drive) scores at
 *       least the composite-key confidence. Ties go to the most recently updated listing,
 *       then to the earlier listing.</li>
 *   <li><b>None</b>.</li>
 * </ol>
 *
 * <p>Matching is pure and may run concurrently for different candidates. It does not enforce
 * that a listing is claimed by at most one candidate; that is the classifier's job.</p>
 */
public class EntityMatcher {
    private static final Logger log = LoggerFactory.getLogger(EntityMatcher.class);

    private final VariantSpecExtractor specExtractor;
    private final VariantSimilarityScorer scorer;
    private final ReconciliationOptions options;

    public EntityMatcher(ReconciliationOptions options) {
        this(new VariantSpecExtractor(), options);
    }

    public EntityMatcher(VariantSpecExtractor specExtractor, ReconciliationOptions options) {
        this(specExtractor, new VariantSimilarityScorer(specExtractor, options.getHorsepowerTolerance()), options);
    }

    public EntityMatcher(VariantSpecExtractor specExtractor, VariantSimilarityScorer scorer,
                         ReconciliationOptions options) {
        this.specExtractor = specExtractor;
        this.scorer = scorer;
        this.options = options;
    }

    /**
     * Matches one candidate against the seller's listings.
     */
    public MatchOutcome match(Candidate candidate, List<ExistingListing> existing) {
        return match(candidate, index(existing));
    }

    /**
     * Matches every candidate, preserving candidate order in the result. When an executor is
     * given and parallel matching is enabled, candidates are matched concurrently.
     */
    public List<MatchOutcome> matchAll(List<Candidate> candidates, List<ExistingListing> existing,
                                       Executor executor) {
        Map<String, List<ExistingListing>> index = index(existing);
        if (executor == null || !options.isParallelMatching() || candidates.size() < 2) {
            List<MatchOutcome> outcomes = new ArrayList<>(candidates.size());
            for (Candidate candidate : candidates) {
                outcomes.add(match(candidate, index));
            }
            return outcomes;
        }

        List<CompletableFuture<MatchOutcome>> futures = new ArrayList<>(candidates.size());
        for (Candidate candidate : candidates) {
            futures.add(CompletableFuture.supplyAsync(() -> match(candidate, index), executor));
        }
        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
        return futures.stream().map(CompletableFuture::join).toList();
    }

    private MatchOutcome match(Candidate candidate, Map<String, List<ExistingListing>> index) {
        ListingAttributes attrs = candidate.attributes();
        List<ExistingListing> pool = index.getOrDefault(
                KeyNormalizer.makeModelKey(attrs.make(), attrs.model()), Collections.emptyList());
        if (pool.isEmpty()) {
            log.debug("No listings share make/model with {}", candidate.displayName());
            return MatchOutcome.none();
        }

        String exactKey = KeyNormalizer.exactKey(attrs.make(), attrs.model(), attrs.variant());
        List<ExistingListing> exactHits = pool.stream()
                .filter(listing -> exactKey.equals(exactKeyOf(listing)))
                .toList();
        if (exactHits.size() == 1) {
            return MatchOutcome.exact(exactHits.get(0));
        }
        if (exactHits.size() > 1) {
            log.debug("{} listings share the exact key of {}, falling back to fuzzy matching",
                    exactHits.size(), candidate.displayName());
        }

        return fuzzyMatch(candidate, pool);
    }

    private MatchOutcome fuzzyMatch(Candidate candidate, List<ExistingListing> pool) {
        ListingAttributes attrs = candidate.attributes();
        String compositeKey = specExtractor.compositeKey(attrs.make(), attrs.model(), attrs.variant(),
                attrs.horsepower(), attrs.transmission());

        ExistingListing best = null;
        double bestScore = -1.0;
        for (ExistingListing listing : pool) {
            double score = scorer.score(attrs, listing.getAttributes());
            ListingAttributes other = listing.getAttributes();
            if (compositeKey.equals(specExtractor.compositeKey(other.make(), other.model(), other.variant(),
                    other.horsepower(), other.transmission()))) {
                score = Math.max(score, options.getCompositeKeyConfidence());
            }
            score = Math.min(score, 1.0);

            if (score > bestScore
                    || (score == bestScore && listing.getUpdatedAt().isAfter(best.getUpdatedAt()))) {
                best = listing;
                bestScore = score;
            }
        }

        if (best != null && bestScore >= options.getFuzzyConfidenceFloor()) {
            log.debug("Fuzzy match {} -> {} (score={})", candidate.displayName(), best.getId(), bestScore);
            return MatchOutcome.fuzzy(best, bestScore);
        }
        log.debug("Best fuzzy score {} for {} is below the floor {}",
                bestScore, candidate.displayName(), options.getFuzzyConfidenceFloor());
        return MatchOutcome.none();
    }

    private static Map<String, List<ExistingListing>> index(List<ExistingListing> existing) {
        Map<String, List<ExistingListing>> index = new LinkedHashMap<>();
        for (ExistingListing listing : existing) {
            ListingAttributes attrs = listing.getAttributes();
            index.computeIfAbsent(KeyNormalizer.makeModelKey(attrs.make(), attrs.model()), k -> new ArrayList<>())
                    .add(listing);
        }
        return index;
    }

    private static String exactKeyOf(ExistingListing listing) {
        ListingAttributes attrs = listing.getAttributes();
        return KeyNormalizer.exactKey(attrs.make(), attrs.model(), attrs.variant());
    }
}
