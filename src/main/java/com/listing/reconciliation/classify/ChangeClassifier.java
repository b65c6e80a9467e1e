package com.listing.reconciliation.classify;

import com.listing.reconciliation.api.ReconciliationOptions;
import com.listing.reconciliation.core.model.Candidate;
import com.listing.reconciliation.core.model.ChangePayload;
import com.listing.reconciliation.core.model.CreatePayload;
import com.listing.reconciliation.core.model.DeletePayload;
import com.listing.reconciliation.core.model.ExistingListing;
import com.listing.reconciliation.core.model.MatchMethod;
import com.listing.reconciliation.core.model.MissingReferencePayload;
import com.listing.reconciliation.core.model.UnchangedPayload;
import com.listing.reconciliation.core.model.UpdatePayload;
import com.listing.reconciliation.match.EntityMatcher;
import com.listing.reconciliation.match.MatchOutcome;
import com.listing.reconciliation.taxonomy.TaxonomyResolution;
import com.listing.reconciliation.taxonomy.TaxonomyResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executor;

/**
 * Turns the candidates of one price list and the seller's existing listings into a
 * {@link Changeset}.
 *
 * <ol>
 *   <li>Every candidate is matched independently, possibly in parallel.</li>
 *   <li>Matches are assigned in a single pass ordered by confidence (highest first), then
 *       by candidate position, so each listing is claimed by at most one candidate. Losing
 *       candidates are treated as unmatched and recorded as {@link MatchConflict}s.</li>
 *   <li>Matched candidates become {@code update} or {@code unchanged} depending on the field
 *       diff. Unmatched candidates become {@code create} when make and model resolve against
 *       the taxonomy, {@code missing_reference} otherwise.</li>
 *   <li>Every listing no candidate claimed becomes {@code delete}.</li>
 * </ol>
 *
 * <p>Classification is deterministic: the same inputs always produce an equal changeset.</p>
 */
public class ChangeClassifier {
    private static final Logger log = LoggerFactory.getLogger(ChangeClassifier.class);

    static final String DELETE_REASON = "Not present in extracted price list";

    private final EntityMatcher matcher;
    private final FieldDiffer fieldDiffer;
    private final TaxonomyResolver taxonomyResolver;
    private final Executor executor;

    public ChangeClassifier(EntityMatcher matcher, TaxonomyResolver taxonomyResolver,
                            ReconciliationOptions options) {
        this(matcher, new FieldDiffer(new OfferNormalizer(options.getDefaultPeriodMonths(),
                options.getDefaultMileagePerYear())), taxonomyResolver, null);
    }

    public ChangeClassifier(EntityMatcher matcher, FieldDiffer fieldDiffer,
                            TaxonomyResolver taxonomyResolver, Executor executor) {
        this.matcher = matcher;
        this.fieldDiffer = fieldDiffer;
        this.taxonomyResolver = taxonomyResolver;
        this.executor = executor;
    }

    public Changeset classify(List<Candidate> candidates, List<ExistingListing> existing) {
        List<MatchOutcome> outcomes = new ArrayList<>(matcher.matchAll(candidates, existing, executor));
        List<MatchConflict> conflicts = assignExclusively(outcomes);

        List<ProposedChange> changes = new ArrayList<>(candidates.size() + existing.size());
        Map<String, Boolean> claimed = new HashMap<>();
        for (int i = 0; i < candidates.size(); i++) {
            MatchOutcome outcome = outcomes.get(i);
            if (outcome.isMatched()) {
                claimed.put(outcome.listing().getId(), Boolean.TRUE);
                changes.add(classifyMatched(i, candidates.get(i), outcome));
            } else {
                changes.add(classifyUnmatched(i, candidates.get(i)));
            }
        }

        for (int j = 0; j < existing.size(); j++) {
            ExistingListing listing = existing.get(j);
            if (!claimed.containsKey(listing.getId())) {
                DeletePayload payload = new DeletePayload(listing.getAttributes(), DELETE_REASON);
                changes.add(new ProposedChange(candidates.size() + j, payload, listing.getId(),
                        MatchMethod.NONE, 0.0, ChangeSummaries.describe(payload)));
            }
        }

        Changeset changeset = new Changeset(changes, conflicts, candidates.size(), existing.size());
        log.debug("Classified {} candidates against {} listings: {} changes, {} conflicts",
                candidates.size(), existing.size(), changes.size(), conflicts.size());
        return changeset;
    }

    /**
     * Demotes all but the best claim on each listing to "no match", in place.
     */
    List<MatchConflict> assignExclusively(List<MatchOutcome> outcomes) {
        List<Integer> order = new ArrayList<>();
        for (int i = 0; i < outcomes.size(); i++) {
            if (outcomes.get(i).isMatched()) {
                order.add(i);
            }
        }
        order.sort(Comparator.<Integer>comparingDouble(i -> outcomes.get(i).confidence()).reversed()
                .thenComparingInt(i -> i));

        Map<String, Integer> winners = new HashMap<>();
        List<MatchConflict> conflicts = new ArrayList<>();
        for (int i : order) {
            MatchOutcome outcome = outcomes.get(i);
            String listingId = outcome.listing().getId();
            Integer winner = winners.putIfAbsent(listingId, i);
            if (winner != null) {
                MatchConflict conflict = new MatchConflict(listingId, winner,
                        outcomes.get(winner).confidence(), i, outcome.confidence());
                conflicts.add(conflict);
                outcomes.set(i, MatchOutcome.none());
                log.warn("match.conflict listingId={} winnerPosition={} winnerConfidence={} "
                                + "loserPosition={} loserConfidence={}",
                        listingId, conflict.winnerPosition(), conflict.winnerConfidence(),
                        conflict.loserPosition(), conflict.loserConfidence());
            }
        }
        conflicts.sort(Comparator.comparingInt(MatchConflict::loserPosition));
        return conflicts;
    }

    private ProposedChange classifyMatched(int position, Candidate candidate, MatchOutcome outcome) {
        FieldDiffer.Diff diff = fieldDiffer.diff(candidate, outcome.listing());
        ChangePayload payload = diff.isEmpty()
                ? new UnchangedPayload(candidate)
                : new UpdatePayload(candidate, diff.fieldChanges(), diff.offersReplacement());
        return new ProposedChange(position, payload, outcome.listing().getId(), outcome.method(),
                outcome.confidence(), ChangeSummaries.describe(payload));
    }

    private ProposedChange classifyUnmatched(int position, Candidate candidate) {
        TaxonomyResolution resolution = taxonomyResolver.resolve(candidate.attributes());
        ChangePayload payload = resolution.isResolved()
                ? new CreatePayload(candidate, resolution.refs(), resolution.unresolvedAttributes())
                : new MissingReferencePayload(candidate, resolution.missing());
        return new ProposedChange(position, payload, null, MatchMethod.NONE, 0.0, ChangeSummaries.describe(payload));
    }

    /**
     * Re-resolves a candidate after the taxonomy changed.
     */
    public TaxonomyResolution resolve(Candidate candidate) {
        return taxonomyResolver.resolve(candidate.attributes());
    }
}
