package com.listing.reconciliation.classify;

import com.listing.reconciliation.core.model.Candidate;
import com.listing.reconciliation.core.model.ExistingListing;
import com.listing.reconciliation.core.model.FieldChange;
import com.listing.reconciliation.core.model.ListingAttributes;
import com.listing.reconciliation.core.model.Offer;
import com.listing.reconciliation.core.model.OfferReplacement;
import com.listing.reconciliation.core.model.TrackedField;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Computes the field-level difference between a candidate and the listing it matched.
 *
 * <ul>
 *   <li>Text fields are trimmed and compared case-sensitively; a blank value counts as absent.</li>
 *   <li>Numbers are compared by exact value.</li>
 *   <li>A value on one side only is a change, in either direction.</li>
 *   <li>The monthly price falls back to the cheapest offer when the attribute is absent.</li>
 *   <li>Offers are compared as a whole set. Any difference yields a single replacement.
 *       A candidate without offers leaves the listing's offers alone.</li>
 * </ul>
 */
public class FieldDiffer {

    private final OfferNormalizer offerNormalizer;

    public FieldDiffer(OfferNormalizer offerNormalizer) {
        this.offerNormalizer = offerNormalizer;
    }

    public Diff diff(Candidate candidate, ExistingListing existing) {
        Map<String, FieldChange> changes = new LinkedHashMap<>();
        for (TrackedField field : TrackedField.values()) {
            Object oldValue = valueOf(field, existing.getAttributes(), existing.getOffers());
            Object newValue = valueOf(field, candidate.attributes(), candidate.offers());
            if (!Objects.equals(oldValue, newValue)) {
                changes.put(field.fieldName(), new FieldChange(oldValue, newValue));
            }
        }

        OfferReplacement replacement = null;
        if (!candidate.offers().isEmpty()
                && !offerNormalizer.sameOffers(existing.getOffers(), candidate.offers())) {
            replacement = new OfferReplacement(existing.getOffers(), offerNormalizer.normalize(candidate.offers()));
        }
        return new Diff(changes, replacement);
    }

    /**
     * Comparable value of a tracked field.
     */
    static Object valueOf(TrackedField field, ListingAttributes attributes, List<Offer> offers) {
        Object value = field.read(attributes);
        if (field == TrackedField.MONTHLY_PRICE && value == null) {
            return offers.stream().map(Offer::monthlyPrice).min(Integer::compare).orElse(null);
        }
        if (value instanceof String text) {
            String trimmed = text.trim();
            return trimmed.isEmpty() ? null : trimmed;
        }
        return value;
    }

    /**
     * @param fieldChanges      changed tracked fields, keyed by field name
     * @param offersReplacement offer replacement, or null when the offer sets agree
     */
    public record Diff(Map<String, FieldChange> fieldChanges, OfferReplacement offersReplacement) {

        public boolean isEmpty() {
            return fieldChanges.isEmpty() && offersReplacement == null;
        }
    }
}
