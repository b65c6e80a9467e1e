package com.listing.reconciliation.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Field-level diff of a matched listing. {@code fieldChanges} is keyed by tracked field name
 * in {@link TrackedField} order; {@code offersReplacement} is null when the offer sets are equal.
 */
public record UpdatePayload(Candidate extracted, Map<String, FieldChange> fieldChanges,
                            OfferReplacement offersReplacement) implements ChangePayload {

    public UpdatePayload {
        Objects.requireNonNull(extracted, "extracted is required");
        fieldChanges = fieldChanges != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(fieldChanges))
                : Map.of();
        if (fieldChanges.isEmpty() && offersReplacement == null) {
            throw new IllegalArgumentException("An update must change at least one field or the offer set");
        }
    }

    @Override
    public ChangeType type() {
        return ChangeType.UPDATE;
    }

    /**
     * Names of every changed field, including the synthetic {@code offers_replacement} entry.
     */
    public List<String> changedFieldNames() {
        List<String> names = new ArrayList<>(fieldChanges.keySet());
        if (offersReplacement != null) {
            names.add(TrackedField.OFFERS_REPLACEMENT);
        }
        return names;
    }
}
