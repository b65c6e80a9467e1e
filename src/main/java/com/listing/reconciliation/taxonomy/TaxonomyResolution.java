package com.listing.reconciliation.taxonomy;

import com.listing.reconciliation.core.model.MissingReference;
import com.listing.reconciliation.core.model.TaxonomyRefs;

import java.util.List;

/**
 * Outcome of resolving one listing's names. Exactly one of {@code refs} and {@code missing}
 * is non-null.
 *
 * @param refs                 resolved ids when make and model resolved
 * @param missing              the failed required lookup otherwise
 * @param unresolvedAttributes optional attributes that were present but did not resolve
 */
public record TaxonomyResolution(TaxonomyRefs refs, MissingReference missing, List<String> unresolvedAttributes) {

    public TaxonomyResolution {
        if ((refs == null) == (missing == null)) {
            throw new IllegalArgumentException("Exactly one of refs and missing must be set");
        }
        unresolvedAttributes = unresolvedAttributes != null ? List.copyOf(unresolvedAttributes) : List.of();
    }

    public static TaxonomyResolution resolved(TaxonomyRefs refs, List<String> unresolvedAttributes) {
        return new TaxonomyResolution(refs, null, unresolvedAttributes);
    }

    public static TaxonomyResolution missing(MissingReference missing) {
        return new TaxonomyResolution(null, missing, List.of());
    }

    public boolean isResolved() {
        return refs != null;
    }
}
