package com.listing.reconciliation.taxonomy;

import com.listing.reconciliation.core.model.ListingAttributes;
import com.listing.reconciliation.core.model.MissingReference;
import com.listing.reconciliation.core.model.MissingReferenceKind;
import com.listing.reconciliation.core.model.TaxonomyRefs;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Resolves a listing's names against the taxonomy.
 *
 * <p>Make and model are required: a blank or unknown make, or a model unknown under the
 * resolved make, yields a {@link MissingReference}. Body type, fuel type and transmission are
 * optional; when present but unknown they are reported in
 * {@link TaxonomyResolution#unresolvedAttributes()} and their id is left null.</p>
 */
public class TaxonomyResolver {
    private static final Logger log = LoggerFactory.getLogger(TaxonomyResolver.class);

    private final TaxonomyLookup lookup;

    public TaxonomyResolver(TaxonomyLookup lookup) {
        this.lookup = Objects.requireNonNull(lookup, "lookup is required");
    }

    public TaxonomyResolution resolve(ListingAttributes attributes) {
        Optional<String> makeId = isBlank(attributes.make())
                ? Optional.empty()
                : lookup.resolveMake(attributes.make());
        if (makeId.isEmpty()) {
            log.debug("Make '{}' not found for {}", attributes.make(), attributes.displayName());
            return TaxonomyResolution.missing(new MissingReference(MissingReferenceKind.MAKE,
                    attributes.make(), attributes.model(), attributes.variant(), null));
        }

        Optional<String> modelId = isBlank(attributes.model())
                ? Optional.empty()
                : lookup.resolveModel(makeId.get(), attributes.model());
        if (modelId.isEmpty()) {
            log.debug("Model '{}' not found under make {} for {}",
                    attributes.model(), makeId.get(), attributes.displayName());
            return TaxonomyResolution.missing(new MissingReference(MissingReferenceKind.MODEL,
                    attributes.make(), attributes.model(), attributes.variant(), makeId.get()));
        }

        List<String> unresolved = new ArrayList<>();
        String bodyTypeId = resolveOptional(TaxonomyKind.BODY_TYPE, attributes.bodyType(), unresolved);
        String fuelTypeId = resolveOptional(TaxonomyKind.FUEL_TYPE, attributes.fuelType(), unresolved);
        String transmissionId = resolveOptional(TaxonomyKind.TRANSMISSION, attributes.transmission(), unresolved);

        return TaxonomyResolution.resolved(
                new TaxonomyRefs(makeId.get(), modelId.get(), bodyTypeId, fuelTypeId, transmissionId),
                unresolved);
    }

    /**
     * Resolves only the optional attributes, for patching an existing listing whose make and
     * model are already known.
     */
    public TaxonomyRefs resolveOptionalRefs(ListingAttributes attributes) {
        List<String> ignored = new ArrayList<>();
        return new TaxonomyRefs(null, null,
                resolveOptional(TaxonomyKind.BODY_TYPE, attributes.bodyType(), ignored),
                resolveOptional(TaxonomyKind.FUEL_TYPE, attributes.fuelType(), ignored),
                resolveOptional(TaxonomyKind.TRANSMISSION, attributes.transmission(), ignored));
    }

    public TaxonomyLookup getLookup() {
        return lookup;
    }

    private String resolveOptional(TaxonomyKind kind, String value, List<String> unresolved) {
        if (isBlank(value)) {
            return null;
        }
        Optional<String> id = lookup.resolveAttribute(kind, value);
        if (id.isEmpty()) {
            unresolved.add(kind.attributeName());
            return null;
        }
        return id.get();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
