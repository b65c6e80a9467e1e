package com.listing.reconciliation;

import com.listing.reconciliation.core.model.Candidate;
import com.listing.reconciliation.core.model.ExistingListing;
import com.listing.reconciliation.core.model.ListingAttributes;
import com.listing.reconciliation.core.model.Offer;
import com.listing.reconciliation.core.model.TaxonomyRefs;
import com.listing.reconciliation.taxonomy.InMemoryTaxonomy;
import com.listing.reconciliation.taxonomy.TaxonomyKind;

import java.time.Instant;
import java.util.List;

/**
 * Shared builders for listings, candidates and a small car taxonomy.
 */
public final class TestData {

    public static final String SELLER = "seller-1";
    public static final String OTHER_SELLER = "seller-2";

    public static final String TOYOTA = "make-toyota";
    public static final String VW = "make-vw";
    public static final String YARIS = "model-yaris";
    public static final String AYGO_X = "model-aygo-x";
    public static final String GOLF = "model-golf";

    public static final String HYBRID = "fuel-hybrid";
    public static final String PETROL = "fuel-petrol";
    public static final String AUTOMATIC = "trans-automatic";
    public static final String HATCHBACK = "body-hatchback";

    private TestData() {
    }

    public static InMemoryTaxonomy taxonomy() {
        return new InMemoryTaxonomy()
                .addMake(TOYOTA, "Toyota")
                .addMake(VW, "Volkswagen")
                .addModel(TOYOTA, YARIS, "Yaris")
                .addModel(TOYOTA, AYGO_X, "Aygo X")
                .addModel(VW, GOLF, "Golf")
                .addAttribute(TaxonomyKind.FUEL_TYPE, HYBRID, "Hybrid")
                .addAttribute(TaxonomyKind.FUEL_TYPE, PETROL, "Benzin")
                .addAttribute(TaxonomyKind.TRANSMISSION, AUTOMATIC, "Automatic")
                .addAttribute(TaxonomyKind.BODY_TYPE, HATCHBACK, "Hatchback");
    }

    public static ListingAttributes attrs(String make, String model, String variant) {
        return ListingAttributes.builder().make(make).model(model).variant(variant).build();
    }

    public static ListingAttributes attrs(String make, String model, String variant, Integer monthlyPrice) {
        return ListingAttributes.builder().make(make).model(model).variant(variant).monthlyPrice(monthlyPrice).build();
    }

    public static Candidate candidate(String make, String model, String variant) {
        return Candidate.of(attrs(make, model, variant));
    }

    public static Candidate candidate(String make, String model, String variant, Integer monthlyPrice) {
        return Candidate.of(attrs(make, model, variant, monthlyPrice));
    }

    public static Offer offer(int monthlyPrice) {
        return new Offer(monthlyPrice, 0, 36, 15_000, null);
    }

    public static ExistingListing listing(String id, String make, String model, String variant) {
        return listing(id, attrs(make, model, variant));
    }

    public static ExistingListing listing(String id, String make, String model, String variant, Integer monthlyPrice) {
        return listing(id, attrs(make, model, variant, monthlyPrice));
    }

    public static ExistingListing listing(String id, ListingAttributes attributes) {
        return ExistingListing.builder()
                .id(id)
                .sellerId(SELLER)
                .attributes(attributes)
                .refs(new TaxonomyRefs(TOYOTA, YARIS, null, null, null))
                .createdAt(Instant.parse("2024-01-01T00:00:00Z"))
                .build();
    }

    public static ExistingListing listingWithOffers(String id, ListingAttributes attributes, List<Offer> offers) {
        return listing(id, attributes).toBuilder().offers(offers).build();
    }
}
