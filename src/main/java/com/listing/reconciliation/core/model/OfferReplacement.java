package com.listing.reconciliation.core.model;

import java.util.List;

/**
 * The offer set of a listing is replaced wholesale when any offer differs: all existing offers
 * are deleted and {@code newOffers} inserted. Individual offers are never diffed.
 */
public record OfferReplacement(List<Offer> oldOffers, List<Offer> newOffers) {

    public OfferReplacement {
        oldOffers = oldOffers != null ? List.copyOf(oldOffers) : List.of();
        newOffers = newOffers != null ? List.copyOf(newOffers) : List.of();
    }
}
