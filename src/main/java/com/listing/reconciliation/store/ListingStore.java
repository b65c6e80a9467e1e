package com.listing.reconciliation.store;

import com.listing.reconciliation.core.model.ExistingListing;
import com.listing.reconciliation.core.model.ListingAttributes;
import com.listing.reconciliation.core.model.Offer;
import com.listing.reconciliation.core.model.TaxonomyRefs;

import java.util.List;
import java.util.Optional;

/**
 * CRUD primitives over listings and their offers. Each call is atomic on its own; nothing
 * spans several calls.
 *
 * <p>All methods throw {@link StoreOperationException} when the store rejects the operation,
 * for example when the listing does not exist.</p>
 */
public interface ListingStore {

    /**
     * Returns the seller's listings in insertion order.
     */
    List<ExistingListing> findBySeller(String sellerId);

    Optional<ExistingListing> findById(String listingId);

    /**
     * Inserts a new listing without offers and returns it with its generated id.
     */
    ExistingListing insert(String sellerId, ListingAttributes attributes, TaxonomyRefs refs);

    void insertOffers(String listingId, List<Offer> offers);

    /**
     * Overwrites the listing's attributes and references.
     */
    ExistingListing patch(String listingId, ListingAttributes attributes, TaxonomyRefs refs);

    /**
     * Deletes every offer of the listing and inserts {@code offers}.
     */
    void replaceOffers(String listingId, List<Offer> offers);

    /**
     * Removes the listing together with its offers.
     */
    void delete(String listingId);
}
