package com.listing.reconciliation.rest.dto;

import com.listing.reconciliation.core.model.ExistingListing;
import com.listing.reconciliation.core.model.ListingAttributes;
import com.listing.reconciliation.core.model.Offer;

import java.time.Instant;
import java.util.List;

public record ListingResponse(
        String id,
        String sellerId,
        String displayName,
        ListingAttributes attributes,
        List<Offer> offers,
        Instant updatedAt
) {
    public static ListingResponse from(ExistingListing listing) {
        return new ListingResponse(
                listing.getId(),
                listing.getSellerId(),
                listing.getDisplayName(),
                listing.getAttributes(),
                listing.getOffers(),
                listing.getUpdatedAt()
        );
    }
}
