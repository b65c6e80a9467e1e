package com.listing.reconciliation.store;

import com.listing.reconciliation.core.model.ExistingListing;
import com.listing.reconciliation.core.model.ListingAttributes;
import com.listing.reconciliation.core.model.Offer;
import com.listing.reconciliation.core.model.TaxonomyRefs;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.UnaryOperator;

/**
 * In-memory implementation of {@link ListingStore}.
 * Suitable for testing and single-JVM deployments.
 */
public class InMemoryListingStore implements ListingStore {
    private static final Logger log = LoggerFactory.getLogger(InMemoryListingStore.class);

    private final ConcurrentMap<String, Row> rows = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();

    /**
     * Stores a listing as-is, keeping its id. Used to seed the store.
     */
    public ExistingListing save(ExistingListing listing) {
        rows.compute(listing.getId(), (id, existing) ->
                new Row(existing != null ? existing.seq() : sequence.incrementAndGet(), listing));
        return listing;
    }

    @Override
    public List<ExistingListing> findBySeller(String sellerId) {
        return rows.values().stream()
                .filter(row -> row.listing().getSellerId().equals(sellerId))
                .sorted(Comparator.comparingLong(Row::seq))
                .map(Row::listing)
                .toList();
    }

    @Override
    public Optional<ExistingListing> findById(String listingId) {
        Row row = rows.get(listingId);
        return row == null ? Optional.empty() : Optional.of(row.listing());
    }

    @Override
    public ExistingListing insert(String sellerId, ListingAttributes attributes, TaxonomyRefs refs) {
        ExistingListing listing = ExistingListing.builder()
                .id(UUID.randomUUID().toString())
                .sellerId(sellerId)
                .attributes(attributes)
                .refs(refs)
                .createdAt(Instant.now())
                .build();
        rows.put(listing.getId(), new Row(sequence.incrementAndGet(), listing));
        log.debug("Inserted listing {} for seller {}", listing.getId(), sellerId);
        return listing;
    }

    @Override
    public void insertOffers(String listingId, List<Offer> offers) {
        update(listingId, listing -> {
            List<Offer> merged = new ArrayList<>(listing.getOffers());
            merged.addAll(offers);
            return listing.toBuilder().offers(merged).build();
        });
    }

    @Override
    public ExistingListing patch(String listingId, ListingAttributes attributes, TaxonomyRefs refs) {
        return update(listingId, listing -> listing.toBuilder()
                .attributes(attributes)
                .refs(refs)
                .updatedAt(Instant.now())
                .build());
    }

    @Override
    public void replaceOffers(String listingId, List<Offer> offers) {
        update(listingId, listing -> listing.toBuilder()
                .offers(offers)
                .updatedAt(Instant.now())
                .build());
    }

    @Override
    public void delete(String listingId) {
        if (rows.remove(listingId) == null) {
            throw new StoreOperationException("Listing not found: " + listingId);
        }
        log.debug("Deleted listing {}", listingId);
    }

    public int size() {
        return rows.size();
    }

    private ExistingListing update(String listingId, UnaryOperator<ExistingListing> change) {
        Row updated = rows.computeIfPresent(listingId, (id, row) -> new Row(row.seq(), change.apply(row.listing())));
        if (updated == null) {
            throw new StoreOperationException("Listing not found: " + listingId);
        }
        return updated.listing();
    }

    private record Row(long seq, ExistingListing listing) {}
}
