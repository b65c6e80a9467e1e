package com.listing.reconciliation.core.model;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * A persisted listing owned by exactly one seller. Instances are immutable snapshots of the
 * backing store row; store writes return new instances.
 */
public class ExistingListing {

    private final String id;
    private final String sellerId;
    private final ListingAttributes attributes;
    private final TaxonomyRefs refs;
    private final List<Offer> offers;
    private final Instant createdAt;
    private final Instant updatedAt;
    private final boolean draft;
    private final List<String> missingFields;

    private ExistingListing(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id is required");
        this.sellerId = Objects.requireNonNull(builder.sellerId, "sellerId is required");
        this.attributes = Objects.requireNonNull(builder.attributes, "attributes is required");
        this.refs = builder.refs;
        this.offers = builder.offers != null ? List.copyOf(builder.offers) : List.of();
        this.createdAt = builder.createdAt != null ? builder.createdAt : Instant.now();
        this.updatedAt = builder.updatedAt != null ? builder.updatedAt : this.createdAt;
        this.draft = builder.draft;
        this.missingFields = builder.missingFields != null ? List.copyOf(builder.missingFields) : List.of();
    }

    public String getId() {
        return id;
    }

    public String getSellerId() {
        return sellerId;
    }

    public ListingAttributes getAttributes() {
        return attributes;
    }

    public TaxonomyRefs getRefs() {
        return refs;
    }

    public List<Offer> getOffers() {
        return offers;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public boolean isDraft() {
        return draft;
    }

    public List<String> getMissingFields() {
        return missingFields;
    }

    public String getDisplayName() {
        return attributes.displayName();
    }

    public Builder toBuilder() {
        return builder()
                .id(id)
                .sellerId(sellerId)
                .attributes(attributes)
                .refs(refs)
                .offers(offers)
                .createdAt(createdAt)
                .updatedAt(updatedAt)
                .draft(draft)
                .missingFields(missingFields);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ExistingListing that = (ExistingListing) o;
        return Objects.equals(id, that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "ExistingListing{" +
                "id='" + id + '\'' +
                ", sellerId='" + sellerId + '\'' +
                ", name='" + attributes.displayName() + '\'' +
                ", offers=" + offers.size() +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String id;
        private String sellerId;
        private ListingAttributes attributes;
        private TaxonomyRefs refs;
        private List<Offer> offers;
        private Instant createdAt;
        private Instant updatedAt;
        private boolean draft;
        private List<String> missingFields;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder sellerId(String sellerId) {
            this.sellerId = sellerId;
            return this;
        }

        public Builder attributes(ListingAttributes attributes) {
            this.attributes = attributes;
            return this;
        }

        public Builder refs(TaxonomyRefs refs) {
            this.refs = refs;
            return this;
        }

        public Builder offers(List<Offer> offers) {
            this.offers = offers;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder updatedAt(Instant updatedAt) {
            this.updatedAt = updatedAt;
            return this;
        }

        public Builder draft(boolean draft) {
            this.draft = draft;
            return this;
        }

        public Builder missingFields(List<String> missingFields) {
            this.missingFields = missingFields;
            return this;
        }

        public ExistingListing build() {
            return new ExistingListing(this);
        }
    }
}
