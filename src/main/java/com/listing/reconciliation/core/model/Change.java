package com.listing.reconciliation.core.model;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * The unit of review: one classified difference between the extracted price list and the
 * seller's existing listings, staged in a comparison session.
 *
 * <p>Instances are immutable. Status transitions and the single re-classification operation
 * produce new instances through {@link #toBuilder()}; {@code changeType} and {@code payload}
 * must always agree.</p>
 */
public class Change {

    private final String id;
    private final String sessionId;
    private final int position;
    private final ChangeType changeType;
    private final ChangePayload payload;
    private final String existingListingId;
    private final MatchMethod matchMethod;
    private final double confidenceScore;
    private final ChangeStatus status;
    private final String changeSummary;
    private final String reviewNotes;
    private final Instant reviewedAt;
    private final String reviewedBy;
    private final Instant createdAt;

    private Change(Builder builder) {
        this.id = builder.id != null ? builder.id : UUID.randomUUID().toString();
        this.sessionId = Objects.requireNonNull(builder.sessionId, "sessionId is required");
        this.position = builder.position;
        this.changeType = Objects.requireNonNull(builder.changeType, "changeType is required");
        this.payload = Objects.requireNonNull(builder.payload, "payload is required");
        this.existingListingId = builder.existingListingId;
        this.matchMethod = builder.matchMethod != null ? builder.matchMethod : MatchMethod.NONE;
        this.confidenceScore = builder.confidenceScore;
        this.status = builder.status != null ? builder.status : ChangeStatus.PENDING;
        this.changeSummary = builder.changeSummary;
        this.reviewNotes = builder.reviewNotes;
        this.reviewedAt = builder.reviewedAt;
        this.reviewedBy = builder.reviewedBy;
        this.createdAt = builder.createdAt != null ? builder.createdAt : Instant.now();

        if (payload.type() != changeType) {
            throw new IllegalArgumentException("Payload of type " + payload.type()
                    + " does not match change type " + changeType);
        }
        if (confidenceScore < 0.0 || confidenceScore > 1.0) {
            throw new IllegalArgumentException("confidenceScore must be between 0.0 and 1.0");
        }
        if (matchMethod == MatchMethod.EXACT && confidenceScore != 1.0) {
            throw new IllegalArgumentException("Exact matches must have confidence 1.0");
        }
        if ((changeType == ChangeType.UPDATE || changeType == ChangeType.DELETE
                || changeType == ChangeType.UNCHANGED) && existingListingId == null) {
            throw new IllegalArgumentException(changeType + " changes require an existing listing id");
        }
    }

    public String getId() {
        return id;
    }

    public String getSessionId() {
        return sessionId;
    }

    /**
     * Extraction order of the candidate; deletes follow all candidates in listing order.
     */
    public int getPosition() {
        return position;
    }

    public ChangeType getChangeType() {
        return changeType;
    }

    public ChangePayload getPayload() {
        return payload;
    }

    public Candidate getExtractedData() {
        return payload.extracted();
    }

    public Map<String, FieldChange> getFieldChanges() {
        if (payload instanceof UpdatePayload update) {
            return update.fieldChanges();
        }
        return Map.of();
    }

    public String getExistingListingId() {
        return existingListingId;
    }

    public MatchMethod getMatchMethod() {
        return matchMethod;
    }

    public double getConfidenceScore() {
        return confidenceScore;
    }

    public ChangeStatus getStatus() {
        return status;
    }

    public String getChangeSummary() {
        return changeSummary;
    }

    public String getReviewNotes() {
        return reviewNotes;
    }

    public Instant getReviewedAt() {
        return reviewedAt;
    }

    public String getReviewedBy() {
        return reviewedBy;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public boolean isPending() {
        return status == ChangeStatus.PENDING;
    }

    public boolean isMissingReference() {
        return changeType == ChangeType.MISSING_REFERENCE;
    }

    public Builder toBuilder() {
        return builder()
                .id(id)
                .sessionId(sessionId)
                .position(position)
                .changeType(changeType)
                .payload(payload)
                .existingListingId(existingListingId)
                .matchMethod(matchMethod)
                .confidenceScore(confidenceScore)
                .status(status)
                .changeSummary(changeSummary)
                .reviewNotes(reviewNotes)
                .reviewedAt(reviewedAt)
                .reviewedBy(reviewedBy)
                .createdAt(createdAt);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Change change = (Change) o;
        return Objects.equals(id, change.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "Change{" +
                "id='" + id + '\'' +
                ", sessionId='" + sessionId + '\'' +
                ", type=" + changeType +
                ", status=" + status +
                ", existingListingId='" + existingListingId + '\'' +
                ", method=" + matchMethod +
                ", confidence=" + confidenceScore +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String id;
        private String sessionId;
        private int position;
        private ChangeType changeType;
        private ChangePayload payload;
        private String existingListingId;
        private MatchMethod matchMethod;
        private double confidenceScore;
        private ChangeStatus status;
        private String changeSummary;
        private String reviewNotes;
        private Instant reviewedAt;
        private String reviewedBy;
        private Instant createdAt;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder sessionId(String sessionId) {
            this.sessionId = sessionId;
            return this;
        }

        public Builder position(int position) {
            this.position = position;
            return this;
        }

        public Builder changeType(ChangeType changeType) {
            this.changeType = changeType;
            return this;
        }

        /**
         * Sets the payload and the matching change type.
         */
        public Builder payload(ChangePayload payload) {
            this.payload = payload;
            if (payload != null) {
                this.changeType = payload.type();
            }
            return this;
        }

        public Builder existingListingId(String existingListingId) {
            this.existingListingId = existingListingId;
            return this;
        }

        public Builder matchMethod(MatchMethod matchMethod) {
            this.matchMethod = matchMethod;
            return this;
        }

        public Builder confidenceScore(double confidenceScore) {
            this.confidenceScore = confidenceScore;
            return this;
        }

        public Builder status(ChangeStatus status) {
            this.status = status;
            return this;
        }

        public Builder changeSummary(String changeSummary) {
            this.changeSummary = changeSummary;
            return this;
        }

        public Builder reviewNotes(String reviewNotes) {
            this.reviewNotes = reviewNotes;
            return this;
        }

        public Builder reviewedAt(Instant reviewedAt) {
            this.reviewedAt = reviewedAt;
            return this;
        }

        public Builder reviewedBy(String reviewedBy) {
            this.reviewedBy = reviewedBy;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Change build() {
            return new Change(this);
        }
    }
}
