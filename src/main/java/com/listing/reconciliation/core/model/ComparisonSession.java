package com.listing.reconciliation.core.model;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * A named, timestamped reconciliation pass for one seller. Sessions are never deleted;
 * together with their changes they form the audit trail of every price-list import.
 */
public class ComparisonSession {

    private final String id;
    private final String sessionName;
    private final String sellerId;
    private final ExtractionType extractionType;
    private final SessionStatus status;
    private final SessionSummary summary;
    private final ExtractionMetadata extractionMetadata;
    private final String failureReason;
    private final Instant createdAt;
    private final Instant appliedAt;

    private ComparisonSession(Builder builder) {
        this.id = builder.id != null ? builder.id : UUID.randomUUID().toString();
        this.sessionName = Objects.requireNonNull(builder.sessionName, "sessionName is required");
        this.sellerId = Objects.requireNonNull(builder.sellerId, "sellerId is required");
        this.extractionType = builder.extractionType != null ? builder.extractionType : ExtractionType.UPDATE;
        this.status = builder.status != null ? builder.status : SessionStatus.PROCESSING;
        this.summary = builder.summary != null ? builder.summary : SessionSummary.empty();
        this.extractionMetadata = builder.extractionMetadata != null
                ? builder.extractionMetadata : ExtractionMetadata.none();
        this.failureReason = builder.failureReason;
        this.createdAt = builder.createdAt != null ? builder.createdAt : Instant.now();
        this.appliedAt = builder.appliedAt;
    }

    public String getId() {
        return id;
    }

    public String getSessionName() {
        return sessionName;
    }

    public String getSellerId() {
        return sellerId;
    }

    public ExtractionType getExtractionType() {
        return extractionType;
    }

    public SessionStatus getStatus() {
        return status;
    }

    public SessionSummary getSummary() {
        return summary;
    }

    public ExtractionMetadata getExtractionMetadata() {
        return extractionMetadata;
    }

    public String getFailureReason() {
        return failureReason;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    /**
     * Time the first change of this session was committed, or null.
     */
    public Instant getAppliedAt() {
        return appliedAt;
    }

    public boolean isCompleted() {
        return status == SessionStatus.COMPLETED;
    }

    public Builder toBuilder() {
        return builder()
                .id(id)
                .sessionName(sessionName)
                .sellerId(sellerId)
                .extractionType(extractionType)
                .status(status)
                .summary(summary)
                .extractionMetadata(extractionMetadata)
                .failureReason(failureReason)
                .createdAt(createdAt)
                .appliedAt(appliedAt);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ComparisonSession that = (ComparisonSession) o;
        return Objects.equals(id, that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "ComparisonSession{" +
                "id='" + id + '\'' +
                ", name='" + sessionName + '\'' +
                ", sellerId='" + sellerId + '\'' +
                ", status=" + status +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String id;
        private String sessionName;
        private String sellerId;
        private ExtractionType extractionType;
        private SessionStatus status;
        private SessionSummary summary;
        private ExtractionMetadata extractionMetadata;
        private String failureReason;
        private Instant createdAt;
        private Instant appliedAt;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder sessionName(String sessionName) {
            this.sessionName = sessionName;
            return this;
        }

        public Builder sellerId(String sellerId) {
            this.sellerId = sellerId;
            return this;
        }

        public Builder extractionType(ExtractionType extractionType) {
            this.extractionType = extractionType;
            return this;
        }

        public Builder status(SessionStatus status) {
            this.status = status;
            return this;
        }

        public Builder summary(SessionSummary summary) {
            this.summary = summary;
            return this;
        }

        public Builder extractionMetadata(ExtractionMetadata extractionMetadata) {
            this.extractionMetadata = extractionMetadata;
            return this;
        }

        public Builder failureReason(String failureReason) {
            this.failureReason = failureReason;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder appliedAt(Instant appliedAt) {
            this.appliedAt = appliedAt;
            return this;
        }

        public ComparisonSession build() {
            return new ComparisonSession(this);
        }
    }
}
