package com.listing.reconciliation.store;

import com.listing.reconciliation.codec.ChangePayloadCodec;
import com.listing.reconciliation.codec.InvalidPayloadException;
import com.listing.reconciliation.core.model.Change;
import com.listing.reconciliation.core.model.ChangeStatus;
import com.listing.reconciliation.core.model.ChangeType;
import com.listing.reconciliation.core.model.CreatePayload;
import com.listing.reconciliation.core.model.MatchMethod;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-memory implementation of {@link ChangeRepository} that keeps changes as rows with a
 * JSON payload column, the way a relational store would.
 */
public class InMemoryChangeRepository implements ChangeRepository {
    private static final Logger log = LoggerFactory.getLogger(InMemoryChangeRepository.class);

    private static final Comparator<Change> LISTING_ORDER = Comparator
            .comparing(Change::getChangeType)
            .thenComparingInt(Change::getPosition);

    private final ChangePayloadCodec codec;
    private final ConcurrentMap<String, ChangeRow> rows = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();

    public InMemoryChangeRepository(ChangePayloadCodec codec) {
        this.codec = codec;
    }

    @Override
    public void saveAll(List<Change> changes) {
        // Encode everything first so a bad payload leaves nothing behind.
        Map<String, ChangeRow> batch = new LinkedHashMap<>();
        for (Change change : changes) {
            if (rows.containsKey(change.getId()) || batch.containsKey(change.getId())) {
                throw new StoreOperationException("Duplicate change id: " + change.getId());
            }
            batch.put(change.getId(), toRow(change, sequence.incrementAndGet()));
        }
        synchronized (rows) {
            rows.putAll(batch);
        }
        log.debug("Persisted {} changes", batch.size());
    }

    @Override
    public Optional<Change> findById(String changeId) {
        ChangeRow row = rows.get(changeId);
        return row == null ? Optional.empty() : Optional.of(fromRow(row));
    }

    @Override
    public List<Change> findBySession(String sessionId) {
        synchronized (rows) {
            return rows.values().stream()
                    .filter(row -> row.sessionId().equals(sessionId))
                    .map(this::fromRow)
                    .sorted(LISTING_ORDER)
                    .toList();
        }
    }

    @Override
    public List<Change> findByType(ChangeType type) {
        return rows.values().stream()
                .filter(row -> row.changeType() == type)
                .sorted(Comparator.comparingLong(ChangeRow::seq))
                .map(this::fromRow)
                .toList();
    }

    @Override
    public Change update(Change change) {
        synchronized (rows) {
            ChangeRow existing = requireRow(change.getId());
            if (existing.changeType() != change.getChangeType()) {
                throw new StoreOperationException("Cannot change type of change " + change.getId() + " from "
                        + existing.changeType().wireName() + " to " + change.getChangeType().wireName());
            }
            rows.put(change.getId(), toRow(change, existing.seq()));
            return change;
        }
    }

    @Override
    public Change reclassify(String changeId, CreatePayload payload, String changeSummary) {
        synchronized (rows) {
            ChangeRow existing = requireRow(changeId);
            if (existing.changeType() != ChangeType.MISSING_REFERENCE || existing.status() != ChangeStatus.PENDING) {
                throw new StoreOperationException("Only pending missing_reference changes can be re-classified, "
                        + changeId + " is " + existing.changeType().wireName() + "/" + existing.status().wireName());
            }
            Change reclassified = fromRow(existing).toBuilder()
                    .payload(payload)
                    .changeSummary(changeSummary)
                    .build();
            rows.put(changeId, toRow(reclassified, existing.seq()));
            log.debug("Change {} re-classified as {}", changeId, ChangeType.CREATE.wireName());
            return reclassified;
        }
    }

    public int size() {
        return rows.size();
    }

    private ChangeRow requireRow(String changeId) {
        ChangeRow row = rows.get(changeId);
        if (row == null) {
            throw new StoreOperationException("Change not found: " + changeId);
        }
        return row;
    }

    private ChangeRow toRow(Change change, long seq) {
        String payloadJson;
        try {
            payloadJson = codec.encode(change.getPayload());
        } catch (InvalidPayloadException e) {
            throw new StoreOperationException("Cannot store change " + change.getId() + ": " + e.getMessage(), e);
        }
        return new ChangeRow(seq, change.getId(), change.getSessionId(), change.getPosition(),
                change.getChangeType(), payloadJson, change.getExistingListingId(), change.getMatchMethod(),
                change.getConfidenceScore(), change.getStatus(), change.getChangeSummary(),
                change.getReviewNotes(), change.getReviewedAt(), change.getReviewedBy(), change.getCreatedAt());
    }

    private Change fromRow(ChangeRow row) {
        return Change.builder()
                .id(row.id())
                .sessionId(row.sessionId())
                .position(row.position())
                .payload(codec.decode(row.changeType(), row.payloadJson()))
                .existingListingId(row.existingListingId())
                .matchMethod(row.matchMethod())
                .confidenceScore(row.confidenceScore())
                .status(row.status())
                .changeSummary(row.changeSummary())
                .reviewNotes(row.reviewNotes())
                .reviewedAt(row.reviewedAt())
                .reviewedBy(row.reviewedBy())
                .createdAt(row.createdAt())
                .build();
    }

    /**
     * Column layout of the {@code changes} table.
     */
    record ChangeRow(
            long seq,
            String id,
            String sessionId,
            int position,
            ChangeType changeType,
            String payloadJson,
            String existingListingId,
            MatchMethod matchMethod,
            double confidenceScore,
            ChangeStatus status,
            String changeSummary,
            String reviewNotes,
            Instant reviewedAt,
            String reviewedBy,
            Instant createdAt
    ) {}
}
