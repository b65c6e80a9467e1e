package com.listing.reconciliation.unmapped;

import com.listing.reconciliation.audit.AuditAction;
import com.listing.reconciliation.audit.AuditService;
import com.listing.reconciliation.classify.ChangeSummaries;
import com.listing.reconciliation.core.model.Change;
import com.listing.reconciliation.core.model.ChangeStatus;
import com.listing.reconciliation.core.model.ChangeType;
import com.listing.reconciliation.core.model.ComparisonSession;
import com.listing.reconciliation.core.model.DeletePayload;
import com.listing.reconciliation.core.model.ExistingListing;
import com.listing.reconciliation.core.model.MatchMethod;
import com.listing.reconciliation.session.ComparisonSessionService;
import com.listing.reconciliation.store.ChangeRepository;
import com.listing.reconciliation.store.ListingStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Finds a seller's listings that no change of a session refers to, typically listings whose
 * best candidate stayed below the fuzzy confidence floor, and lets a reviewer stage them for
 * deletion.
 */
public class UnmappedDetector {
    private static final Logger log = LoggerFactory.getLogger(UnmappedDetector.class);

    public static final String DEFAULT_REASON = "Marked for deletion from unmapped listings";

    private final ComparisonSessionService sessionService;
    private final ChangeRepository changeRepository;
    private final ListingStore listingStore;
    private final AuditService auditService;

    public UnmappedDetector(ComparisonSessionService sessionService, ChangeRepository changeRepository,
                            ListingStore listingStore, AuditService auditService) {
        this.sessionService = sessionService;
        this.changeRepository = changeRepository;
        this.listingStore = listingStore;
        this.auditService = auditService;
    }

    /**
     * Returns the seller's listings that are not referenced by an update, delete or unchanged
     * change of the session, nor created by one of its applied creates. Read-only.
     */
    public List<ExistingListing> findUnmapped(String sessionId, String sellerId) {
        if (sellerId == null || sellerId.isBlank()) {
            throw new IllegalArgumentException("sellerId must not be blank");
        }
        ComparisonSession session = sessionService.requireCompleted(sessionId);
        if (!sellerId.equals(session.getSellerId())) {
            log.warn("Session {} belongs to seller {}, not {}", sessionId, session.getSellerId(), sellerId);
        }
        Set<String> referenced = referencedListingIds(sessionId);
        List<ExistingListing> unmapped = listingStore.findBySeller(sellerId).stream()
                .filter(listing -> !referenced.contains(listing.getId()))
                .toList();
        log.debug("Session {} leaves {} of seller {}'s listings unmapped", sessionId, unmapped.size(), sellerId);
        return unmapped;
    }

    /**
     * Stages pending delete changes for unmapped listings. New changes are appended after
     * the session's last position and the summary is recounted.
     *
     * @param reason stored as the changes' review notes; a default is used when blank
     * @return the created changes
     * @throws IllegalArgumentException if a listing is unknown, belongs to another seller or
     *                                  is already referenced by the session
     */
    public synchronized List<Change> markForDeletion(String sessionId, List<String> listingIds, String reason) {
        if (listingIds == null || listingIds.isEmpty()) {
            throw new IllegalArgumentException("listingIds must not be empty");
        }
        ComparisonSession session = sessionService.requireCompleted(sessionId);
        List<Change> existingChanges = changeRepository.findBySession(sessionId);
        Set<String> referenced = referencedListingIds(existingChanges);
        String notes = reason != null && !reason.isBlank() ? reason.trim() : DEFAULT_REASON;

        int nextPosition = existingChanges.stream().mapToInt(Change::getPosition).max().orElse(-1) + 1;
        Instant now = Instant.now();
        List<Change> created = new ArrayList<>();
        for (String listingId : new LinkedHashSet<>(listingIds)) {
            if (referenced.contains(listingId)) {
                throw new IllegalArgumentException("Listing " + listingId + " is already referenced by session " + sessionId);
            }
            ExistingListing listing = listingStore.findById(listingId)
                    .orElseThrow(() -> new IllegalArgumentException("Listing not found: " + listingId));
            if (!listing.getSellerId().equals(session.getSellerId())) {
                throw new IllegalArgumentException("Listing " + listingId + " does not belong to seller "
                        + session.getSellerId());
            }
            DeletePayload payload = new DeletePayload(listing.getAttributes(), notes);
            created.add(Change.builder()
                    .sessionId(sessionId)
                    .position(nextPosition++)
                    .payload(payload)
                    .existingListingId(listingId)
                    .matchMethod(MatchMethod.NONE)
                    .confidenceScore(0.0)
                    .status(ChangeStatus.PENDING)
                    .changeSummary(ChangeSummaries.describe(payload))
                    .reviewNotes(notes)
                    .createdAt(now)
                    .build());
        }

        changeRepository.saveAll(created);
        sessionService.recountSummary(sessionId);
        try {
            auditService.record(AuditAction.LISTINGS_MARKED_FOR_DELETION, sessionId, AuditService.SYSTEM_ACTOR,
                    Map.of("listingIds", List.copyOf(new LinkedHashSet<>(listingIds)), "reason", notes));
        } catch (Exception e) {
            log.warn("Failed to record audit entry for session {}: {}", sessionId, e.getMessage());
        }
        log.info("unmapped.marked sessionId={} count={}", sessionId, created.size());
        return created;
    }

    private Set<String> referencedListingIds(String sessionId) {
        return referencedListingIds(changeRepository.findBySession(sessionId));
    }

    private static Set<String> referencedListingIds(List<Change> changes) {
        Set<String> ids = new HashSet<>();
        for (Change change : changes) {
            if (change.getExistingListingId() == null) {
                continue;
            }
            ChangeType type = change.getChangeType();
            boolean matchedOrDeleted = type == ChangeType.UPDATE || type == ChangeType.DELETE
                    || type == ChangeType.UNCHANGED;
            boolean appliedCreate = type == ChangeType.CREATE && change.getStatus() == ChangeStatus.APPLIED;
            if (matchedOrDeleted || appliedCreate) {
                ids.add(change.getExistingListingId());
            }
        }
        return ids;
    }
}
