package com.listing.reconciliation.apply;

import com.listing.reconciliation.api.ReconciliationOptions;
import com.listing.reconciliation.audit.AuditAction;
import com.listing.reconciliation.audit.AuditService;
import com.listing.reconciliation.classify.OfferNormalizer;
import com.listing.reconciliation.core.model.Change;
import com.listing.reconciliation.core.model.ChangeStatus;
import com.listing.reconciliation.core.model.ChangeType;
import com.listing.reconciliation.core.model.ComparisonSession;
import com.listing.reconciliation.core.model.CreatePayload;
import com.listing.reconciliation.core.model.ExistingListing;
import com.listing.reconciliation.core.model.FieldChange;
import com.listing.reconciliation.core.model.ListingAttributes;
import com.listing.reconciliation.core.model.TaxonomyRefs;
import com.listing.reconciliation.core.model.TrackedField;
import com.listing.reconciliation.core.model.UpdatePayload;
import com.listing.reconciliation.logging.LogContext;
import com.listing.reconciliation.metrics.MetricsService;
import com.listing.reconciliation.review.ChangeStore;
import com.listing.reconciliation.session.ComparisonSessionService;
import com.listing.reconciliation.store.ChangeRepository;
import com.listing.reconciliation.store.ListingStore;
import com.listing.reconciliation.store.StoreOperationException;
import com.listing.reconciliation.taxonomy.TaxonomyResolver;
import com.listing.reconciliation.tracing.Span;
import com.listing.reconciliation.tracing.TracingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;

/**
 * Commits a reviewer's selection of a session's changes and discards the rest.
 *
 * <p>Selected {@code create}, {@code update} and {@code delete} changes that are pending or
 * approved are executed against the {@link ListingStore}: deletes first, then updates, then
 * creates. Store operations are independent; a failure is recorded for that change, written
 * into its review notes, and leaves it pending so it can be selected again. There is no
 * rollback of operations that already succeeded.</p>
 *
 * <p>Selected ids that are unknown, already terminal, {@code unchanged} or
 * {@code missing_reference} are reported as failures and have no effect.</p>
 *
 * <p>After every selected operation has been attempted, all other pending or approved changes
 * of the session are discarded, except missing references and changes whose operation failed.
 * If the calling thread is interrupted, the remaining operations are not attempted and the
 * discard pass is skipped; operations already committed stay committed.</p>
 */
public class ApplyEngine {
    private static final Logger log = LoggerFactory.getLogger(ApplyEngine.class);

    private static final List<ChangeType> PHASES = List.of(ChangeType.DELETE, ChangeType.UPDATE, ChangeType.CREATE);

    private final ComparisonSessionService sessionService;
    private final ChangeRepository changeRepository;
    private final ListingStore listingStore;
    private final TaxonomyResolver taxonomyResolver;
    private final OfferNormalizer offerNormalizer;
    private final AuditService auditService;
    private final MetricsService metricsService;
    private final TracingService tracingService;
    private final Executor executor;
    private final int concurrency;

    public ApplyEngine(ComparisonSessionService sessionService, ChangeRepository changeRepository,
                       ListingStore listingStore, TaxonomyResolver taxonomyResolver,
                       ReconciliationOptions options, AuditService auditService,
                       MetricsService metricsService, TracingService tracingService, Executor executor) {
        this.sessionService = sessionService;
        this.changeRepository = changeRepository;
        this.listingStore = listingStore;
        this.taxonomyResolver = taxonomyResolver;
        this.offerNormalizer = new OfferNormalizer(options.getDefaultPeriodMonths(), options.getDefaultMileagePerYear());
        this.auditService = auditService;
        this.metricsService = metricsService;
        this.tracingService = tracingService;
        this.executor = executor;
        this.concurrency = options.getApplyConcurrency();
    }

    /**
     * Applies the selected changes of a completed session.
     *
     * @param appliedBy reviewer recorded on applied and discarded changes
     */
    public ApplyResult applySelected(String sessionId, Collection<String> selectedChangeIds, String appliedBy) {
        if (selectedChangeIds == null) {
            throw new IllegalArgumentException("selectedChangeIds is required");
        }
        ComparisonSession session = sessionService.requireCompleted(sessionId);
        Instant start = Instant.now();

        try (LogContext ctx = LogContext.forApply(LogContext.generateCorrelationId(), sessionId);
             Span span = tracingService.startSpan(TracingService.APPLY, Map.of("sessionId", sessionId))) {
            Set<String> selected = new LinkedHashSet<>(selectedChangeIds);
            log.info("apply.starting sessionId={} selected={} appliedBy={}", sessionId, selected.size(), appliedBy);
            span.setAttribute("selected", selected.size());

            Map<String, Change> byId = new HashMap<>();
            for (Change change : changeRepository.findBySession(sessionId)) {
                byId.put(change.getId(), change);
            }

            List<ApplyFailure> failures = new ArrayList<>();
            Map<ChangeType, List<Change>> phases = new EnumMap<>(ChangeType.class);
            for (String id : selected) {
                Change change = byId.get(id);
                String rejection = rejectionReason(change);
                if (rejection != null) {
                    log.warn("Skipping selected change {}: {}", id, rejection);
                    failures.add(new ApplyFailure(id, change != null ? change.getChangeType() : null,
                            change != null ? change.getExistingListingId() : null, rejection));
                    continue;
                }
                phases.computeIfAbsent(change.getChangeType(), t -> new ArrayList<>()).add(change);
            }

            Set<String> failedIds = new HashSet<>();
            List<String> appliedIds = new ArrayList<>();
            Map<ChangeType, Integer> appliedByType = new EnumMap<>(ChangeType.class);
            boolean cancelled = false;

            for (ChangeType phase : PHASES) {
                List<Change> batch = phases.getOrDefault(phase, List.of());
                for (int from = 0; from < batch.size() && !cancelled; from += concurrency) {
                    if (Thread.currentThread().isInterrupted()) {
                        cancelled = true;
                        break;
                    }
                    List<Change> chunk = batch.subList(from, Math.min(from + concurrency, batch.size()));
                    List<Outcome> outcomes = runChunk(session, chunk, appliedBy);
                    if (outcomes == null) {
                        cancelled = true;
                        break;
                    }
                    for (Outcome outcome : outcomes) {
                        if (outcome.failure() == null) {
                            appliedIds.add(outcome.change().getId());
                            appliedByType.merge(phase, 1, Integer::sum);
                        } else {
                            failedIds.add(outcome.change().getId());
                            failures.add(outcome.failure());
                        }
                    }
                }
                if (cancelled) {
                    break;
                }
            }

            int discarded = 0;
            if (cancelled) {
                log.warn("apply.cancelled sessionId={} applied={}; unselected changes were left as they are",
                        sessionId, appliedIds.size());
            } else {
                discarded = discardRemaining(sessionId, failedIds, appliedBy);
            }

            if (!appliedIds.isEmpty()) {
                sessionService.markApplied(sessionId, Instant.now());
            }

            ApplyResult result = new ApplyResult(sessionId, appliedIds.size(),
                    appliedByType.getOrDefault(ChangeType.CREATE, 0),
                    appliedByType.getOrDefault(ChangeType.UPDATE, 0),
                    appliedByType.getOrDefault(ChangeType.DELETE, 0),
                    discarded, selected.size(), appliedIds, failures, cancelled);

            recordMetrics(result, start);
            span.setAttribute("applied", result.appliedCount());
            span.setAttribute("failures", result.failures().size());
            span.setStatus(result.hasFailures() || cancelled ? Span.SpanStatus.ERROR : Span.SpanStatus.OK);
            log.info("apply.completed sessionId={} applied={} creates={} updates={} deletes={} discarded={} failures={}",
                    sessionId, result.appliedCount(), result.appliedCreates(), result.appliedUpdates(),
                    result.appliedDeletes(), result.discardedCount(), result.failures().size());
            return result;
        }
    }

    private String rejectionReason(Change change) {
        if (change == null) {
            return "Change does not belong to this session";
        }
        if (!change.getChangeType().isApplicable()) {
            return change.getChangeType().wireName() + " changes cannot be applied";
        }
        if (change.getStatus() != ChangeStatus.PENDING && change.getStatus() != ChangeStatus.APPROVED) {
            return "Change is " + change.getStatus().wireName();
        }
        return null;
    }

    /**
     * Runs one chunk of store operations, concurrently when an executor is configured.
     *
     * @return the outcomes, or null if the calling thread was interrupted while waiting
     */
    private List<Outcome> runChunk(ComparisonSession session, List<Change> chunk, String appliedBy) {
        List<Outcome> outcomes = new ArrayList<>(chunk.size());
        if (executor == null || chunk.size() == 1) {
            for (Change change : chunk) {
                outcomes.add(execute(session, change, appliedBy));
            }
            return outcomes;
        }

        List<CompletableFuture<Outcome>> futures = new ArrayList<>(chunk.size());
        for (Change change : chunk) {
            futures.add(CompletableFuture.supplyAsync(() -> execute(session, change, appliedBy), executor));
        }
        try {
            for (CompletableFuture<Outcome> future : futures) {
                outcomes.add(future.get());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            futures.forEach(f -> f.cancel(true));
            return null;
        } catch (ExecutionException | CancellationException e) {
            throw new IllegalStateException("Apply worker failed unexpectedly", e);
        }
        return outcomes;
    }

    private Outcome execute(ComparisonSession session, Change change, String appliedBy) {
        try {
            String listingId = switch (change.getChangeType()) {
                case CREATE -> create(session.getSellerId(), (CreatePayload) change.getPayload());
                case UPDATE -> update(change.getExistingListingId(), (UpdatePayload) change.getPayload());
                case DELETE -> {
                    listingStore.delete(change.getExistingListingId());
                    yield change.getExistingListingId();
                }
                default -> throw new IllegalStateException("Not applicable: " + change.getChangeType());
            };

            ChangeStore.checkTransition(change, ChangeStatus.APPLIED);
            changeRepository.update(change.toBuilder()
                    .status(ChangeStatus.APPLIED)
                    .existingListingId(listingId)
                    .reviewedAt(Instant.now())
                    .reviewedBy(appliedBy)
                    .build());
            recordAudit(AuditAction.CHANGE_APPLIED, change.getId(), appliedBy, Map.of(
                    "sessionId", change.getSessionId(),
                    "changeType", change.getChangeType().wireName(),
                    "listingId", listingId));
            log.debug("Applied {} change {} to listing {}", change.getChangeType().wireName(), change.getId(), listingId);
            return new Outcome(change, null);
        } catch (RuntimeException e) {
            return fail(change, appliedBy, e);
        }
    }

    private String create(String sellerId, CreatePayload payload) {
        ExistingListing listing = listingStore.insert(sellerId, payload.extracted().attributes(), payload.refs());
        if (!payload.extracted().offers().isEmpty()) {
            listingStore.insertOffers(listing.getId(), offerNormalizer.normalize(payload.extracted().offers()));
        }
        return listing.getId();
    }

    private String update(String listingId, UpdatePayload payload) {
        ExistingListing listing = listingStore.findById(listingId)
                .orElseThrow(() -> new StoreOperationException("Listing not found: " + listingId));

        ListingAttributes.Builder patched = listing.getAttributes().toBuilder();
        for (Map.Entry<String, FieldChange> entry : payload.fieldChanges().entrySet()) {
            TrackedField.fromFieldName(entry.getKey()).write(patched, entry.getValue().newValue());
        }
        ListingAttributes attributes = patched.build();
        TaxonomyRefs current = listing.getRefs() != null
                ? listing.getRefs()
                : new TaxonomyRefs(null, null, null, null, null);
        TaxonomyRefs refs = taxonomyResolver.resolveOptionalRefs(attributes).orElse(current);

        listingStore.patch(listingId, attributes, refs);
        if (payload.offersReplacement() != null) {
            listingStore.replaceOffers(listingId, payload.offersReplacement().newOffers());
        }
        return listingId;
    }

    private Outcome fail(Change change, String appliedBy, RuntimeException e) {
        String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
        log.warn("apply.failed changeId={} type={} listingId={} error={}",
                change.getId(), change.getChangeType().wireName(), change.getExistingListingId(), message);
        try {
            changeRepository.update(change.toBuilder()
                    .reviewNotes("Apply failed: " + message)
                    .build());
        } catch (RuntimeException updateFailure) {
            log.warn("Failed to record apply error on change {}: {}", change.getId(), updateFailure.getMessage());
        }
        recordAudit(AuditAction.CHANGE_APPLY_FAILED, change.getId(), appliedBy, Map.of(
                "sessionId", change.getSessionId(),
                "changeType", change.getChangeType().wireName(),
                "error", message));
        return new Outcome(change, new ApplyFailure(change.getId(), change.getChangeType(),
                change.getExistingListingId(), message));
    }

    private int discardRemaining(String sessionId, Set<String> failedIds, String appliedBy) {
        Instant now = Instant.now();
        List<String> discarded = new ArrayList<>();
        for (Change change : changeRepository.findBySession(sessionId)) {
            boolean open = change.getStatus() == ChangeStatus.PENDING || change.getStatus() == ChangeStatus.APPROVED;
            if (!open || change.isMissingReference() || failedIds.contains(change.getId())) {
                continue;
            }
            changeRepository.update(change.toBuilder()
                    .status(ChangeStatus.DISCARDED)
                    .reviewedAt(now)
                    .reviewedBy(appliedBy)
                    .build());
            discarded.add(change.getId());
        }
        if (!discarded.isEmpty()) {
            recordAudit(AuditAction.CHANGES_DISCARDED, sessionId, appliedBy, Map.of("count", discarded.size()));
        }
        log.debug("Discarded {} unselected changes in session {}", discarded.size(), sessionId);
        return discarded.size();
    }

    private void recordMetrics(ApplyResult result, Instant start) {
        try {
            metricsService.recordApplyDuration(Duration.between(start, Instant.now()));
            for (int i = 0; i < result.appliedCreates(); i++) {
                metricsService.incrementChangeApplied(ChangeType.CREATE);
            }
            for (int i = 0; i < result.appliedUpdates(); i++) {
                metricsService.incrementChangeApplied(ChangeType.UPDATE);
            }
            for (int i = 0; i < result.appliedDeletes(); i++) {
                metricsService.incrementChangeApplied(ChangeType.DELETE);
            }
            for (ApplyFailure failure : result.failures()) {
                if (failure.changeType() != null) {
                    metricsService.incrementApplyFailure(failure.changeType());
                }
            }
            metricsService.recordDiscarded(result.discardedCount());
        } catch (Exception e) {
            log.warn("Failed to record apply metrics: {}", e.getMessage());
        }
    }

    private void recordAudit(AuditAction action, String subjectId, String actorId, Map<String, Object> details) {
        try {
            auditService.record(action, subjectId, actorId, details);
        } catch (Exception e) {
            log.warn("Failed to record audit entry {} for {}: {}", action, subjectId, e.getMessage());
        }
    }

    private record Outcome(Change change, ApplyFailure failure) {}
}
