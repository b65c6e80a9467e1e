package com.listing.reconciliation.session;

import com.listing.reconciliation.api.ChangeFilter;
import com.listing.reconciliation.api.Page;
import com.listing.reconciliation.api.PageRequest;
import com.listing.reconciliation.audit.AuditAction;
import com.listing.reconciliation.audit.AuditService;
import com.listing.reconciliation.classify.ChangeClassifier;
import com.listing.reconciliation.classify.Changeset;
import com.listing.reconciliation.classify.ProposedChange;
import com.listing.reconciliation.core.model.Candidate;
import com.listing.reconciliation.core.model.Change;
import com.listing.reconciliation.core.model.ChangeStatus;
import com.listing.reconciliation.core.model.ChangeType;
import com.listing.reconciliation.core.model.ComparisonSession;
import com.listing.reconciliation.core.model.ExistingListing;
import com.listing.reconciliation.core.model.ExtractionMetadata;
import com.listing.reconciliation.core.model.ExtractionType;
import com.listing.reconciliation.core.model.MatchMethod;
import com.listing.reconciliation.core.model.SessionStatus;
import com.listing.reconciliation.core.model.SessionSummary;
import com.listing.reconciliation.logging.LogContext;
import com.listing.reconciliation.metrics.MetricsService;
import com.listing.reconciliation.metrics.NoOpMetricsService;
import com.listing.reconciliation.store.ChangeRepository;
import com.listing.reconciliation.store.SessionRepository;
import com.listing.reconciliation.tracing.NoOpTracingService;
import com.listing.reconciliation.tracing.Span;
import com.listing.reconciliation.tracing.TracingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Builds comparison sessions and serves their changes.
 *
 * <p>A build runs the classifier once over the full candidate and listing sets and persists
 * the session together with all of its changes. The session is saved as {@code PROCESSING}
 * first, the changes are written in one batch, and only then is the session marked
 * {@code COMPLETED}. If anything fails the session is marked {@code FAILED} and reads of its
 * changes are refused.</p>
 */
public class ComparisonSessionService {
    private static final Logger log = LoggerFactory.getLogger(ComparisonSessionService.class);

    private final ChangeClassifier classifier;
    private final SessionRepository sessionRepository;
    private final ChangeRepository changeRepository;
    private final AuditService auditService;
    private final MetricsService metricsService;
    private final TracingService tracingService;

    public ComparisonSessionService(ChangeClassifier classifier, SessionRepository sessionRepository,
                                    ChangeRepository changeRepository, AuditService auditService) {
        this(classifier, sessionRepository, changeRepository, auditService,
                new NoOpMetricsService(), new NoOpTracingService());
    }

    public ComparisonSessionService(ChangeClassifier classifier, SessionRepository sessionRepository,
                                    ChangeRepository changeRepository, AuditService auditService,
                                    MetricsService metricsService, TracingService tracingService) {
        this.classifier = classifier;
        this.sessionRepository = sessionRepository;
        this.changeRepository = changeRepository;
        this.auditService = auditService;
        this.metricsService = metricsService;
        this.tracingService = tracingService;
    }

    /**
     * Classifies {@code candidates} against {@code existing} and persists the result as a new
     * session.
     *
     * @return the completed session with its summary
     * @throws SessionBuildException if classification or persistence fails
     */
    public ComparisonSession build(List<Candidate> candidates, List<ExistingListing> existing,
                                   String sellerId, String sessionName, ExtractionType extractionType,
                                   ExtractionMetadata metadata) {
        requireNonBlank(sellerId, "sellerId");
        requireNonBlank(sessionName, "sessionName");
        if (candidates == null || existing == null) {
            throw new IllegalArgumentException("candidates and existing listings are required");
        }

        String correlationId = LogContext.generateCorrelationId();
        Instant start = Instant.now();
        ComparisonSession session = sessionRepository.save(ComparisonSession.builder()
                .sessionName(sessionName)
                .sellerId(sellerId)
                .extractionType(extractionType)
                .extractionMetadata(metadata)
                .status(SessionStatus.PROCESSING)
                .createdAt(start)
                .build());

        try (LogContext ctx = LogContext.forSessionBuild(correlationId, sellerId).with("sessionId", session.getId());
             Span span = tracingService.startSpan(TracingService.SESSION_BUILD,
                     Map.of("sessionId", session.getId(), "sellerId", sellerId))) {
            log.info("session.building sessionId={} candidates={} existing={}",
                    session.getId(), candidates.size(), existing.size());
            span.setAttribute("candidates", candidates.size());
            span.setAttribute("existing", existing.size());
            try {
                Changeset changeset = classifier.classify(candidates, existing);
                List<Change> changes = toChanges(session.getId(), changeset, start);
                changeRepository.saveAll(changes);

                SessionSummary summary = SessionSummary.of(changes, changeset.totalExtracted(),
                        changeset.totalExisting());
                ComparisonSession completed = sessionRepository.update(session.toBuilder()
                        .status(SessionStatus.COMPLETED)
                        .summary(summary)
                        .build());

                recordBuildMetrics(changeset, start);
                recordAudit(AuditAction.SESSION_BUILT, completed.getId(), Map.of(
                        "sellerId", sellerId,
                        "totalChanges", changes.size(),
                        "conflicts", changeset.conflicts().size()));
                span.setStatus(Span.SpanStatus.OK);
                log.info("session.completed sessionId={} new={} updated={} deleted={} unchanged={} missing={}",
                        completed.getId(), summary.totalNew(), summary.totalUpdated(), summary.totalDeleted(),
                        summary.totalUnchanged(), summary.totalMissingReferences());
                return completed;
            } catch (RuntimeException e) {
                span.recordException(e);
                span.setStatus(Span.SpanStatus.ERROR);
                markFailed(session, e);
                metricsService.recordSessionBuild(SessionStatus.FAILED, Duration.between(start, Instant.now()));
                throw new SessionBuildException(session.getId(), e);
            }
        }
    }

    /**
     * Returns the session's changes ordered by change type, then extraction order.
     *
     * @throws SessionNotFoundException    if the session does not exist
     * @throws SessionUnavailableException if the session did not complete
     */
    public List<Change> listChanges(String sessionId, ChangeFilter filter) {
        requireCompleted(sessionId);
        ChangeFilter effective = filter != null ? filter : ChangeFilter.all();
        return changeRepository.findBySession(sessionId).stream()
                .filter(effective::matches)
                .toList();
    }

    public Page<Change> listChanges(String sessionId, ChangeFilter filter, PageRequest page) {
        return Page.slice(listChanges(sessionId, filter), page);
    }

    public ComparisonSession getSession(String sessionId) {
        requireNonBlank(sessionId, "sessionId");
        return sessionRepository.findById(sessionId)
                .orElseThrow(() -> new SessionNotFoundException(sessionId));
    }

    /**
     * Returns the seller's sessions, newest first.
     */
    public List<ComparisonSession> listSessions(String sellerId) {
        requireNonBlank(sellerId, "sellerId");
        return sessionRepository.findBySeller(sellerId);
    }

    /**
     * Counts the session's changes per status, for review progress.
     */
    public Map<ChangeStatus, Long> countByStatus(String sessionId) {
        Map<ChangeStatus, Long> counts = new EnumMap<>(ChangeStatus.class);
        for (ChangeStatus status : ChangeStatus.values()) {
            counts.put(status, 0L);
        }
        for (Change change : listChanges(sessionId, ChangeFilter.all())) {
            counts.merge(change.getStatus(), 1L, Long::sum);
        }
        return counts;
    }

    /**
     * Returns the session if it completed.
     *
     * @throws SessionNotFoundException    if the session does not exist
     * @throws SessionUnavailableException if the session did not complete
     */
    public ComparisonSession requireCompleted(String sessionId) {
        ComparisonSession session = getSession(sessionId);
        if (!session.isCompleted()) {
            throw new SessionUnavailableException(sessionId, session.getStatus());
        }
        return session;
    }

    /**
     * Recomputes the per-type summary counts from the changes currently stored.
     */
    public synchronized ComparisonSession recountSummary(String sessionId) {
        ComparisonSession session = getSession(sessionId);
        SessionSummary summary = session.getSummary().recount(changeRepository.findBySession(sessionId));
        return sessionRepository.update(session.toBuilder().summary(summary).build());
    }

    /**
     * Sets {@code appliedAt} the first time a change of the session is committed.
     */
    public synchronized ComparisonSession markApplied(String sessionId, Instant appliedAt) {
        ComparisonSession session = getSession(sessionId);
        if (session.getAppliedAt() != null) {
            return session;
        }
        return sessionRepository.update(session.toBuilder().appliedAt(appliedAt).build());
    }

    private List<Change> toChanges(String sessionId, Changeset changeset, Instant createdAt) {
        List<Change> changes = new ArrayList<>(changeset.changes().size());
        for (ProposedChange proposed : changeset.changes()) {
            changes.add(Change.builder()
                    .sessionId(sessionId)
                    .position(proposed.position())
                    .payload(proposed.payload())
                    .existingListingId(proposed.existingListingId())
                    .matchMethod(proposed.matchMethod())
                    .confidenceScore(proposed.confidence())
                    .status(ChangeStatus.PENDING)
                    .changeSummary(proposed.summary())
                    .createdAt(createdAt)
                    .build());
        }
        return changes;
    }

    private void markFailed(ComparisonSession session, RuntimeException cause) {
        log.error("session.failed sessionId={} error={}", session.getId(), cause.getMessage(), cause);
        try {
            sessionRepository.update(session.toBuilder()
                    .status(SessionStatus.FAILED)
                    .failureReason(cause.getMessage())
                    .build());
        } catch (RuntimeException e) {
            log.warn("Failed to mark session {} as failed: {}", session.getId(), e.getMessage());
        }
        recordAudit(AuditAction.SESSION_FAILED, session.getId(),
                Map.of("error", String.valueOf(cause.getMessage())));
    }

    private void recordBuildMetrics(Changeset changeset, Instant start) {
        try {
            metricsService.recordSessionBuild(SessionStatus.COMPLETED, Duration.between(start, Instant.now()));
            for (ChangeType type : ChangeType.values()) {
                metricsService.recordChangesClassified(type, (int) changeset.countOf(type));
            }
            for (ProposedChange change : changeset.changes()) {
                if (change.matchMethod() != MatchMethod.NONE) {
                    metricsService.recordMatchConfidence(change.matchMethod(), change.confidence());
                }
            }
        } catch (Exception e) {
            log.warn("Failed to record session build metrics: {}", e.getMessage());
        }
    }

    private void recordAudit(AuditAction action, String sessionId, Map<String, Object> details) {
        try {
            auditService.record(action, sessionId, AuditService.SYSTEM_ACTOR, details);
        } catch (Exception e) {
            log.warn("Failed to record audit entry {} for session {}: {}", action, sessionId, e.getMessage());
        }
    }

    private static void requireNonBlank(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " must not be blank");
        }
    }
}
