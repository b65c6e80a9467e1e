package com.listing.reconciliation.review;

import com.listing.reconciliation.audit.AuditAction;
import com.listing.reconciliation.audit.AuditService;
import com.listing.reconciliation.classify.ChangeSummaries;
import com.listing.reconciliation.core.model.Change;
import com.listing.reconciliation.core.model.ChangeStatus;
import com.listing.reconciliation.core.model.ChangeType;
import com.listing.reconciliation.core.model.CreatePayload;
import com.listing.reconciliation.core.model.MissingReferencePayload;
import com.listing.reconciliation.logging.LogContext;
import com.listing.reconciliation.metrics.MetricsService;
import com.listing.reconciliation.session.ComparisonSessionService;
import com.listing.reconciliation.session.SessionNotFoundException;
import com.listing.reconciliation.store.ChangeRepository;
import com.listing.reconciliation.taxonomy.TaxonomyResolution;
import com.listing.reconciliation.taxonomy.TaxonomyResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Review lifecycle of individual changes.
 *
 * <pre>
 * pending  -> approved | rejected | applied | discarded
 * approved -> applied | discarded
 * </pre>
 *
 * <p>Every transition records the reviewer and {@code reviewedAt}. Missing-reference changes
 * take part in no transition; they only leave that state through
 * {@link #resolveMissingReference}, the single operation that rewrites a change's type.</p>
 */
public class ChangeStore {
    private static final Logger log = LoggerFactory.getLogger(ChangeStore.class);

    private final ChangeRepository changeRepository;
    private final ComparisonSessionService sessionService;
    private final TaxonomyResolver taxonomyResolver;
    private final AuditService auditService;
    private final MetricsService metricsService;

    public ChangeStore(ChangeRepository changeRepository, ComparisonSessionService sessionService,
                       TaxonomyResolver taxonomyResolver, AuditService auditService,
                       MetricsService metricsService) {
        this.changeRepository = changeRepository;
        this.sessionService = sessionService;
        this.taxonomyResolver = taxonomyResolver;
        this.auditService = auditService;
        this.metricsService = metricsService;
    }

    public Change getChange(String changeId) {
        if (changeId == null || changeId.isBlank()) {
            throw new IllegalArgumentException("changeId must not be blank");
        }
        return changeRepository.findById(changeId).orElseThrow(() -> new ChangeNotFoundException(changeId));
    }

    /**
     * Moves a change to {@code target}.
     *
     * @param reviewer who acted; recorded on the change
     * @param notes    optional review notes; existing notes are kept when null
     * @return the updated change
     * @throws InvalidStateTransitionException if the state machine forbids the transition or
     *                                         the change is a missing reference
     */
    public Change transition(String changeId, ChangeStatus target, String reviewer, String notes) {
        if (target == null) {
            throw new IllegalArgumentException("target status is required");
        }
        try (LogContext ctx = LogContext.forReview(changeId)) {
            Change change = getChange(changeId);
            sessionService.requireCompleted(change.getSessionId());
            checkTransition(change, target);

            Change updated = changeRepository.update(change.toBuilder()
                    .status(target)
                    .reviewedAt(Instant.now())
                    .reviewedBy(reviewer)
                    .reviewNotes(notes != null ? notes : change.getReviewNotes())
                    .build());

            recordAudit(AuditAction.CHANGE_STATUS_CHANGED, changeId, reviewer, Map.of(
                    "sessionId", change.getSessionId(),
                    "from", change.getStatus().wireName(),
                    "to", target.wireName()));
            log.info("change.status.changed changeId={} type={} from={} to={} reviewer={}",
                    changeId, change.getChangeType().wireName(), change.getStatus().wireName(),
                    target.wireName(), reviewer);
            return updated;
        }
    }

    /**
     * Fails without side effect unless {@code change} may move to {@code target}.
     */
    public static void checkTransition(Change change, ChangeStatus target) {
        if (change.isMissingReference()) {
            throw InvalidStateTransitionException.missingReference(change.getId(), change.getStatus(), target);
        }
        if (!change.getStatus().canTransitionTo(target)) {
            throw InvalidStateTransitionException.notAllowed(change.getId(), change.getStatus(), target);
        }
    }

    /**
     * Re-classifies pending missing-reference changes as creates after the model
     * {@code modelName} was registered under {@code makeId}.
     *
     * <p>A change qualifies when its missing model matches {@code modelName}
     * case-insensitively under the same make. Cached model lookups of the make are dropped first,
     * since the model may have been created outside this engine. Each qualifying change is then
     * re-resolved against the taxonomy; a change whose lookup still fails is left untouched.
     * Summaries of the affected sessions are recounted.</p>
     *
     * @param sessionId restricts the operation to one session; null re-classifies across all
     *                  completed sessions
     * @return ids of the re-classified changes
     */
    public List<String> resolveMissingReference(String sessionId, String makeId, String modelName) {
        if (makeId == null || makeId.isBlank() || modelName == null || modelName.isBlank()) {
            throw new IllegalArgumentException("makeId and modelName must not be blank");
        }
        taxonomyResolver.getLookup().invalidateModels(makeId);
        List<Change> pool = sessionId != null
                ? changeRepository.findBySession(sessionService.requireCompleted(sessionId).getId())
                : changeRepository.findByType(ChangeType.MISSING_REFERENCE);

        List<String> resolved = new ArrayList<>();
        Set<String> touchedSessions = new LinkedHashSet<>();
        Map<String, Integer> skipped = new HashMap<>();
        Map<String, Boolean> completedSessions = new HashMap<>();
        for (Change change : pool) {
            if (!change.isMissingReference() || !change.isPending()) {
                continue;
            }
            if (sessionId == null && !completedSessions.computeIfAbsent(change.getSessionId(), this::isCompleted)) {
                continue;
            }
            MissingReferencePayload payload = (MissingReferencePayload) change.getPayload();
            if (!payload.missing().isSatisfiedBy(makeId, modelName)) {
                continue;
            }
            TaxonomyResolution resolution = taxonomyResolver.resolve(payload.extracted().attributes());
            if (!resolution.isResolved()) {
                log.warn("Change {} still has an unresolved reference after registering '{}': {}",
                        change.getId(), modelName, resolution.missing());
                skipped.merge(change.getSessionId(), 1, Integer::sum);
                continue;
            }
            reclassifyAsCreate(change, new CreatePayload(payload.extracted(), resolution.refs(),
                    resolution.unresolvedAttributes()));
            resolved.add(change.getId());
            touchedSessions.add(change.getSessionId());
        }

        for (String touched : touchedSessions) {
            sessionService.recountSummary(touched);
        }
        if (!resolved.isEmpty()) {
            metricsService.recordMissingReferencesResolved(resolved.size());
            Map<String, Object> details = new HashMap<>();
            details.put("modelName", modelName.trim());
            details.put("changeIds", List.copyOf(resolved));
            if (sessionId != null) {
                details.put("sessionId", sessionId);
            }
            recordAudit(AuditAction.MISSING_REFERENCE_RESOLVED, makeId, AuditService.SYSTEM_ACTOR, details);
        }
        log.info("missing_reference.resolved makeId={} model='{}' resolved={} skipped={} sessions={}",
                makeId, modelName.trim(), resolved.size(), skipped.values().stream().mapToInt(Integer::intValue).sum(),
                touchedSessions.size());
        return resolved;
    }

    private boolean isCompleted(String sessionId) {
        try {
            return sessionService.getSession(sessionId).isCompleted();
        } catch (SessionNotFoundException e) {
            log.warn("Skipping missing_reference changes of unknown session {}", sessionId);
            return false;
        }
    }

    private void reclassifyAsCreate(Change change, CreatePayload payload) {
        changeRepository.reclassify(change.getId(), payload, ChangeSummaries.describe(payload));
        log.debug("Change {} re-classified from {} to {}", change.getId(),
                ChangeType.MISSING_REFERENCE.wireName(), ChangeType.CREATE.wireName());
    }

    private void recordAudit(AuditAction action, String subjectId, String actorId, Map<String, Object> details) {
        try {
            auditService.record(action, subjectId, actorId, details);
        } catch (Exception e) {
            log.warn("Failed to record audit entry {} for {}: {}", action, subjectId, e.getMessage());
        }
    }
}
