package com.listing.reconciliation.audit;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * One line of the reconciliation trail.
 *
 * <p>{@code subjectId} is a session id, a change id or a make id depending on
 * {@link AuditAction#subject()}. Change-level entries carry their session under the
 * {@value #SESSION_ID} detail so a session's full history can be read back.</p>
 *
 * @param actorId reviewer, or {@link AuditService#SYSTEM_ACTOR} for engine-initiated actions
 */
public record AuditEntry(
        String id,
        AuditAction action,
        String subjectId,
        String actorId,
        Map<String, Object> details,
        Instant recordedAt
) {
    public static final String SESSION_ID = "sessionId";
    public static final String CHANGE_IDS = "changeIds";

    public AuditEntry {
        Objects.requireNonNull(id, "id is required");
        Objects.requireNonNull(action, "action is required");
        Objects.requireNonNull(subjectId, "subjectId is required");
        Objects.requireNonNull(recordedAt, "recordedAt is required");
        actorId = actorId != null && !actorId.isBlank() ? actorId : AuditService.SYSTEM_ACTOR;
        details = details != null ? Map.copyOf(details) : Map.of();
    }

    public static AuditEntry of(AuditAction action, String subjectId, String actorId, Map<String, Object> details) {
        return new AuditEntry(UUID.randomUUID().toString(), action, subjectId, actorId, details, Instant.now());
    }

    public AuditSubject subject() {
        return action.subject();
    }

    /**
     * The session this entry belongs to, when it belongs to one.
     */
    public Optional<String> sessionId() {
        if (subject() == AuditSubject.SESSION) {
            return Optional.of(subjectId);
        }
        return details.get(SESSION_ID) instanceof String sessionId ? Optional.of(sessionId) : Optional.empty();
    }

    /**
     * Whether this entry concerns {@code changeId}, either as its subject or as one of the
     * changes a batch operation touched.
     */
    public boolean concernsChange(String changeId) {
        if (subject() == AuditSubject.CHANGE) {
            return subjectId.equals(changeId);
        }
        return details.get(CHANGE_IDS) instanceof List<?> changeIds && changeIds.contains(changeId);
    }

    public boolean isSystemAction() {
        return AuditService.SYSTEM_ACTOR.equals(actorId);
    }
}
