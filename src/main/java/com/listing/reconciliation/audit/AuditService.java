package com.listing.reconciliation.audit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Append-only trail of reconciliation operations.
 */
public class AuditService {
    private static final Logger log = LoggerFactory.getLogger(AuditService.class);

    public static final String SYSTEM_ACTOR = "SYSTEM";

    private final List<AuditEntry> entries = new CopyOnWriteArrayList<>();

    public AuditEntry record(AuditEntry entry) {
        entries.add(entry);
        log.debug("Audit entry recorded: {} for {} {} by {}", entry.action(),
                entry.subject().name().toLowerCase(Locale.ROOT), entry.subjectId(), entry.actorId());
        return entry;
    }

    public AuditEntry record(AuditAction action, String subjectId, String actorId, Map<String, Object> details) {
        return record(AuditEntry.of(action, subjectId, actorId, details));
    }

    public List<AuditEntry> getAllEntries() {
        return List.copyOf(entries);
    }

    /**
     * Entries filed under {@code subjectId} itself, whatever kind of subject it is.
     */
    public List<AuditEntry> getEntriesFor(String subjectId) {
        return entries.stream().filter(e -> subjectId.equals(e.subjectId())).toList();
    }

    /**
     * The session's history: its own entries plus those of its changes.
     */
    public List<AuditEntry> getSessionHistory(String sessionId) {
        return entries.stream().filter(e -> e.sessionId().filter(sessionId::equals).isPresent()).toList();
    }

    public List<AuditEntry> getChangeHistory(String changeId) {
        return entries.stream().filter(e -> e.concernsChange(changeId)).toList();
    }

    public List<AuditEntry> getEntriesByAction(AuditAction action) {
        return entries.stream().filter(e -> e.action() == action).toList();
    }

    public int size() {
        return entries.size();
    }
}
