package com.listing.reconciliation.audit;

/**
 * Auditable reconciliation operations, each tied to the kind of record it is filed under.
 */
public enum AuditAction {
    SESSION_BUILT(AuditSubject.SESSION),
    SESSION_FAILED(AuditSubject.SESSION),
    CHANGE_STATUS_CHANGED(AuditSubject.CHANGE),
    CHANGE_APPLIED(AuditSubject.CHANGE),
    CHANGE_APPLY_FAILED(AuditSubject.CHANGE),
    CHANGES_DISCARDED(AuditSubject.SESSION),
    MISSING_REFERENCE_RESOLVED(AuditSubject.MAKE),
    LISTINGS_MARKED_FOR_DELETION(AuditSubject.SESSION);

    private final AuditSubject subject;

    AuditAction(AuditSubject subject) {
        this.subject = subject;
    }

    public AuditSubject subject() {
        return subject;
    }
}
