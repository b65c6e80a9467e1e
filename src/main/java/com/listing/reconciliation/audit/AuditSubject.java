package com.listing.reconciliation.audit;

/**
 * What the {@code subjectId} of an {@link AuditEntry} identifies.
 */
public enum AuditSubject {
    SESSION,
    CHANGE,
    /** A make whose model set changed; the affected session, if any, is in the details. */
    MAKE
}
