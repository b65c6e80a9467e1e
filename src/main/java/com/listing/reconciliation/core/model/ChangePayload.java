package com.listing.reconciliation.core.model;

/**
 * Type-specific content of a change. Each change type has exactly one payload type:
 * <ul>
 *   <li>{@link ChangeType#CREATE} - {@link CreatePayload}</li>
 *   <li>{@link ChangeType#UPDATE} - {@link UpdatePayload}</li>
 *   <li>{@link ChangeType#DELETE} - {@link DeletePayload}</li>
 *   <li>{@link ChangeType#UNCHANGED} - {@link UnchangedPayload}</li>
 *   <li>{@link ChangeType#MISSING_REFERENCE} - {@link MissingReferencePayload}</li>
 * </ul>
 */
public interface ChangePayload {

    ChangeType type();

    /**
     * The extracted candidate that produced the change, or null for deletes.
     */
    Candidate extracted();
}
