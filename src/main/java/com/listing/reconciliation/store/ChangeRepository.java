package com.listing.reconciliation.store;

import com.listing.reconciliation.core.model.Change;
import com.listing.reconciliation.core.model.ChangeType;
import com.listing.reconciliation.core.model.CreatePayload;

import java.util.List;
import java.util.Optional;

/**
 * Persistence for changes. Payloads are stored as JSON blobs and validated against the
 * change type when read back.
 */
public interface ChangeRepository {

    /**
     * Persists a batch of new changes. Either every change becomes visible or none does.
     *
     * @throws StoreOperationException if any change cannot be stored
     */
    void saveAll(List<Change> changes);

    Optional<Change> findById(String changeId);

    /**
     * Returns the changes of a session ordered by change type, then by position.
     */
    List<Change> findBySession(String sessionId);

    /**
     * Returns changes of the given type across all sessions, in creation order.
     */
    List<Change> findByType(ChangeType type);

    /**
     * Replaces a stored change with a new version of the same id. The change type is fixed once
     * stored; only {@link #reclassify} changes it.
     *
     * @throws StoreOperationException if the change does not exist or its type would change
     */
    Change update(Change change);

    /**
     * Turns a pending missing-reference change into a create carrying {@code payload}.
     *
     * @param changeSummary the summary line describing the create
     * @return the re-classified change
     * @throws StoreOperationException if the change does not exist, is not a missing reference,
     *                                 or is no longer pending
     */
    Change reclassify(String changeId, CreatePayload payload, String changeSummary);
}
