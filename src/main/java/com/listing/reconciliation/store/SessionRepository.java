package com.listing.reconciliation.store;

import com.listing.reconciliation.core.model.ComparisonSession;

import java.util.List;
import java.util.Optional;

/**
 * Persistence for comparison sessions.
 */
public interface SessionRepository {

    ComparisonSession save(ComparisonSession session);

    Optional<ComparisonSession> findById(String sessionId);

    /**
     * Returns the seller's sessions, newest first.
     */
    List<ComparisonSession> findBySeller(String sellerId);

    /**
     * Replaces a stored session with a new version of the same id.
     *
     * @throws StoreOperationException if the session does not exist
     */
    ComparisonSession update(ComparisonSession session);
}
