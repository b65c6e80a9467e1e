package com.listing.reconciliation.store;

import com.listing.reconciliation.core.model.ComparisonSession;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * In-memory implementation of {@link SessionRepository}.
 */
public class InMemorySessionRepository implements SessionRepository {

    private final ConcurrentMap<String, ComparisonSession> sessions = new ConcurrentHashMap<>();

    @Override
    public ComparisonSession save(ComparisonSession session) {
        sessions.put(session.getId(), session);
        return session;
    }

    @Override
    public Optional<ComparisonSession> findById(String sessionId) {
        return Optional.ofNullable(sessions.get(sessionId));
    }

    @Override
    public List<ComparisonSession> findBySeller(String sellerId) {
        return sessions.values().stream()
                .filter(session -> session.getSellerId().equals(sellerId))
                .sorted(Comparator.comparing(ComparisonSession::getCreatedAt).reversed())
                .toList();
    }

    @Override
    public ComparisonSession update(ComparisonSession session) {
        if (sessions.replace(session.getId(), session) == null) {
            throw new StoreOperationException("Session not found: " + session.getId());
        }
        return session;
    }
}
