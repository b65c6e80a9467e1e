package com.listing.reconciliation.metrics;

import com.listing.reconciliation.core.model.ChangeType;
import com.listing.reconciliation.core.model.MatchMethod;
import com.listing.reconciliation.core.model.SessionStatus;

import java.time.Duration;

public class NoOpMetricsService implements MetricsService {

    @Override
    public void recordSessionBuild(SessionStatus outcome, Duration duration) {
    }

    @Override
    public void recordChangesClassified(ChangeType type, int count) {
    }

    @Override
    public void recordMatchConfidence(MatchMethod method, double confidence) {
    }

    @Override
    public void incrementChangeApplied(ChangeType type) {
    }

    @Override
    public void incrementApplyFailure(ChangeType type) {
    }

    @Override
    public void recordDiscarded(int count) {
    }

    @Override
    public void recordApplyDuration(Duration duration) {
    }

    @Override
    public void recordMissingReferencesResolved(int count) {
    }
}
