package com.listing.reconciliation.metrics;

import com.listing.reconciliation.core.model.ChangeType;
import com.listing.reconciliation.core.model.MatchMethod;
import com.listing.reconciliation.core.model.SessionStatus;

import java.time.Duration;

/**
 * Records reconciliation metrics. {@link NoOpMetricsService} is used when no registry is
 * configured.
 */
public interface MetricsService {

    /**
     * @param outcome {@link SessionStatus#COMPLETED} or {@link SessionStatus#FAILED}
     */
    void recordSessionBuild(SessionStatus outcome, Duration duration);

    void recordChangesClassified(ChangeType type, int count);

    void recordMatchConfidence(MatchMethod method, double confidence);

    void incrementChangeApplied(ChangeType type);

    void incrementApplyFailure(ChangeType type);

    void recordDiscarded(int count);

    void recordApplyDuration(Duration duration);

    void recordMissingReferencesResolved(int count);
}
