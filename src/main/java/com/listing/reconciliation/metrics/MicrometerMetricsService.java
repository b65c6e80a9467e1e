package com.listing.reconciliation.metrics;

import com.listing.reconciliation.core.model.ChangeType;
import com.listing.reconciliation.core.model.MatchMethod;
import com.listing.reconciliation.core.model.SessionStatus;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer-based implementation of {@link MetricsService}.
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code reconciliation.session.build.duration}: Timer (tag: status)</li>
 *   <li>{@code reconciliation.changes.classified}: Counter (tag: changeType)</li>
 *   <li>{@code reconciliation.match.confidence}: DistributionSummary (tag: method)</li>
 *   <li>{@code reconciliation.changes.applied}: Counter (tag: changeType)</li>
 *   <li>{@code reconciliation.apply.failures}: Counter (tag: changeType)</li>
 *   <li>{@code reconciliation.changes.discarded}: Counter</li>
 *   <li>{@code reconciliation.apply.duration}: Timer</li>
 *   <li>{@code reconciliation.missing_references.resolved}: Counter</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final MeterRegistry registry;
    private final Map<String, Timer> timerCache = new ConcurrentHashMap<>();
    private final Map<String, Counter> counterCache = new ConcurrentHashMap<>();
    private final Map<MatchMethod, DistributionSummary> confidenceSummaries = new ConcurrentHashMap<>();
    private final Counter discardedCounter;
    private final Counter resolvedCounter;
    private final Timer applyTimer;

    public MicrometerMetricsService(MeterRegistry registry) {
        this.registry = registry;
        this.discardedCounter = Counter.builder("reconciliation.changes.discarded")
                .description("Changes discarded because they were not selected for application")
                .register(registry);
        this.resolvedCounter = Counter.builder("reconciliation.missing_references.resolved")
                .description("Missing-reference changes re-classified as creates")
                .register(registry);
        this.applyTimer = Timer.builder("reconciliation.apply.duration")
                .description("Duration of applySelected runs")
                .register(registry);
    }

    @Override
    public void recordSessionBuild(SessionStatus outcome, Duration duration) {
        timerCache.computeIfAbsent("build:" + outcome.name(), k ->
                Timer.builder("reconciliation.session.build.duration")
                        .description("Duration of comparison session builds")
                        .tag("status", outcome.name())
                        .register(registry))
                .record(duration);
    }

    @Override
    public void recordChangesClassified(ChangeType type, int count) {
        counter("reconciliation.changes.classified", "Changes produced by classification", type)
                .increment(count);
    }

    @Override
    public void recordMatchConfidence(MatchMethod method, double confidence) {
        confidenceSummaries.computeIfAbsent(method, m ->
                DistributionSummary.builder("reconciliation.match.confidence")
                        .description("Confidence of accepted matches")
                        .tag("method", m.name())
                        .register(registry))
                .record(confidence);
    }

    @Override
    public void incrementChangeApplied(ChangeType type) {
        counter("reconciliation.changes.applied", "Changes committed to the listing store", type).increment();
    }

    @Override
    public void incrementApplyFailure(ChangeType type) {
        counter("reconciliation.apply.failures", "Selected changes whose store operation failed", type).increment();
    }

    @Override
    public void recordDiscarded(int count) {
        discardedCounter.increment(count);
    }

    @Override
    public void recordApplyDuration(Duration duration) {
        applyTimer.record(duration);
    }

    @Override
    public void recordMissingReferencesResolved(int count) {
        resolvedCounter.increment(count);
    }

    private Counter counter(String name, String description, ChangeType type) {
        return counterCache.computeIfAbsent(name + ":" + type.name(), k ->
                Counter.builder(name)
                        .description(description)
                        .tag("changeType", type.name())
                        .register(registry));
    }
}
