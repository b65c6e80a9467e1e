package com.listing.reconciliation.cdi;

import com.listing.reconciliation.api.ReconciliationOptions;
import com.listing.reconciliation.api.ReconciliationService;
import com.listing.reconciliation.audit.AuditService;
import com.listing.reconciliation.cache.CacheConfig;
import com.listing.reconciliation.metrics.MetricsService;
import com.listing.reconciliation.metrics.MicrometerMetricsService;
import com.listing.reconciliation.metrics.NoOpMetricsService;
import com.listing.reconciliation.store.InMemoryListingStore;
import com.listing.reconciliation.store.ListingStore;
import com.listing.reconciliation.taxonomy.InMemoryTaxonomy;
import com.listing.reconciliation.taxonomy.TaxonomyLookup;
import com.listing.reconciliation.tracing.NoOpTracingService;
import com.listing.reconciliation.tracing.OpenTelemetryTracingService;
import com.listing.reconciliation.tracing.TracingService;
import io.micrometer.core.instrument.MeterRegistry;
import io.opentelemetry.api.GlobalOpenTelemetry;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Disposes;
import jakarta.enterprise.inject.Instance;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * CDI producer that wires the reconciliation engine from MicroProfile Config properties.
 *
 * <p>The hosting application supplies the {@link ListingStore} and {@link TaxonomyLookup}
 * beans for its database. When none are present, in-memory implementations are used. A
 * {@link MeterRegistry} bean, when present, enables Micrometer metrics.</p>
 *
 * <pre>
 * listing-reconciliation:
 *   matching:
 *     fuzzy-floor: 0.70
 *     composite-key-confidence: 0.95
 *     horsepower-tolerance: 5
 *     parallel: false
 *   offers:
 *     default-period-months: 36
 *     default-mileage-per-year: 15000
 *   apply:
 *     concurrency: 4
 *     default-reviewer: admin
 *   cache:
 *     enabled: true
 *     max-size: 5000
 *     ttl-seconds: 600
 *   tracing:
 *     enabled: false
 * </pre>
 */
@ApplicationScoped
public class ReconciliationProducer {

    private static final Logger log = LoggerFactory.getLogger(ReconciliationProducer.class);

    static final String INSTRUMENTATION_NAME = "listing-reconciliation";

    // ── Matching ──────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "listing-reconciliation.matching.fuzzy-floor", defaultValue = "0.70")
    double fuzzyFloor;

    @Inject
    @ConfigProperty(name = "listing-reconciliation.matching.composite-key-confidence", defaultValue = "0.95")
    double compositeKeyConfidence;

    @Inject
    @ConfigProperty(name = "listing-reconciliation.matching.horsepower-tolerance", defaultValue = "5")
    int horsepowerTolerance;

    @Inject
    @ConfigProperty(name = "listing-reconciliation.matching.parallel", defaultValue = "false")
    boolean parallelMatching;

    // ── Offers ────────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "listing-reconciliation.offers.default-period-months", defaultValue = "36")
    int defaultPeriodMonths;

    @Inject
    @ConfigProperty(name = "listing-reconciliation.offers.default-mileage-per-year", defaultValue = "15000")
    int defaultMileagePerYear;

    // ── Apply ─────────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "listing-reconciliation.apply.concurrency", defaultValue = "1")
    int applyConcurrency;

    @Inject
    @ConfigProperty(name = "listing-reconciliation.apply.default-reviewer", defaultValue = "admin")
    String defaultReviewer;

    // ── Cache ─────────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "listing-reconciliation.cache.enabled", defaultValue = "true")
    boolean cacheEnabled;

    @Inject
    @ConfigProperty(name = "listing-reconciliation.cache.max-size", defaultValue = "5000")
    int cacheMaxSize;

    @Inject
    @ConfigProperty(name = "listing-reconciliation.cache.ttl-seconds", defaultValue = "600")
    int cacheTtlSeconds;

    // ── Tracing ───────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "listing-reconciliation.tracing.enabled", defaultValue = "false")
    boolean tracingEnabled;

    private ExecutorService executor;

    // ══════════════════════════════════════════════════════════
    //  Producers
    // ══════════════════════════════════════════════════════════

    @Produces
    @ApplicationScoped
    public ReconciliationService reconciliationService(Instance<ListingStore> listingStores,
                                                       Instance<TaxonomyLookup> taxonomyLookups,
                                                       Instance<MeterRegistry> meterRegistries) {
        ListingStore store = listingStores.isResolvable() ? listingStores.get() : null;
        TaxonomyLookup lookup = taxonomyLookups.isResolvable() ? taxonomyLookups.get() : null;
        MeterRegistry registry = meterRegistries.isResolvable() ? meterRegistries.get() : null;
        return createService(store, lookup, registry);
    }

    public void closeService(@Disposes ReconciliationService service) {
        if (executor != null) {
            log.info("Shutting down reconciliation executor");
            executor.shutdown();
            try {
                if (!executor.awaitTermination(30, TimeUnit.SECONDS)) {
                    executor.shutdownNow();
                }
            } catch (InterruptedException e) {
                executor.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
    }

    @Produces
    @ApplicationScoped
    public AuditService auditService(ReconciliationService service) {
        return service.getAuditService();
    }

    // ══════════════════════════════════════════════════════════
    //  Internal
    // ══════════════════════════════════════════════════════════

    ReconciliationService createService(ListingStore store, TaxonomyLookup lookup, MeterRegistry registry) {
        ReconciliationOptions options = options();
        log.info("Producing ReconciliationService: options={} cache={}", options, cacheEnabled);

        ReconciliationService.Builder builder = ReconciliationService.builder()
                .options(options)
                .listingStore(store != null ? store : new InMemoryListingStore())
                .taxonomyLookup(lookup != null ? lookup : new InMemoryTaxonomy())
                .cacheConfig(cacheConfig())
                .metricsService(metricsService(registry))
                .tracingService(tracingService());

        if (store == null || lookup == null) {
            log.warn("No ListingStore or TaxonomyLookup bean found, using in-memory implementations");
        }
        if (parallelMatching || applyConcurrency > 1) {
            executor = Executors.newFixedThreadPool(Math.max(2, applyConcurrency));
            builder.executor(executor);
        }
        return builder.build();
    }

    ReconciliationOptions options() {
        return ReconciliationOptions.builder()
                .fuzzyConfidenceFloor(fuzzyFloor)
                .compositeKeyConfidence(compositeKeyConfidence)
                .horsepowerTolerance(horsepowerTolerance)
                .defaultPeriodMonths(defaultPeriodMonths)
                .defaultMileagePerYear(defaultMileagePerYear)
                .parallelMatching(parallelMatching)
                .applyConcurrency(applyConcurrency)
                .defaultReviewer(defaultReviewer)
                .build();
    }

    CacheConfig cacheConfig() {
        return cacheEnabled ? new CacheConfig(cacheMaxSize, cacheTtlSeconds, true) : CacheConfig.disabled();
    }

    MetricsService metricsService(MeterRegistry registry) {
        if (registry == null) {
            log.info("No MeterRegistry bean found, metrics disabled");
            return new NoOpMetricsService();
        }
        return new MicrometerMetricsService(registry);
    }

    TracingService tracingService() {
        if (!tracingEnabled) {
            return new NoOpTracingService();
        }
        return new OpenTelemetryTracingService(GlobalOpenTelemetry.getTracer(INSTRUMENTATION_NAME));
    }
}
