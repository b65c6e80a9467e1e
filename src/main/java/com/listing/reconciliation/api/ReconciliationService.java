package com.listing.reconciliation.api;

import com.listing.reconciliation.apply.ApplyEngine;
import com.listing.reconciliation.apply.ApplyResult;
import com.listing.reconciliation.audit.AuditService;
import com.listing.reconciliation.cache.CacheConfig;
import com.listing.reconciliation.cache.CachingTaxonomyLookup;
import com.listing.reconciliation.classify.ChangeClassifier;
import com.listing.reconciliation.classify.FieldDiffer;
import com.listing.reconciliation.classify.OfferNormalizer;
import com.listing.reconciliation.codec.ChangePayloadCodec;
import com.listing.reconciliation.core.model.Candidate;
import com.listing.reconciliation.core.model.Change;
import com.listing.reconciliation.core.model.ChangeStatus;
import com.listing.reconciliation.core.model.ComparisonSession;
import com.listing.reconciliation.core.model.ExistingListing;
import com.listing.reconciliation.core.model.ExtractionMetadata;
import com.listing.reconciliation.core.model.ExtractionType;
import com.listing.reconciliation.extraction.ExtractionResult;
import com.listing.reconciliation.match.EntityMatcher;
import com.listing.reconciliation.metrics.MetricsService;
import com.listing.reconciliation.metrics.NoOpMetricsService;
import com.listing.reconciliation.review.ChangeStore;
import com.listing.reconciliation.session.ComparisonSessionService;
import com.listing.reconciliation.store.ChangeRepository;
import com.listing.reconciliation.store.InMemoryChangeRepository;
import com.listing.reconciliation.store.InMemoryListingStore;
import com.listing.reconciliation.store.InMemorySessionRepository;
import com.listing.reconciliation.store.ListingStore;
import com.listing.reconciliation.store.SessionRepository;
import com.listing.reconciliation.taxonomy.TaxonomyLookup;
import com.listing.reconciliation.taxonomy.TaxonomyResolver;
import com.listing.reconciliation.tracing.NoOpTracingService;
import com.listing.reconciliation.tracing.TracingService;
import com.listing.reconciliation.unmapped.UnmappedDetector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Executor;

/**
 * Main entry point for listing reconciliation.
 *
 * <p>Wires the matcher, classifier, session, review, apply and unmapped components over a
 * listing store and a taxonomy lookup, and exposes the operations a review UI needs.</p>
 *
 * <pre>
 * ReconciliationService service = ReconciliationService.builder()
 *     .listingStore(store)
 *     .taxonomyLookup(taxonomy)
 *     .build();
 *
 * ComparisonSession session = service.buildSession(candidates, "seller-1", "Price list May");
 * List&lt;Change&gt; updates = service.listChanges(session.getId(), ChangeFilter.ofTypes(ChangeType.UPDATE));
 * ApplyResult result = service.applySelected(session.getId(), List.of(updates.get(0).getId()));
 * </pre>
 */
public class ReconciliationService {
    private static final Logger log = LoggerFactory.getLogger(ReconciliationService.class);

    private final ReconciliationOptions options;
    private final ListingStore listingStore;
    private final TaxonomyLookup taxonomyLookup;
    private final AuditService auditService;
    private final ComparisonSessionService sessionService;
    private final ChangeStore changeStore;
    private final ApplyEngine applyEngine;
    private final UnmappedDetector unmappedDetector;

    private ReconciliationService(Builder builder) {
        this.options = builder.options;
        this.listingStore = builder.listingStore != null ? builder.listingStore : new InMemoryListingStore();
        this.auditService = builder.auditService != null ? builder.auditService : new AuditService();
        MetricsService metricsService = builder.metricsService != null
                ? builder.metricsService : new NoOpMetricsService();
        TracingService tracingService = builder.tracingService != null
                ? builder.tracingService : new NoOpTracingService();

        TaxonomyLookup lookup = Objects.requireNonNull(builder.taxonomyLookup, "taxonomyLookup is required");
        this.taxonomyLookup = builder.cacheConfig.enabled()
                ? new CachingTaxonomyLookup(lookup, builder.cacheConfig) : lookup;
        TaxonomyResolver taxonomyResolver = new TaxonomyResolver(taxonomyLookup);

        ChangeRepository changeRepository = builder.changeRepository != null
                ? builder.changeRepository : new InMemoryChangeRepository(new ChangePayloadCodec());
        SessionRepository sessionRepository = builder.sessionRepository != null
                ? builder.sessionRepository : new InMemorySessionRepository();

        OfferNormalizer offerNormalizer = new OfferNormalizer(options.getDefaultPeriodMonths(),
                options.getDefaultMileagePerYear());
        ChangeClassifier classifier = new ChangeClassifier(new EntityMatcher(options),
                new FieldDiffer(offerNormalizer), taxonomyResolver,
                options.isParallelMatching() ? builder.executor : null);

        this.sessionService = new ComparisonSessionService(classifier, sessionRepository, changeRepository,
                auditService, metricsService, tracingService);
        this.changeStore = new ChangeStore(changeRepository, sessionService, taxonomyResolver,
                auditService, metricsService);
        this.applyEngine = new ApplyEngine(sessionService, changeRepository, listingStore, taxonomyResolver,
                options, auditService, metricsService, tracingService, builder.executor);
        this.unmappedDetector = new UnmappedDetector(sessionService, changeRepository, listingStore, auditService);

        log.info("ReconciliationService initialized with options: {}", options);
    }

    // ========== Sessions ==========

    /**
     * Compares extracted candidates with the seller's current listings and persists the
     * result as a new session.
     *
     * @throws com.listing.reconciliation.session.SessionBuildException if the session could not
     *                                                                 be persisted
     */
    public ComparisonSession buildSession(List<Candidate> candidates, String sellerId, String sessionName) {
        return buildSession(candidates, sellerId, sessionName, ExtractionType.UPDATE, ExtractionMetadata.none());
    }

    public ComparisonSession buildSession(ExtractionResult extraction, String sellerId, String sessionName) {
        return buildSession(extraction.candidates(), sellerId, sessionName, extraction.extractionType(),
                extraction.metadata());
    }

    public ComparisonSession buildSession(List<Candidate> candidates, String sellerId, String sessionName,
                                          ExtractionType extractionType, ExtractionMetadata metadata) {
        if (sellerId == null || sellerId.isBlank()) {
            throw new IllegalArgumentException("sellerId must not be blank");
        }
        List<ExistingListing> existing = listingStore.findBySeller(sellerId);
        return sessionService.build(candidates, existing, sellerId, sessionName, extractionType, metadata);
    }

    public ComparisonSession getSession(String sessionId) {
        return sessionService.getSession(sessionId);
    }

    /**
     * Returns the seller's sessions, newest first.
     */
    public List<ComparisonSession> listSessions(String sellerId) {
        return sessionService.listSessions(sellerId);
    }

    public Map<ChangeStatus, Long> countByStatus(String sessionId) {
        return sessionService.countByStatus(sessionId);
    }

    // ========== Review ==========

    public List<Change> listChanges(String sessionId, ChangeFilter filter) {
        return sessionService.listChanges(sessionId, filter);
    }

    public Page<Change> listChanges(String sessionId, ChangeFilter filter, PageRequest page) {
        return sessionService.listChanges(sessionId, filter, page);
    }

    public Change getChange(String changeId) {
        return changeStore.getChange(changeId);
    }

    /**
     * Sets a change's review status as the configured default reviewer.
     */
    public Change setChangeStatus(String changeId, ChangeStatus status, String notes) {
        return setChangeStatus(changeId, status, notes, options.getDefaultReviewer());
    }

    /**
     * Sets a change's review status.
     *
     * <p>{@code applied} cannot be set directly; changes only become applied through
     * {@link #applySelected}.</p>
     *
     * @throws com.listing.reconciliation.review.InvalidStateTransitionException if the
     *         transition is not allowed
     */
    public Change setChangeStatus(String changeId, ChangeStatus status, String notes, String reviewer) {
        if (status == ChangeStatus.APPLIED) {
            throw new IllegalArgumentException("Changes are applied through applySelected, not by setting the status");
        }
        return changeStore.transition(changeId, status, reviewer != null ? reviewer : options.getDefaultReviewer(),
                notes);
    }

    // ========== Apply ==========

    public ApplyResult applySelected(String sessionId, Collection<String> changeIds) {
        return applySelected(sessionId, changeIds, options.getDefaultReviewer());
    }

    /**
     * Commits the selected changes and discards every other open change of the session.
     * See {@link ApplyEngine} for ordering and failure semantics.
     */
    public ApplyResult applySelected(String sessionId, Collection<String> changeIds, String appliedBy) {
        return applyEngine.applySelected(sessionId, changeIds,
                appliedBy != null ? appliedBy : options.getDefaultReviewer());
    }

    // ========== Missing references ==========

    /**
     * Re-classifies pending missing-reference changes of every session whose missing model is
     * now registered.
     *
     * @return ids of the changes that became creates
     */
    public List<String> resolveMissingReference(String makeId, String modelName) {
        return changeStore.resolveMissingReference(null, makeId, modelName);
    }

    public List<String> resolveMissingReference(String sessionId, String makeId, String modelName) {
        return changeStore.resolveMissingReference(sessionId, makeId, modelName);
    }

    /**
     * Registers a model in the taxonomy and re-classifies the changes that were waiting for it.
     */
    public List<String> registerMissingModel(String makeId, String modelName) {
        return registerMissingModel(null, makeId, modelName);
    }

    /**
     * Same as {@link #registerMissingModel(String, String)}, re-classifying only the changes of
     * {@code sessionId} when it is not null.
     */
    public List<String> registerMissingModel(String sessionId, String makeId, String modelName) {
        String modelId = taxonomyLookup.registerModel(makeId, modelName);
        log.info("taxonomy.model.registered makeId={} model='{}' modelId={}", makeId, modelName, modelId);
        return changeStore.resolveMissingReference(sessionId, makeId, modelName);
    }

    // ========== Unmapped listings ==========

    public List<ExistingListing> findUnmapped(String sessionId, String sellerId) {
        return unmappedDetector.findUnmapped(sessionId, sellerId);
    }

    public List<Change> markForDeletion(String sessionId, List<String> listingIds, String reason) {
        return unmappedDetector.markForDeletion(sessionId, listingIds, reason);
    }

    // ========== Accessors ==========

    public ReconciliationOptions getOptions() {
        return options;
    }

    public AuditService getAuditService() {
        return auditService;
    }

    public ListingStore getListingStore() {
        return listingStore;
    }

    public TaxonomyLookup getTaxonomyLookup() {
        return taxonomyLookup;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private ReconciliationOptions options = ReconciliationOptions.defaults();
        private ListingStore listingStore;
        private TaxonomyLookup taxonomyLookup;
        private ChangeRepository changeRepository;
        private SessionRepository sessionRepository;
        private AuditService auditService;
        private MetricsService metricsService;
        private TracingService tracingService;
        private CacheConfig cacheConfig = CacheConfig.disabled();
        private Executor executor;

        public Builder options(ReconciliationOptions options) {
            this.options = options;
            return this;
        }

        public Builder listingStore(ListingStore listingStore) {
            this.listingStore = listingStore;
            return this;
        }

        /**
         * Sets the taxonomy used to resolve make, model and attribute names. Required.
         */
        public Builder taxonomyLookup(TaxonomyLookup taxonomyLookup) {
            this.taxonomyLookup = taxonomyLookup;
            return this;
        }

        public Builder changeRepository(ChangeRepository changeRepository) {
            this.changeRepository = changeRepository;
            return this;
        }

        public Builder sessionRepository(SessionRepository sessionRepository) {
            this.sessionRepository = sessionRepository;
            return this;
        }

        public Builder auditService(AuditService auditService) {
            this.auditService = auditService;
            return this;
        }

        public Builder metricsService(MetricsService metricsService) {
            this.metricsService = metricsService;
            return this;
        }

        public Builder tracingService(TracingService tracingService) {
            this.tracingService = tracingService;
            return this;
        }

        /**
         * Enables a Caffeine cache in front of the taxonomy lookup.
         */
        public Builder cacheConfig(CacheConfig cacheConfig) {
            this.cacheConfig = cacheConfig;
            return this;
        }

        /**
         * Executor for parallel candidate matching and concurrent apply operations.
         * Without one, everything runs on the calling thread.
         */
        public Builder executor(Executor executor) {
            this.executor = executor;
            return this;
        }

        public ReconciliationService build() {
            if (options == null) {
                throw new IllegalStateException("options must not be null");
            }
            if (cacheConfig == null) {
                cacheConfig = CacheConfig.disabled();
            }
            return new ReconciliationService(this);
        }
    }
}
