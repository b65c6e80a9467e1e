package com.listing.reconciliation.api;

import com.listing.reconciliation.apply.ApplyResult;
import com.listing.reconciliation.cache.CacheConfig;
import com.listing.reconciliation.core.model.Candidate;
import com.listing.reconciliation.core.model.Change;
import com.listing.reconciliation.core.model.ChangeStatus;
import com.listing.reconciliation.core.model.ChangeType;
import com.listing.reconciliation.core.model.ComparisonSession;
import com.listing.reconciliation.core.model.CreatePayload;
import com.listing.reconciliation.core.model.ExistingListing;
import com.listing.reconciliation.core.model.ExtractionMetadata;
import com.listing.reconciliation.core.model.ExtractionType;
import com.listing.reconciliation.core.model.FieldChange;
import com.listing.reconciliation.core.model.SessionStatus;
import com.listing.reconciliation.core.model.UpdatePayload;
import com.listing.reconciliation.extraction.ExtractionException;
import com.listing.reconciliation.extraction.ExtractionResult;
import com.listing.reconciliation.extraction.ListingExtractor;
import com.listing.reconciliation.store.InMemoryListingStore;
import com.listing.reconciliation.taxonomy.InMemoryTaxonomy;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import static com.listing.reconciliation.TestData.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end reconciliation flows through {@link ReconciliationService}.
 */
@DisplayName("Reconciliation Scenario Tests")
class ScenarioTest {

    private InMemoryListingStore store;
    private InMemoryTaxonomy taxonomy;
    private ReconciliationService service;

    @BeforeEach
    void setUp() {
        store = new InMemoryListingStore();
        taxonomy = taxonomy();
        service = ReconciliationService.builder()
                .listingStore(store)
                .taxonomyLookup(taxonomy)
                .cacheConfig(CacheConfig.defaults())
                .build();
    }

    private static Change single(List<Change> changes, ChangeType type) {
        List<Change> ofType = changes.stream().filter(c -> c.getChangeType() == type).toList();
        assertEquals(1, ofType.size(), "expected exactly one " + type.wireName() + " change");
        return ofType.get(0);
    }

    @Test
    @DisplayName("Unknown variant of a known model becomes a create")
    void scenarioCreate() {
        ComparisonSession session = service.buildSession(
                List.of(candidate("Toyota", "Yaris", "1.5 Hybrid")), SELLER, "price list");

        List<Change> changes = service.listChanges(session.getId(), ChangeFilter.all());

        assertEquals(1, changes.size());
        Change create = single(changes, ChangeType.CREATE);
        assertEquals(ChangeStatus.PENDING, create.getStatus());
        CreatePayload payload = (CreatePayload) create.getPayload();
        assertEquals(TOYOTA, payload.refs().makeId());
        assertEquals(YARIS, payload.refs().modelId());
        assertEquals(SessionStatus.COMPLETED, session.getStatus());
        assertEquals(1, session.getSummary().totalNew());
    }

    @Test
    @DisplayName("Price change on a matched listing becomes an update")
    void scenarioUpdate() {
        store.save(listing("yaris", "Toyota", "Yaris", "1.5 Hybrid", 3000));

        ComparisonSession session = service.buildSession(
                List.of(candidate("Toyota", "Yaris", "1.5 Hybrid", 3200)), SELLER, "price list");

        Change update = single(service.listChanges(session.getId(), ChangeFilter.all()), ChangeType.UPDATE);
        assertEquals("yaris", update.getExistingListingId());
        assertEquals(Map.of("monthly_price", new FieldChange(3000, 3200)), update.getFieldChanges());
        assertNull(((UpdatePayload) update.getPayload()).offersReplacement());
    }

    @Test
    @DisplayName("Listing without a matching candidate becomes a delete")
    void scenarioDelete() {
        store.save(listing("gti", "VW", "Golf", "2.0 GTI"));

        ComparisonSession session = service.buildSession(
                List.of(candidate("Toyota", "Yaris", "1.5 Hybrid")), SELLER, "price list");

        Change delete = single(service.listChanges(session.getId(), ChangeFilter.all()), ChangeType.DELETE);
        assertEquals("gti", delete.getExistingListingId());
        assertEquals(1, session.getSummary().totalDeleted());
    }

    @Nested
    @DisplayName("Missing models")
    class MissingModel {

        @Test
        @DisplayName("Unknown model is flagged and becomes a create once registered")
        void registerResolves() {
            ComparisonSession session = service.buildSession(
                    List.of(candidate("Toyota", "bZ5X", "Comfort")), SELLER, "price list");
            Change missing = single(service.listChanges(session.getId(), ChangeFilter.all()),
                    ChangeType.MISSING_REFERENCE);

            List<String> resolved = service.registerMissingModel(TOYOTA, "bZ5X");

            assertEquals(List.of(missing.getId()), resolved);
            Change create = service.getChange(missing.getId());
            assertEquals(ChangeType.CREATE, create.getChangeType());
            assertEquals(ChangeStatus.PENDING, create.getStatus());
            assertEquals(1, service.getSession(session.getId()).getSummary().totalNew());
            assertEquals(0, service.getSession(session.getId()).getSummary().totalMissingReferences());
        }

        @Test
        @DisplayName("Resolving before the model exists leaves the change missing")
        void resolveWithoutModel() {
            ComparisonSession session = service.buildSession(
                    List.of(candidate("Toyota", "bZ5X", "Comfort")), SELLER, "price list");

            assertTrue(service.resolveMissingReference(session.getId(), TOYOTA, "bZ5X").isEmpty());
            assertEquals(1, service.listChanges(session.getId(),
                    ChangeFilter.ofTypes(ChangeType.MISSING_REFERENCE)).size());
        }

        @Test
        @DisplayName("Model created directly in the taxonomy is found despite the cached miss")
        void modelCreatedOutsideEngine() {
            ComparisonSession session = service.buildSession(
                    List.of(candidate("Toyota", "bZ5X", "Comfort")), SELLER, "price list");
            Change missing = single(service.listChanges(session.getId(), ChangeFilter.all()),
                    ChangeType.MISSING_REFERENCE);
            String bz5x = taxonomy.registerModel(TOYOTA, "bZ5X");

            List<String> resolved = service.resolveMissingReference(TOYOTA, "bZ5X");

            assertEquals(List.of(missing.getId()), resolved);
            CreatePayload payload = (CreatePayload) service.getChange(missing.getId()).getPayload();
            assertEquals(bz5x, payload.refs().modelId());
            assertEquals(0, service.getSession(session.getId()).getSummary().totalMissingReferences());
        }

        @Test
        @DisplayName("Session-scoped resolution also sees a model created directly in the taxonomy")
        void modelCreatedOutsideEngineScoped() {
            ComparisonSession session = service.buildSession(
                    List.of(candidate("Toyota", "bZ5X", "Comfort")), SELLER, "price list");
            taxonomy.registerModel(TOYOTA, "bz5x ");

            assertEquals(1, service.resolveMissingReference(session.getId(), TOYOTA, "bZ5X").size());
            assertEquals(1, service.getSession(session.getId()).getSummary().totalNew());
        }
    }

    @Nested
    @DisplayName("Selective apply")
    class SelectiveApply {

        private ComparisonSession session;
        private Change create;
        private Change update;
        private Change delete;
        private Change missing;

        @BeforeEach
        void buildSession() {
            store.save(listing("yaris", "Toyota", "Yaris", "1.5 Hybrid", 3000));
            store.save(listing("gti", "VW", "Golf", "2.0 GTI"));

            session = service.buildSession(List.of(
                    candidate("Toyota", "Aygo X", "1.0 Play", 1999),
                    candidate("Toyota", "Yaris", "1.5 Hybrid", 3200),
                    candidate("Toyota", "bZ5X", "Comfort")), SELLER, "price list");

            List<Change> changes = service.listChanges(session.getId(), ChangeFilter.all());
            create = single(changes, ChangeType.CREATE);
            update = single(changes, ChangeType.UPDATE);
            delete = single(changes, ChangeType.DELETE);
            missing = single(changes, ChangeType.MISSING_REFERENCE);
        }

        @Test
        @DisplayName("Selected changes are applied and the rest discarded")
        void appliesSelection() {
            ApplyResult result = service.applySelected(session.getId(), List.of(create.getId(), update.getId()));

            assertEquals(2, result.appliedCount());
            assertEquals(1, result.appliedCreates());
            assertEquals(1, result.appliedUpdates());
            assertFalse(result.hasFailures());
            assertFalse(result.cancelled());

            assertEquals(ChangeStatus.APPLIED, service.getChange(create.getId()).getStatus());
            assertEquals(ChangeStatus.APPLIED, service.getChange(update.getId()).getStatus());
            assertEquals(ChangeStatus.DISCARDED, service.getChange(delete.getId()).getStatus());
            assertEquals(ChangeStatus.PENDING, service.getChange(missing.getId()).getStatus());

            assertEquals(3200, store.findById("yaris").orElseThrow().getAttributes().monthlyPrice());
            assertTrue(store.findById("gti").isPresent());
            assertEquals(3, store.findBySeller(SELLER).size());
            assertNotNull(service.getSession(session.getId()).getAppliedAt());
        }

        @Test
        @DisplayName("Rebuilding after apply finds nothing left to change")
        void idempotentRebuild() {
            service.applySelected(session.getId(), List.of(create.getId(), update.getId(), delete.getId()));

            ComparisonSession rebuilt = service.buildSession(List.of(
                    candidate("Toyota", "Aygo X", "1.0 Play", 1999),
                    candidate("Toyota", "Yaris", "1.5 Hybrid", 3200),
                    candidate("Toyota", "bZ5X", "Comfort")), SELLER, "price list again");

            List<Change> changes = service.listChanges(rebuilt.getId(), ChangeFilter.all());
            Set<ChangeType> types = changes.stream().map(Change::getChangeType).collect(Collectors.toSet());
            assertEquals(Set.of(ChangeType.UNCHANGED, ChangeType.MISSING_REFERENCE), types);
            assertEquals(2, rebuilt.getSummary().totalUnchanged());
        }

        @Test
        @DisplayName("Changes cannot be marked applied by a reviewer")
        void appliedStatusRejected() {
            assertThrows(IllegalArgumentException.class,
                    () -> service.setChangeStatus(create.getId(), ChangeStatus.APPLIED, null));
            assertEquals(ChangeStatus.PENDING, service.getChange(create.getId()).getStatus());
        }

        @Test
        @DisplayName("Rejected changes survive the discard pass")
        void rejectedKept() {
            service.setChangeStatus(delete.getId(), ChangeStatus.REJECTED, "keep the GTI", "alice");

            service.applySelected(session.getId(), List.of(update.getId()));

            Change rejected = service.getChange(delete.getId());
            assertEquals(ChangeStatus.REJECTED, rejected.getStatus());
            assertEquals("alice", rejected.getReviewedBy());
            assertEquals(ChangeStatus.DISCARDED, service.getChange(create.getId()).getStatus());
        }
    }

    @Test
    @DisplayName("Each listing is claimed by at most one candidate")
    void exclusiveMatching() {
        store.save(listing("yaris", "Toyota", "Yaris", "1.5 Hybrid", 3000));

        ComparisonSession session = service.buildSession(List.of(
                candidate("Toyota", "Yaris", "1.5 Hybrid", 3000),
                candidate("Toyota", "Yaris", "1.5 Hybrid", 3000)), SELLER, "duplicates");

        List<Change> changes = service.listChanges(session.getId(), ChangeFilter.all());
        Set<String> claimed = new HashSet<>();
        for (Change change : changes) {
            if (change.getExistingListingId() != null) {
                assertTrue(claimed.add(change.getExistingListingId()),
                        "listing claimed twice: " + change.getExistingListingId());
            }
        }
        assertEquals(1, changes.stream().filter(c -> c.getChangeType() == ChangeType.UNCHANGED).count());
        assertEquals(1, changes.stream().filter(c -> c.getChangeType() == ChangeType.CREATE).count());
    }

    @Nested
    @DisplayName("Extraction input")
    class Extraction {

        @Test
        @DisplayName("Session records the extractor's type and cost")
        void buildsFromExtractor() {
            ListingExtractor extractor = (document, sellerId) -> new ExtractionResult(
                    List.of(Candidate.of(attrs("Toyota", "Yaris", new String(document, StandardCharsets.UTF_8)))),
                    ExtractionType.CREATE,
                    new ExtractionMetadata("pdf-extractor", 0.12, 1800, 950L));

            ExtractionResult result = extractor.extract("1.5 Hybrid".getBytes(StandardCharsets.UTF_8), SELLER);
            ComparisonSession session = service.buildSession(result, SELLER, "first import");

            assertEquals(ExtractionType.CREATE, session.getExtractionType());
            assertEquals("pdf-extractor", session.getExtractionMetadata().extractorName());
            assertEquals(1, session.getSummary().totalExtracted());
        }

        @Test
        @DisplayName("Extraction failures surface before any session is built")
        void extractorFailure() {
            ListingExtractor extractor = (document, sellerId) -> {
                throw new ExtractionException("Unreadable document");
            };

            assertThrows(ExtractionException.class, () -> extractor.extract(new byte[0], SELLER));
            assertTrue(service.listSessions(SELLER).isEmpty());
        }

        @Test
        @DisplayName("Blank seller is rejected")
        void blankSeller() {
            assertThrows(IllegalArgumentException.class,
                    () -> service.buildSession(List.of(), " ", "price list"));
        }
    }

    @Test
    @DisplayName("Other sellers' listings are never compared")
    void sellerIsolation() {
        ExistingListing foreign = listing("foreign", "VW", "Golf", "2.0 GTI").toBuilder()
                .sellerId(OTHER_SELLER).build();
        store.save(foreign);

        ComparisonSession session = service.buildSession(
                List.of(candidate("Toyota", "Yaris", "1.5 Hybrid")), SELLER, "price list");

        assertEquals(0, session.getSummary().totalDeleted());
        assertEquals(0, session.getSummary().totalExisting());
    }
}
