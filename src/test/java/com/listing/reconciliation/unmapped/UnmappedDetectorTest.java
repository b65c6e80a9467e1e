package com.listing.reconciliation.unmapped;

import com.listing.reconciliation.api.ChangeFilter;
import com.listing.reconciliation.api.ReconciliationOptions;
import com.listing.reconciliation.apply.ApplyEngine;
import com.listing.reconciliation.audit.AuditAction;
import com.listing.reconciliation.audit.AuditService;
import com.listing.reconciliation.classify.ChangeClassifier;
import com.listing.reconciliation.codec.ChangePayloadCodec;
import com.listing.reconciliation.core.model.Change;
import com.listing.reconciliation.core.model.ChangeStatus;
import com.listing.reconciliation.core.model.ChangeType;
import com.listing.reconciliation.core.model.ComparisonSession;
import com.listing.reconciliation.core.model.DeletePayload;
import com.listing.reconciliation.core.model.ExistingListing;
import com.listing.reconciliation.core.model.ExtractionType;
import com.listing.reconciliation.match.EntityMatcher;
import com.listing.reconciliation.metrics.NoOpMetricsService;
import com.listing.reconciliation.session.ComparisonSessionService;
import com.listing.reconciliation.store.InMemoryChangeRepository;
import com.listing.reconciliation.store.InMemoryListingStore;
import com.listing.reconciliation.store.InMemorySessionRepository;
import com.listing.reconciliation.taxonomy.TaxonomyResolver;
import com.listing.reconciliation.tracing.NoOpTracingService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.listing.reconciliation.TestData.*;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("UnmappedDetector Tests")
class UnmappedDetectorTest {

    private InMemoryListingStore store;
    private InMemoryChangeRepository changeRepository;
    private ComparisonSessionService sessionService;
    private AuditService auditService;
    private UnmappedDetector detector;
    private ComparisonSession session;
    private TaxonomyResolver resolver;

    @BeforeEach
    void setUp() {
        ReconciliationOptions options = ReconciliationOptions.defaults();
        store = new InMemoryListingStore();
        store.save(listing("yaris", "Toyota", "Yaris", "1.5 Hybrid"));
        store.save(listing("old", "VW", "Golf", "2.0 GTI"));
        changeRepository = new InMemoryChangeRepository(new ChangePayloadCodec());
        resolver = new TaxonomyResolver(taxonomy());
        auditService = new AuditService();
        sessionService = new ComparisonSessionService(
                new ChangeClassifier(new EntityMatcher(options), resolver, options),
                new InMemorySessionRepository(), changeRepository, auditService);
        detector = new UnmappedDetector(sessionService, changeRepository, store, auditService);

        session = sessionService.build(
                List.of(candidate("Toyota", "Yaris", "1.5 Hybrid"), candidate("Toyota", "Aygo X", "Active")),
                store.findBySeller(SELLER), SELLER, "price list", ExtractionType.UPDATE, null);

        // Listings added after the build were never compared.
        store.save(listing("late", "VW", "Golf", "1.5 Life"));
        store.save(listing("foreign", attrs("VW", "Golf", "1.5 Life")).toBuilder().sellerId(OTHER_SELLER).build());
    }

    @Nested
    @DisplayName("findUnmapped")
    class FindUnmapped {

        @Test
        @DisplayName("Returns listings no change of the session refers to")
        void unreferenced() {
            List<ExistingListing> unmapped = detector.findUnmapped(session.getId(), SELLER);

            assertEquals(List.of("late"), unmapped.stream().map(ExistingListing::getId).toList());
        }

        @Test
        @DisplayName("Listings created by the session's applied creates are mapped")
        void appliedCreatesAreMapped() {
            ApplyEngine engine = new ApplyEngine(sessionService, changeRepository, store, resolver,
                    ReconciliationOptions.defaults(), auditService, new NoOpMetricsService(),
                    new NoOpTracingService(), null);
            Change create = sessionService.listChanges(session.getId(), ChangeFilter.ofTypes(ChangeType.CREATE)).get(0);

            engine.applySelected(session.getId(), List.of(create.getId()), "alice");

            assertEquals(List.of("late"),
                    detector.findUnmapped(session.getId(), SELLER).stream().map(ExistingListing::getId).toList());
            assertEquals(4, store.findBySeller(SELLER).size());
        }

        @Test
        @DisplayName("Should require a seller")
        void requiresSeller() {
            assertThrows(IllegalArgumentException.class, () -> detector.findUnmapped(session.getId(), " "));
        }
    }

    @Nested
    @DisplayName("markForDeletion")
    class MarkForDeletion {

        @Test
        @DisplayName("Creates pending deletes after the last position and recounts the summary")
        void marks() {
            int lastPosition = changeRepository.findBySession(session.getId()).stream()
                    .mapToInt(Change::getPosition).max().orElseThrow();

            List<Change> created = detector.markForDeletion(session.getId(), List.of("late"), "  discontinued ");

            assertEquals(1, created.size());
            Change change = created.get(0);
            assertEquals(ChangeType.DELETE, change.getChangeType());
            assertEquals(ChangeStatus.PENDING, change.getStatus());
            assertEquals("late", change.getExistingListingId());
            assertEquals(lastPosition + 1, change.getPosition());
            assertEquals("discontinued", change.getReviewNotes());
            assertEquals("discontinued", ((DeletePayload) change.getPayload()).reason());

            assertEquals(2, sessionService.getSession(session.getId()).getSummary().totalDeleted());
            assertTrue(detector.findUnmapped(session.getId(), SELLER).isEmpty());
            assertEquals(1, auditService.getEntriesByAction(AuditAction.LISTINGS_MARKED_FOR_DELETION).size());
        }

        @Test
        @DisplayName("Blank reason falls back to the default")
        void defaultReason() {
            Change change = detector.markForDeletion(session.getId(), List.of("late"), null).get(0);

            assertEquals(UnmappedDetector.DEFAULT_REASON, change.getReviewNotes());
        }

        @Test
        @DisplayName("Should refuse referenced, unknown and foreign listings without side effects")
        void refuses() {
            assertThrows(IllegalArgumentException.class,
                    () -> detector.markForDeletion(session.getId(), List.of("late", "yaris"), null));
            assertThrows(IllegalArgumentException.class,
                    () -> detector.markForDeletion(session.getId(), List.of("nope"), null));
            assertThrows(IllegalArgumentException.class,
                    () -> detector.markForDeletion(session.getId(), List.of("foreign"), null));
            assertThrows(IllegalArgumentException.class,
                    () -> detector.markForDeletion(session.getId(), List.of(), null));

            assertEquals(1, sessionService.getSession(session.getId()).getSummary().totalDeleted());
            assertEquals(List.of("late"),
                    detector.findUnmapped(session.getId(), SELLER).stream().map(ExistingListing::getId).toList());
        }
    }
}
