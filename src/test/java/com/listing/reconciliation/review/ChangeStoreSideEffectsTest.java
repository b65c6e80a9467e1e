package com.listing.reconciliation.review;

import com.listing.reconciliation.audit.AuditAction;
import com.listing.reconciliation.audit.AuditService;
import com.listing.reconciliation.core.model.Change;
import com.listing.reconciliation.core.model.ChangeStatus;
import com.listing.reconciliation.core.model.ChangeType;
import com.listing.reconciliation.core.model.ComparisonSession;
import com.listing.reconciliation.core.model.CreatePayload;
import com.listing.reconciliation.core.model.DeletePayload;
import com.listing.reconciliation.core.model.MissingReference;
import com.listing.reconciliation.core.model.MissingReferenceKind;
import com.listing.reconciliation.core.model.MissingReferencePayload;
import com.listing.reconciliation.core.model.SessionStatus;
import com.listing.reconciliation.metrics.MetricsService;
import com.listing.reconciliation.session.ComparisonSessionService;
import com.listing.reconciliation.store.ChangeRepository;
import com.listing.reconciliation.taxonomy.InMemoryTaxonomy;
import com.listing.reconciliation.taxonomy.TaxonomyResolver;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Optional;

import static com.listing.reconciliation.TestData.*;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("ChangeStore Side Effect Tests")
class ChangeStoreSideEffectsTest {

    @Mock
    private ChangeRepository changeRepository;

    @Mock
    private ComparisonSessionService sessionService;

    @Mock
    private AuditService auditService;

    @Mock
    private MetricsService metricsService;

    private InMemoryTaxonomy taxonomy;
    private ChangeStore changeStore;

    @BeforeEach
    void setUp() {
        taxonomy = taxonomy();
        changeStore = new ChangeStore(changeRepository, sessionService, new TaxonomyResolver(taxonomy),
                auditService, metricsService);
    }

    private static Change deleteChange() {
        return Change.builder()
                .id("c1")
                .sessionId("s1")
                .payload(new DeletePayload(attrs("VW", "Golf", "2.0 GTI"), null))
                .existingListingId("gti")
                .build();
    }

    private static Change missingChange() {
        return missingChange("c2", "s1");
    }

    private static Change missingChange(String changeId, String sessionId) {
        return Change.builder()
                .id(changeId)
                .sessionId(sessionId)
                .payload(new MissingReferencePayload(candidate("Toyota", "bZ5X", "Comfort"),
                        new MissingReference(MissingReferenceKind.MODEL, "Toyota", "bZ5X", "Comfort", TOYOTA)))
                .build();
    }

    private static ComparisonSession session(String sessionId, SessionStatus status) {
        return ComparisonSession.builder()
                .id(sessionId)
                .sessionName("price list")
                .sellerId(SELLER)
                .status(status)
                .build();
    }

    private static Change reclassified(Change change, CreatePayload payload) {
        return change.toBuilder().payload(payload).build();
    }

    @Test
    @DisplayName("Audit failure does not fail the transition")
    void auditFailureIgnored() {
        when(changeRepository.findById("c1")).thenReturn(Optional.of(deleteChange()));
        when(changeRepository.update(any(Change.class))).thenAnswer(inv -> inv.getArgument(0));
        doThrow(new IllegalStateException("audit store down"))
                .when(auditService).record(any(AuditAction.class), anyString(), anyString(), anyMap());

        Change approved = changeStore.transition("c1", ChangeStatus.APPROVED, "alice", null);

        assertEquals(ChangeStatus.APPROVED, approved.getStatus());
        assertEquals("alice", approved.getReviewedBy());
        verify(sessionService).requireCompleted("s1");
    }

    @Test
    @DisplayName("Rejected transitions leave the repository untouched")
    void noWriteOnRejectedTransition() {
        when(changeRepository.findById("c2")).thenReturn(Optional.of(missingChange()));

        assertThrows(InvalidStateTransitionException.class,
                () -> changeStore.transition("c2", ChangeStatus.APPROVED, "alice", null));

        verify(changeRepository, never()).update(any(Change.class));
        verifyNoInteractions(auditService);
    }

    @Test
    @DisplayName("Resolution across sessions recounts and records a metric")
    void resolutionSideEffects() {
        String bz5x = taxonomy.registerModel(TOYOTA, "bZ5X");
        when(changeRepository.findByType(ChangeType.MISSING_REFERENCE)).thenReturn(List.of(missingChange()));
        when(sessionService.getSession("s1")).thenReturn(session("s1", SessionStatus.COMPLETED));
        when(changeRepository.reclassify(eq("c2"), any(CreatePayload.class), anyString()))
                .thenAnswer(inv -> reclassified(missingChange(), inv.getArgument(1)));

        List<String> resolved = changeStore.resolveMissingReference(null, TOYOTA, "bZ5X");

        assertEquals(List.of("c2"), resolved);
        verify(changeRepository).reclassify(eq("c2"), argThat(p -> bz5x.equals(p.refs().modelId())),
                anyString());
        verify(changeRepository, never()).update(any(Change.class));
        verify(sessionService).recountSummary("s1");
        verify(metricsService).recordMissingReferencesResolved(1);
        verify(auditService).record(eq(AuditAction.MISSING_REFERENCE_RESOLVED), eq(TOYOTA),
                eq(AuditService.SYSTEM_ACTOR), anyMap());
    }

    @Test
    @DisplayName("Resolution across sessions skips changes of sessions that did not complete")
    void failedSessionsSkipped() {
        taxonomy.registerModel(TOYOTA, "bZ5X");
        when(changeRepository.findByType(ChangeType.MISSING_REFERENCE))
                .thenReturn(List.of(missingChange("c3", "failed"), missingChange("c2", "s1")));
        when(sessionService.getSession("failed")).thenReturn(session("failed", SessionStatus.FAILED));
        when(sessionService.getSession("s1")).thenReturn(session("s1", SessionStatus.COMPLETED));
        when(changeRepository.reclassify(eq("c2"), any(CreatePayload.class), anyString()))
                .thenAnswer(inv -> reclassified(missingChange(), inv.getArgument(1)));

        List<String> resolved = changeStore.resolveMissingReference(null, TOYOTA, "bZ5X");

        assertEquals(List.of("c2"), resolved);
        verify(changeRepository, never()).reclassify(eq("c3"), any(CreatePayload.class), anyString());
        verify(sessionService, never()).recountSummary("failed");
        verify(sessionService).recountSummary("s1");
    }
}
