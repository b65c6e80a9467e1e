package com.listing.reconciliation.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.List;
import java.util.Map;

import static com.listing.reconciliation.TestData.*;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Change Model Tests")
class ChangeModelTest {

    @Nested
    @DisplayName("ChangeStatus")
    class Status {

        @Test
        @DisplayName("Pending may move to every other status")
        void pendingTargets() {
            assertEquals(EnumSet.of(ChangeStatus.APPROVED, ChangeStatus.REJECTED, ChangeStatus.APPLIED,
                    ChangeStatus.DISCARDED), ChangeStatus.PENDING.allowedTargets());
        }

        @Test
        @DisplayName("Approved may only be applied or discarded")
        void approvedTargets() {
            assertTrue(ChangeStatus.APPROVED.canTransitionTo(ChangeStatus.APPLIED));
            assertTrue(ChangeStatus.APPROVED.canTransitionTo(ChangeStatus.DISCARDED));
            assertFalse(ChangeStatus.APPROVED.canTransitionTo(ChangeStatus.REJECTED));
            assertFalse(ChangeStatus.APPROVED.canTransitionTo(ChangeStatus.PENDING));
        }

        @Test
        @DisplayName("Rejected, applied and discarded are terminal")
        void terminal() {
            assertTrue(ChangeStatus.REJECTED.isTerminal());
            assertTrue(ChangeStatus.APPLIED.isTerminal());
            assertTrue(ChangeStatus.DISCARDED.isTerminal());
            assertFalse(ChangeStatus.PENDING.isTerminal());
        }

        @Test
        @DisplayName("Wire names are lower case")
        void wireNames() {
            assertEquals("approved", ChangeStatus.APPROVED.wireName());
            assertEquals(ChangeStatus.DISCARDED, ChangeStatus.fromWireName("Discarded"));
            assertThrows(IllegalArgumentException.class, () -> ChangeStatus.fromWireName("done"));
        }
    }

    @Nested
    @DisplayName("ChangeType")
    class Type {

        @Test
        @DisplayName("Only create, update and delete are applicable")
        void applicable() {
            assertTrue(ChangeType.CREATE.isApplicable());
            assertTrue(ChangeType.UPDATE.isApplicable());
            assertTrue(ChangeType.DELETE.isApplicable());
            assertFalse(ChangeType.UNCHANGED.isApplicable());
            assertFalse(ChangeType.MISSING_REFERENCE.isApplicable());
        }

        @Test
        @DisplayName("Wire names use snake_case")
        void wireNames() {
            assertEquals("missing_reference", ChangeType.MISSING_REFERENCE.wireName());
            assertEquals(ChangeType.MISSING_REFERENCE, ChangeType.fromWireName("missing_reference"));
        }
    }

    @Nested
    @DisplayName("Change")
    class ChangeValidation {

        @Test
        @DisplayName("Update requires an existing listing id")
        void updateRequiresListing() {
            UpdatePayload payload = new UpdatePayload(candidate("VW", "Golf", null, 1),
                    Map.of("monthly_price", new FieldChange(0, 1)), null);

            assertThrows(IllegalArgumentException.class,
                    () -> Change.builder().sessionId("s1").payload(payload).build());
        }

        @Test
        @DisplayName("Exact matches carry confidence 1.0")
        void exactConfidence() {
            UnchangedPayload payload = new UnchangedPayload(candidate("VW", "Golf", null));

            assertThrows(IllegalArgumentException.class, () -> Change.builder().sessionId("s1").payload(payload)
                    .existingListingId("l1").matchMethod(MatchMethod.EXACT).confidenceScore(0.9).build());
        }

        @Test
        @DisplayName("Defaults to a pending change with generated id")
        void defaults() {
            Change change = Change.builder().sessionId("s1")
                    .payload(new CreatePayload(candidate("VW", "Golf", null),
                            new TaxonomyRefs(VW, GOLF, null, null, null), List.of()))
                    .build();

            assertNotNull(change.getId());
            assertEquals(ChangeType.CREATE, change.getChangeType());
            assertEquals(ChangeStatus.PENDING, change.getStatus());
            assertEquals(MatchMethod.NONE, change.getMatchMethod());
            assertTrue(change.isPending());
        }

        @Test
        @DisplayName("An update must change something")
        void emptyUpdate() {
            assertThrows(IllegalArgumentException.class,
                    () -> new UpdatePayload(candidate("VW", "Golf", null), Map.of(), null));
        }
    }

    @Test
    @DisplayName("Missing model is satisfied by the same model name under the same make")
    void missingReferenceSatisfaction() {
        MissingReference missing = new MissingReference(MissingReferenceKind.MODEL, "Toyota", " bZ5X", null, TOYOTA);

        assertTrue(missing.isSatisfiedBy(TOYOTA, "BZ5X "));
        assertFalse(missing.isSatisfiedBy(VW, "bZ5X"));
        assertFalse(missing.isSatisfiedBy(TOYOTA, "bZ4X"));
        assertFalse(new MissingReference(MissingReferenceKind.MAKE, "Tesla", "Model 3", null, null)
                .isSatisfiedBy(TOYOTA, "Model 3"));
    }

    @Test
    @DisplayName("Offer requires a non-negative monthly price")
    void offerValidation() {
        assertThrows(NullPointerException.class, () -> new Offer(null, 0, 36, 15_000, null));
        assertThrows(IllegalArgumentException.class, () -> Offer.of(-1, null, null, null));
        assertEquals(5000 + 24 * 1000, Offer.of(1000, 5000, 24, null).effectiveTotalPrice(36));
        assertEquals(36 * 1000, Offer.of(1000, null, null, null).effectiveTotalPrice(36));
    }
}
