package com.listing.reconciliation.api;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ReconciliationOptions Tests")
class ReconciliationOptionsTest {

    @Test
    @DisplayName("Defaults match the documented tuning")
    void defaults() {
        ReconciliationOptions options = ReconciliationOptions.defaults();

        assertEquals(0.70, options.getFuzzyConfidenceFloor());
        assertEquals(0.95, options.getCompositeKeyConfidence());
        assertEquals(5, options.getHorsepowerTolerance());
        assertEquals(36, options.getDefaultPeriodMonths());
        assertEquals(15_000, options.getDefaultMileagePerYear());
        assertFalse(options.isParallelMatching());
        assertEquals(1, options.getApplyConcurrency());
        assertEquals("admin", options.getDefaultReviewer());
    }

    @Test
    @DisplayName("Builder overrides every setting")
    void customValues() {
        ReconciliationOptions options = ReconciliationOptions.builder()
                .fuzzyConfidenceFloor(0.6)
                .compositeKeyConfidence(0.9)
                .horsepowerTolerance(0)
                .defaultPeriodMonths(48)
                .defaultMileagePerYear(10_000)
                .parallelMatching(true)
                .applyConcurrency(4)
                .defaultReviewer("ops")
                .build();

        assertEquals(0.6, options.getFuzzyConfidenceFloor());
        assertEquals(0.9, options.getCompositeKeyConfidence());
        assertEquals(0, options.getHorsepowerTolerance());
        assertEquals(48, options.getDefaultPeriodMonths());
        assertEquals(10_000, options.getDefaultMileagePerYear());
        assertTrue(options.isParallelMatching());
        assertEquals(4, options.getApplyConcurrency());
        assertEquals("ops", options.getDefaultReviewer());
        assertTrue(options.toString().contains("applyConcurrency=4"));
    }

    @Nested
    @DisplayName("Validation")
    class Validation {

        @ParameterizedTest
        @ValueSource(doubles = {-0.1, 1.01})
        @DisplayName("Scores outside [0, 1] are rejected")
        void scoreRange(double score) {
            assertThrows(IllegalArgumentException.class,
                    () -> ReconciliationOptions.builder().fuzzyConfidenceFloor(score));
            assertThrows(IllegalArgumentException.class,
                    () -> ReconciliationOptions.builder().compositeKeyConfidence(score));
        }

        @Test
        @DisplayName("Composite-key confidence may not fall below the fuzzy floor")
        void compositeBelowFloor() {
            ReconciliationOptions.Builder builder = ReconciliationOptions.builder()
                    .fuzzyConfidenceFloor(0.9)
                    .compositeKeyConfidence(0.8);

            assertThrows(IllegalArgumentException.class, builder::build);
        }

        @Test
        @DisplayName("Non-positive counts are rejected")
        void counts() {
            assertThrows(IllegalArgumentException.class,
                    () -> ReconciliationOptions.builder().horsepowerTolerance(-1));
            assertThrows(IllegalArgumentException.class,
                    () -> ReconciliationOptions.builder().defaultPeriodMonths(0));
            assertThrows(IllegalArgumentException.class,
                    () -> ReconciliationOptions.builder().defaultMileagePerYear(0));
            assertThrows(IllegalArgumentException.class,
                    () -> ReconciliationOptions.builder().applyConcurrency(0));
        }

        @Test
        @DisplayName("Blank reviewer is rejected")
        void blankReviewer() {
            assertThrows(IllegalArgumentException.class,
                    () -> ReconciliationOptions.builder().defaultReviewer(" "));
            assertThrows(IllegalArgumentException.class,
                    () -> ReconciliationOptions.builder().defaultReviewer(null));
        }
    }
}
