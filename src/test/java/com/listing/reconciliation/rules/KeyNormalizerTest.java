package com.listing.reconciliation.rules;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("KeyNormalizer Tests")
class KeyNormalizerTest {

    @Test
    @DisplayName("Should case-fold, trim and collapse whitespace")
    void normalize() {
        assertEquals("aygo x", KeyNormalizer.normalize("  Aygo   X "));
        assertEquals("", KeyNormalizer.normalize(null));
        assertEquals("", KeyNormalizer.normalize("   "));
    }

    @Test
    @DisplayName("Exact key joins normalized make, model and variant")
    void exactKey() {
        assertEquals("toyota|yaris|1.5 hybrid", KeyNormalizer.exactKey("Toyota", " YARIS", "1.5  Hybrid"));
        assertEquals("toyota|yaris|", KeyNormalizer.exactKey("Toyota", "Yaris", null));
    }

    @Test
    @DisplayName("Equivalence ignores case and spacing")
    void equivalent() {
        assertTrue(KeyNormalizer.equivalent("bZ4X", "BZ4X "));
        assertFalse(KeyNormalizer.equivalent("bZ4X", "bZ5X"));
    }
}
