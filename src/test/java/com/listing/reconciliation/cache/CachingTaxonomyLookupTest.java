package com.listing.reconciliation.cache;

import com.listing.reconciliation.taxonomy.InMemoryTaxonomy;
import com.listing.reconciliation.taxonomy.TaxonomyKind;
import com.listing.reconciliation.taxonomy.TaxonomyLookup;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static com.listing.reconciliation.TestData.*;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@DisplayName("CachingTaxonomyLookup Tests")
class CachingTaxonomyLookupTest {

    private TaxonomyLookup delegate;
    private CachingTaxonomyLookup lookup;

    @BeforeEach
    void setUp() {
        delegate = spy(taxonomy());
        lookup = new CachingTaxonomyLookup(delegate, CacheConfig.defaults());
    }

    @Test
    @DisplayName("Repeated lookups hit the cache")
    void cachesHits() {
        assertEquals(Optional.of(TOYOTA), lookup.resolveMake("Toyota"));
        assertEquals(Optional.of(TOYOTA), lookup.resolveMake(" TOYOTA "));
        assertEquals(Optional.of(YARIS), lookup.resolveModel(TOYOTA, "Yaris"));
        assertEquals(Optional.of(YARIS), lookup.resolveModel(TOYOTA, "yaris"));

        verify(delegate, times(1)).resolveMake(anyString());
        verify(delegate, times(1)).resolveModel(eq(TOYOTA), anyString());

        CacheStats stats = lookup.getStats();
        assertEquals(2, stats.hitCount());
        assertEquals(2, stats.missCount());
        assertEquals(0.5, stats.hitRate());
    }

    @Test
    @DisplayName("Misses are cached as well")
    void cachesMisses() {
        assertTrue(lookup.resolveModel(TOYOTA, "bZ5X").isEmpty());
        assertTrue(lookup.resolveModel(TOYOTA, "bZ5X").isEmpty());

        verify(delegate, times(1)).resolveModel(TOYOTA, "bZ5X");
    }

    @Test
    @DisplayName("Attribute lookups are keyed by kind")
    void attributesByKind() {
        assertEquals(Optional.of(HYBRID), lookup.resolveAttribute(TaxonomyKind.FUEL_TYPE, "Hybrid"));
        assertTrue(lookup.resolveAttribute(TaxonomyKind.TRANSMISSION, "Hybrid").isEmpty());
    }

    @Nested
    @DisplayName("Invalidation")
    class Invalidation {

        @Test
        @DisplayName("Registering a model drops the cached miss")
        void registerInvalidates() {
            assertTrue(lookup.resolveModel(TOYOTA, "bZ5X").isEmpty());

            String modelId = lookup.registerModel(TOYOTA, "bZ5X");

            assertEquals(Optional.of(modelId), lookup.resolveModel(TOYOTA, "bZ5X"));
        }

        @Test
        @DisplayName("Only the registered make's models are invalidated")
        void otherMakesKept() {
            lookup.resolveModel(VW, "Golf");
            lookup.registerModel(TOYOTA, "bZ5X");
            lookup.resolveModel(VW, "Golf");

            verify(delegate, times(1)).resolveModel(VW, "Golf");
        }

        @Test
        @DisplayName("A model created on the delegate shows up after invalidateModels")
        void createdBehindTheCache() {
            assertTrue(lookup.resolveModel(TOYOTA, "bZ5X").isEmpty());
            String modelId = delegate.registerModel(TOYOTA, "bZ5X");
            assertTrue(lookup.resolveModel(TOYOTA, "bZ5X").isEmpty());

            TaxonomyLookup asPort = lookup;
            asPort.invalidateModels(TOYOTA);

            assertEquals(Optional.of(modelId), lookup.resolveModel(TOYOTA, "bZ5X"));
        }

        @Test
        @DisplayName("invalidateAll empties the cache")
        void invalidateAll() {
            lookup.resolveMake("Toyota");
            lookup.invalidateAll();
            lookup.resolveMake("Toyota");

            verify(delegate, times(2)).resolveMake("Toyota");
        }
    }

    @Nested
    @DisplayName("CacheConfig")
    class Config {

        @Test
        @DisplayName("Non-positive size or ttl is rejected")
        void validation() {
            assertThrows(IllegalArgumentException.class, () -> new CacheConfig(0, 60, true));
            assertThrows(IllegalArgumentException.class, () -> new CacheConfig(10, 0, true));
        }

        @Test
        @DisplayName("Defaults enable the cache")
        void defaults() {
            assertTrue(CacheConfig.defaults().enabled());
            assertFalse(CacheConfig.disabled().enabled());
            assertEquals(0.0, CacheStats.empty().hitRate());
        }
    }

    @Test
    @DisplayName("Registration errors from the delegate propagate")
    void registrationErrors() {
        InMemoryTaxonomy empty = new InMemoryTaxonomy();
        CachingTaxonomyLookup cached = new CachingTaxonomyLookup(empty, CacheConfig.defaults());

        assertThrows(IllegalArgumentException.class, () -> cached.registerModel("make-lada", "Niva"));
    }
}
