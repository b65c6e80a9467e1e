package com.listing.reconciliation.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.listing.reconciliation.rules.KeyNormalizer;
import com.listing.reconciliation.taxonomy.TaxonomyKind;
import com.listing.reconciliation.taxonomy.TaxonomyLookup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Caffeine-backed decorator for a {@link TaxonomyLookup}.
 *
 * <p>Misses are cached too, since a session build looks up the same unknown model once per
 * variant. Registering a model through this lookup invalidates every cached model lookup of
 * that make. Models created behind its back stay hidden until {@link #invalidateModels} runs or
 * the entry expires.</p>
 */
public class CachingTaxonomyLookup implements TaxonomyLookup {
    private static final Logger log = LoggerFactory.getLogger(CachingTaxonomyLookup.class);

    private final TaxonomyLookup delegate;
    private final Cache<LookupKey, Optional<String>> cache;

    public CachingTaxonomyLookup(TaxonomyLookup delegate, CacheConfig config) {
        this.delegate = Objects.requireNonNull(delegate, "delegate is required");
        this.cache = Caffeine.newBuilder()
                .maximumSize(config.maxSize())
                .expireAfterWrite(Duration.ofSeconds(config.ttlSeconds()))
                .recordStats()
                .build();
        log.info("CachingTaxonomyLookup initialized: maxSize={}, ttl={}s", config.maxSize(), config.ttlSeconds());
    }

    @Override
    public Optional<String> resolveMake(String makeName) {
        return cache.get(new LookupKey(TaxonomyKind.MAKE, null, KeyNormalizer.normalize(makeName)),
                key -> delegate.resolveMake(makeName));
    }

    @Override
    public Optional<String> resolveModel(String makeId, String modelName) {
        return cache.get(new LookupKey(TaxonomyKind.MODEL, makeId, KeyNormalizer.normalize(modelName)),
                key -> delegate.resolveModel(makeId, modelName));
    }

    @Override
    public Optional<String> resolveAttribute(TaxonomyKind kind, String name) {
        return cache.get(new LookupKey(kind, null, KeyNormalizer.normalize(name)),
                key -> delegate.resolveAttribute(kind, name));
    }

    @Override
    public String registerModel(String makeId, String modelName) {
        String modelId = delegate.registerModel(makeId, modelName);
        invalidateModels(makeId);
        return modelId;
    }

    /**
     * Drops every cached model lookup under {@code makeId}, misses included.
     */
    @Override
    public void invalidateModels(String makeId) {
        cache.asMap().keySet().removeIf(key -> key.kind() == TaxonomyKind.MODEL && Objects.equals(key.scope(), makeId));
        log.debug("Invalidated cached model lookups for make {}", makeId);
    }

    public void invalidateAll() {
        cache.invalidateAll();
    }

    public CacheStats getStats() {
        com.github.benmanes.caffeine.cache.stats.CacheStats stats = cache.stats();
        return new CacheStats(stats.hitCount(), stats.missCount(), stats.evictionCount(), cache.estimatedSize());
    }

    record LookupKey(TaxonomyKind kind, String scope, String name) {}
}
