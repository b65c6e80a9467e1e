package com.listing.reconciliation.cache;

/**
 * Configuration for the taxonomy lookup cache.
 *
 * @param maxSize    maximum number of cached lookups
 * @param ttlSeconds time-to-live of each cached lookup
 * @param enabled    whether lookups are cached at all
 */
public record CacheConfig(int maxSize, int ttlSeconds, boolean enabled) {

    public CacheConfig {
        if (maxSize <= 0) {
            throw new IllegalArgumentException("maxSize must be > 0");
        }
        if (ttlSeconds <= 0) {
            throw new IllegalArgumentException("ttlSeconds must be > 0");
        }
    }

    /**
     * 5,000 lookups for 10 minutes.
     */
    public static CacheConfig defaults() {
        return new CacheConfig(5_000, 600, true);
    }

    public static CacheConfig disabled() {
        return new CacheConfig(1, 1, false);
    }
}
