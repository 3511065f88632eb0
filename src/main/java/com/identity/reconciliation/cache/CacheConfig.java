package com.identity.reconciliation.cache;

/**
 * Configuration for the lookup cache. Entries never expire within a run.
 *
 * @param maxSize maximum number of resolved entries kept per lookup kind
 */
public record CacheConfig(int maxSize) {

    public CacheConfig {
        if (maxSize <= 0) {
            throw new IllegalArgumentException("maxSize must be > 0");
        }
    }

    /**
     * Default cache configuration: 100,000 entries per lookup kind.
     */
    public static CacheConfig defaults() {
        return new CacheConfig(100_000);
    }
}
