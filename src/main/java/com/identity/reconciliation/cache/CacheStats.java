package com.identity.reconciliation.cache;

/**
 * Lookup cache metrics.
 *
 * @param hitCount   number of lookups answered from the cache
 * @param missCount  number of lookups that went to the store
 * @param unresolved number of distinct keys the store could not resolve
 * @param size       current number of cached entries
 */
public record CacheStats(long hitCount, long missCount, long unresolved, long size) {

    /**
     * Returns the hit rate (0.0 to 1.0).
     */
    public double hitRate() {
        long total = hitCount + missCount;
        return total == 0 ? 0.0 : (double) hitCount / total;
    }

    public static CacheStats empty() {
        return new CacheStats(0, 0, 0, 0);
    }
}
