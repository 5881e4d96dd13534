package com.questrail.sequencer.api;

/**
 * Counters of one bounded cache.
 */
public record CacheStatistics(
        String name,
        int size,
        int capacity,
        long hits,
        long misses,
        long evictions,
        long invalidations
) {
    public double hitRate() {
        long lookups = hits + misses;
        return lookups == 0 ? 0.0 : (double) hits / lookups;
    }
}
