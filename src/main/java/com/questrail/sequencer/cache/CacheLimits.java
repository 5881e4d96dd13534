package com.questrail.sequencer.cache;

/**
 * Capacities of the engine's result caches.
 *
 * @param classifyCapacity entries of the per-command classification cache
 * @param validateCapacity entries of the per-sequence validation cache
 * @param expandCapacity   entries of the per-sequence expansion cache
 * @param searchCapacity   entries of the search result cache
 * @param evictionFraction share of entries dropped when a cache overflows
 */
public record CacheLimits(
        int classifyCapacity,
        int validateCapacity,
        int expandCapacity,
        int searchCapacity,
        double evictionFraction
) {
    public CacheLimits {
        if (classifyCapacity <= 0 || validateCapacity <= 0 || expandCapacity <= 0 || searchCapacity <= 0) {
            throw new IllegalArgumentException("cache capacities must be positive");
        }
        if (!(evictionFraction > 0.0 && evictionFraction <= 1.0)) {
            throw new IllegalArgumentException("evictionFraction must be in (0, 1]");
        }
    }

    public static CacheLimits defaults() {
        return new CacheLimits(5000, 1000, 5000, 1000, 0.2);
    }
}
