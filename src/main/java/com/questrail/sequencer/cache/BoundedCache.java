package com.questrail.sequencer.cache;

import com.questrail.sequencer.api.CacheStatistics;
import com.questrail.sequencer.time.MonotonicClock;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * BoundedCache
 * =============================================================================
 * Capacity-bounded, dependency-aware result cache with approximate LRU
 * eviction.
 *
 * <h2>Eviction</h2>
 * <p>When an insert would exceed the capacity, the oldest
 * {@code evictionFraction} of the entries (by last touch on the monotonic
 * clock, ties broken by touch order) are dropped in one pass.</p>
 *
 * <h2>Dependencies</h2>
 * <p>An entry may record the set of sequence and button names it was derived
 * from. {@link #invalidateDependents(String)} drops every entry whose set
 * contains the name, leaving unrelated entries in place.</p>
 *
 * <h2>Thread Safety</h2>
 * <p>All operations are serialized on a private lock.</p>
 */
public final class BoundedCache<K, V> {

    private final Object lock = new Object();

    private final String name;
    private final int capacity;
    private final double evictionFraction;
    private final MonotonicClock clock;

    private final Map<K, CacheEntry<V>> entries = new HashMap<>();
    private long touchCounter;

    private long hits;
    private long misses;
    private long evictions;
    private long invalidations;

    public BoundedCache(String name, int capacity, double evictionFraction, MonotonicClock clock) {
        this.name = Objects.requireNonNull(name, "name");
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive");
        }
        if (!(evictionFraction > 0.0 && evictionFraction <= 1.0)) {
            throw new IllegalArgumentException("evictionFraction must be in (0, 1]");
        }
        this.capacity = capacity;
        this.evictionFraction = evictionFraction;
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public String name() {
        return name;
    }

    public Optional<V> get(K key) {
        Objects.requireNonNull(key, "key");
        synchronized (lock) {
            CacheEntry<V> entry = entries.get(key);
            if (entry == null) {
                misses++;
                return Optional.empty();
            }
            hits++;
            entry.touch(clock.nowNanos(), ++touchCounter);
            return Optional.of(entry.value());
        }
    }

    public void put(K key, V value) {
        put(key, value, Set.of());
    }

    public void put(K key, V value, Set<String> dependencies) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
        Objects.requireNonNull(dependencies, "dependencies");
        synchronized (lock) {
            if (!entries.containsKey(key) && entries.size() >= capacity) {
                evictOldest();
            }
            entries.put(key, new CacheEntry<>(value, dependencies, clock.nowNanos(), ++touchCounter));
        }
    }

    /**
     * Drops every entry that was derived from {@code dependencyName}.
     *
     * @return number of entries dropped
     */
    public int invalidateDependents(String dependencyName) {
        Objects.requireNonNull(dependencyName, "dependencyName");
        synchronized (lock) {
            int removed = 0;
            Iterator<CacheEntry<V>> it = entries.values().iterator();
            while (it.hasNext()) {
                if (it.next().dependsOn(dependencyName)) {
                    it.remove();
                    removed++;
                }
            }
            invalidations += removed;
            return removed;
        }
    }

    public boolean invalidate(K key) {
        synchronized (lock) {
            boolean removed = entries.remove(key) != null;
            if (removed) {
                invalidations++;
            }
            return removed;
        }
    }

    public void clear() {
        synchronized (lock) {
            invalidations += entries.size();
            entries.clear();
        }
    }

    public int size() {
        synchronized (lock) {
            return entries.size();
        }
    }

    public CacheStatistics statistics() {
        synchronized (lock) {
            return new CacheStatistics(name, entries.size(), capacity, hits, misses, evictions, invalidations);
        }
    }

    public void resetStatistics() {
        synchronized (lock) {
            hits = 0;
            misses = 0;
            evictions = 0;
            invalidations = 0;
        }
    }

    private void evictOldest() {
        int toEvict = Math.max(1, (int) (capacity * evictionFraction));
        List<Map.Entry<K, CacheEntry<V>>> byAge = new ArrayList<>(entries.entrySet());
        byAge.sort(Comparator
                .comparingLong((Map.Entry<K, CacheEntry<V>> e) -> e.getValue().lastTouchNanos())
                .thenComparingLong(e -> e.getValue().touchOrder()));
        for (int i = 0; i < toEvict && i < byAge.size(); i++) {
            entries.remove(byAge.get(i).getKey());
            evictions++;
        }
    }
}
