package com.questrail.sequencer.cache;

import java.util.Set;

/**
 * A cached value with its recency stamp and the names it was derived from.
 *
 * <p>Instances are only touched under the owning {@link BoundedCache}'s lock.</p>
 */
public final class CacheEntry<V> {
    private final V value;
    private final Set<String> dependencies;
    private long lastTouchNanos;
    private long touchOrder;

    CacheEntry(V value, Set<String> dependencies, long nowNanos, long touchOrder) {
        this.value = value;
        this.dependencies = Set.copyOf(dependencies);
        this.lastTouchNanos = nowNanos;
        this.touchOrder = touchOrder;
    }

    public V value() {
        return value;
    }

    public Set<String> dependencies() {
        return dependencies;
    }

    public long lastTouchNanos() {
        return lastTouchNanos;
    }

    long touchOrder() {
        return touchOrder;
    }

    void touch(long nowNanos, long order) {
        this.lastTouchNanos = nowNanos;
        this.touchOrder = order;
    }

    boolean dependsOn(String name) {
        return dependencies.contains(name);
    }
}
