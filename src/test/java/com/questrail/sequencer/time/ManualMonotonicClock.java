package com.questrail.sequencer.time;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Deterministic monotonic clock for tests.
 *
 * - Starts at 0
 * - Advances only when explicitly instructed, or by a fixed step per read
 * - Never goes backwards
 */
public final class ManualMonotonicClock implements MonotonicClock {

    private final AtomicLong nowNanos = new AtomicLong(0);
    private volatile long stepPerReadNanos;

    @Override
    public long nowNanos() {
        long step = stepPerReadNanos;
        return step == 0 ? nowNanos.get() : nowNanos.addAndGet(step);
    }

    public void advance(Duration delta) {
        advanceNanos(delta.toNanos());
    }

    public void advanceNanos(long deltaNanos) {
        if (deltaNanos < 0) {
            throw new IllegalArgumentException("Cannot advance monotonic clock backwards");
        }
        nowNanos.addAndGet(deltaNanos);
    }

    public void advanceMillis(long millis) {
        advanceNanos(millis * 1_000_000L);
    }

    /**
     * Makes every read advance the clock, simulating slow work.
     */
    public void advanceOnEveryRead(Duration step) {
        if (step.isNegative()) {
            throw new IllegalArgumentException("Cannot advance monotonic clock backwards");
        }
        this.stepPerReadNanos = step.toNanos();
    }
}
