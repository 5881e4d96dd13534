package com.questrail.sequencer.time;

/**
 * MonotonicClock
 * =============================================================================
 * Time source for every correctness-relevant timing decision in the engine.
 *
 * <h2>Binding invariant</h2>
 * Wait slicing, acknowledgement deadlines, parse budgets and cache recency
 * MUST use a monotonic source. Wall-clock time is permitted only for
 * observability timestamps.
 */
public interface MonotonicClock
{
    /**
     * Returns a monotonically increasing tick value in nanoseconds.
     * Values are only meaningful for elapsed time computations.
     */
    long nowNanos();
}
