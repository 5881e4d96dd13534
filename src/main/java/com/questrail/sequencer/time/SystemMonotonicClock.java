package com.questrail.sequencer.time;

/**
 * SystemMonotonicClock
 * =============================================================================
 * Production {@link MonotonicClock} backed by {@link System#nanoTime()}.
 *
 * <h2>Properties</h2>
 * <ul>
 *   <li>Never goes backward</li>
 *   <li>Unaffected by NTP or manual clock changes</li>
 *   <li>Only meaningful for elapsed time, not absolute timestamps</li>
 * </ul>
 *
 * <p>Tests drive the engine with {@code ManualMonotonicClock} instead.</p>
 */
public enum SystemMonotonicClock implements MonotonicClock {
    /**
     * Singleton instance.
     */
    INSTANCE;

    @Override
    public long nowNanos() {
        return System.nanoTime();
    }
}
