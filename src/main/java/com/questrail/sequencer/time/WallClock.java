package com.questrail.sequencer.time;

import java.time.Instant;

/**
 * WallClock
 * =============================================================================
 * Wall-clock source used strictly for observability event timestamps.
 *
 * <p>
 * This clock may jump. It MUST NOT be used for waits, deadlines or cache
 * recency.
 * </p>
 */
public interface WallClock
{
    /**
     * Returns the current wall-clock time.
     */
    Instant now();
}
