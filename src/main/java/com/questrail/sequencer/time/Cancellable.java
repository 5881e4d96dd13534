package com.questrail.sequencer.time;

/**
 * Cancellable
 * =============================================================================
 * Handle for a task scheduled on a {@link MonotonicScheduler}.
 */
public interface Cancellable
{
    /**
     * Attempt to cancel the scheduled task.
     *
     * @return {@code true} if cancellation succeeded; {@code false} if the task
     *         already ran or was cancelled before.
     */
    boolean cancel();
}
