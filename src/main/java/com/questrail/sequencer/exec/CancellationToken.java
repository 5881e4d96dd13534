package com.questrail.sequencer.exec;

import com.questrail.sequencer.api.ErrorCategory;
import com.questrail.sequencer.error.SequenceCancelledException;

import java.time.Duration;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * CancellationToken
 * =============================================================================
 * Cooperative, reusable cancellation flag observed at every suspension point.
 *
 * <h2>Generations</h2>
 * <p>{@link #reset()} starts a new generation. A cancellation aimed at a
 * specific generation ({@link #cancel(long, ErrorCategory, String)}) is ignored
 * once the token has moved on, so a late run timeout cannot cancel the next
 * run.</p>
 *
 * <h2>Waiting</h2>
 * <p>{@link #awaitCancellation(Duration)} sleeps on a condition variable that
 * {@code cancel} signals, so a waiting run wakes immediately instead of at the
 * end of its slice.</p>
 *
 * <h2>Thread Safety</h2>
 * <p>All state is guarded by one lock; any thread may cancel.</p>
 */
public final class CancellationToken {

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition cancelledCondition = lock.newCondition();

    private long generation;
    private boolean cancelled;
    private ErrorCategory cause = ErrorCategory.CANCELLED;
    private String reason = "cancelled";

    public long generation() {
        lock.lock();
        try {
            return generation;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Clears the flag and starts a new generation.
     *
     * @return the new generation
     */
    public long reset() {
        lock.lock();
        try {
            generation++;
            cancelled = false;
            cause = ErrorCategory.CANCELLED;
            reason = "cancelled";
            return generation;
        } finally {
            lock.unlock();
        }
    }

    public void cancel() {
        cancel("cancelled on request");
    }

    public void cancel(String reason) {
        lock.lock();
        try {
            cancelLocked(ErrorCategory.CANCELLED, reason);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Cancels only if the token is still on {@code expectedGeneration}.
     *
     * @return whether the token was cancelled by this call
     */
    public boolean cancel(long expectedGeneration, ErrorCategory cause, String reason) {
        lock.lock();
        try {
            if (generation != expectedGeneration || cancelled) {
                return false;
            }
            cancelLocked(cause, reason);
            return true;
        } finally {
            lock.unlock();
        }
    }

    private void cancelLocked(ErrorCategory cause, String reason) {
        if (!cancelled) {
            this.cancelled = true;
            this.cause = cause;
            this.reason = reason;
        }
        cancelledCondition.signalAll();
    }

    public boolean isCancelled() {
        lock.lock();
        try {
            return cancelled;
        } finally {
            lock.unlock();
        }
    }

    /**
     * {@link ErrorCategory#CANCELLED} for requested cancellation,
     * {@link ErrorCategory#TIMEOUT} for an expired run timeout.
     */
    public ErrorCategory cause() {
        lock.lock();
        try {
            return cause;
        } finally {
            lock.unlock();
        }
    }

    public String reason() {
        lock.lock();
        try {
            return reason;
        } finally {
            lock.unlock();
        }
    }

    /**
     * @throws SequenceCancelledException if the token is cancelled
     */
    public void throwIfCancelled() {
        lock.lock();
        try {
            if (cancelled) {
                throw new SequenceCancelledException(reason);
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Sleeps until the token is cancelled or the timeout passes.
     * An interrupt counts as cancellation; the interrupt flag is restored.
     *
     * @return {@code true} if cancelled
     */
    public boolean awaitCancellation(Duration timeout) {
        long nanos = timeout.toNanos();
        lock.lock();
        try {
            while (!cancelled && nanos > 0) {
                nanos = cancelledCondition.awaitNanos(nanos);
            }
            return cancelled;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            cancelLocked(ErrorCategory.CANCELLED, "interrupted");
            return true;
        } finally {
            lock.unlock();
        }
    }
}
