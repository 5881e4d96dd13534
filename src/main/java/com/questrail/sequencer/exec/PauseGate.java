package com.questrail.sequencer.exec;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Blocks the worker between commands while a run is paused.
 *
 * <p>Waiting is done on a condition variable in bounded slices, re-checking
 * the cancellation token each time, so a paused run stays cancellable and
 * never spins.</p>
 */
public final class PauseGate {

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition changed = lock.newCondition();
    private boolean paused;

    public void pause() {
        lock.lock();
        try {
            paused = true;
        } finally {
            lock.unlock();
        }
    }

    public void resume() {
        lock.lock();
        try {
            paused = false;
            changed.signalAll();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Wakes a waiting worker without resuming, e.g. after cancellation.
     */
    public void wake() {
        lock.lock();
        try {
            changed.signalAll();
        } finally {
            lock.unlock();
        }
    }

    public boolean isPaused() {
        lock.lock();
        try {
            return paused;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns once the gate is open.
     *
     * @return whether the caller had to wait
     * @throws com.questrail.sequencer.error.SequenceCancelledException if the token is cancelled while waiting
     */
    public boolean awaitOpen(CancellationToken token, Duration slice) {
        Objects.requireNonNull(token, "token");
        Objects.requireNonNull(slice, "slice");
        boolean waited = false;
        lock.lock();
        try {
            while (paused) {
                waited = true;
                token.throwIfCancelled();
                try {
                    changed.awaitNanos(slice.toNanos());
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    token.cancel("interrupted");
                }
            }
        } finally {
            lock.unlock();
        }
        token.throwIfCancelled();
        return waited;
    }
}
