package com.questrail.sequencer.time;

import java.util.PriorityQueue;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Deterministic scheduler driven by a {@link MonotonicClock}.
 *
 * Tasks execute ONLY when {@link #runDueTasks()} is called.
 */
public final class DeterministicScheduler implements MonotonicScheduler {

    private final MonotonicClock clock;
    private final PriorityQueue<Scheduled> queue = new PriorityQueue<>();

    public DeterministicScheduler(MonotonicClock clock) {
        this.clock = clock;
    }

    @Override
    public synchronized Cancellable scheduleAtNanos(long deadlineNanos, Runnable task) {
        Scheduled scheduled = new Scheduled(deadlineNanos, task);
        queue.add(scheduled);
        return scheduled;
    }

    /**
     * Run all tasks whose deadlines are <= current clock time.
     */
    public void runDueTasks() {
        while (true) {
            Scheduled next;
            synchronized (this) {
                if (queue.isEmpty() || queue.peek().deadlineNanos > clock.nowNanos()) {
                    return;
                }
                next = queue.poll();
            }
            if (next.cancelled.compareAndSet(false, true)) {
                next.task.run();
            }
        }
    }

    public synchronized int pending() {
        return (int) queue.stream().filter(s -> !s.cancelled.get()).count();
    }

    private static final class Scheduled implements Comparable<Scheduled>, Cancellable {
        private final long deadlineNanos;
        private final Runnable task;
        private final AtomicBoolean cancelled = new AtomicBoolean(false);

        private Scheduled(long deadlineNanos, Runnable task) {
            this.deadlineNanos = deadlineNanos;
            this.task = task;
        }

        @Override
        public boolean cancel() {
            return cancelled.compareAndSet(false, true);
        }

        @Override
        public int compareTo(Scheduled o) {
            return Long.compare(this.deadlineNanos, o.deadlineNanos);
        }
    }
}
