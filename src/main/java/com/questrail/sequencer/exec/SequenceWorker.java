package com.questrail.sequencer.exec;

import com.questrail.sequencer.api.CommandResult;
import com.questrail.sequencer.api.ErrorCategory;
import com.questrail.sequencer.api.ExecutionOutcome;
import com.questrail.sequencer.api.ExecutionProgress;
import com.questrail.sequencer.api.RunStatus;
import com.questrail.sequencer.observability.RunTransitionEvent;
import com.questrail.sequencer.observability.SequenceErrorEvent;
import com.questrail.sequencer.time.Cancellable;
import com.questrail.sequencer.time.MonotonicClock;
import com.questrail.sequencer.time.MonotonicScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * SequenceWorker
 * =============================================================================
 * Runs one command list at a time on a dedicated background thread.
 *
 * <h2>Lifecycle</h2>
 * <pre>
 * IDLE -> RUNNING <-> PAUSED -> { COMPLETED, FAILED, CANCELLED } -> RUNNING ...
 * </pre>
 * <p>{@link #start} is rejected while a run is active. A finished worker can
 * be started again; the cancellation token moves to a new generation so a
 * stale timeout of the previous run has no effect.</p>
 *
 * <h2>Control</h2>
 * <ul>
 *   <li>{@link #pause()} takes effect at the next command boundary; a wait
 *       already in progress finishes its slice first.</li>
 *   <li>{@link #cancel()} wakes any wait, pause or acknowledgement poll, so
 *       the run ends within one slice.</li>
 *   <li>A run timeout cancels the run with cause TIMEOUT; the outcome is
 *       FAILED with category TIMEOUT.</li>
 * </ul>
 *
 * <h2>Threading</h2>
 * <p>Control methods may be called from any thread. Progress snapshots are
 * consistent copies. Observability events are published outside the state
 * lock.</p>
 */
public final class SequenceWorker implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(SequenceWorker.class);

    static final String THREAD_NAME = "sequence-worker";

    private final SequenceRunner runner;
    private final MonotonicScheduler scheduler;
    private final MonotonicClock clock;
    private final ExecutorService thread;

    private final CancellationToken token = new CancellationToken();
    private final PauseGate gate = new PauseGate();
    private final Object lock = new Object();

    private RunStatus status = RunStatus.IDLE;
    private long runId;
    private int current;
    private int total;
    private List<CommandResult> results = new ArrayList<>();
    private Cancellable timeoutHandle;
    private boolean closed;

    public SequenceWorker(SequenceRunner runner, MonotonicScheduler scheduler, MonotonicClock clock) {
        this.runner = Objects.requireNonNull(runner, "runner");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.thread = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, THREAD_NAME);
            t.setDaemon(true);
            return t;
        });
    }

    public CompletableFuture<ExecutionOutcome> start(List<String> commands) {
        return start(commands, null);
    }

    /**
     * Starts a run in the background.
     *
     * @param timeout overall run timeout, or {@code null} for none
     * @throws IllegalStateException if a run is already active or the worker is closed
     */
    public CompletableFuture<ExecutionOutcome> start(List<String> commands, Duration timeout) {
        List<String> snapshot = List.copyOf(Objects.requireNonNull(commands, "commands"));
        if (timeout != null && (timeout.isNegative() || timeout.isZero())) {
            throw new IllegalArgumentException("timeout must be positive");
        }

        CompletableFuture<ExecutionOutcome> future = new CompletableFuture<>();
        RunStatus previous;
        long id;
        synchronized (lock) {
            if (closed) {
                throw new IllegalStateException("worker is closed");
            }
            if (status.isActive()) {
                throw new IllegalStateException("a run is already in progress");
            }
            previous = status;
            long generation = token.reset();
            gate.resume();
            id = runner.nextRunId();
            runId = id;
            status = RunStatus.RUNNING;
            current = 0;
            total = snapshot.size();
            results = new ArrayList<>();
            timeoutHandle = timeout == null ? null : scheduler.scheduleAfter(timeout, clock, () -> {
                if (token.cancel(generation, ErrorCategory.TIMEOUT, "run timed out after " + timeout.toMillis() + " ms")) {
                    log.warn("Run {} exceeded its timeout of {}", id, timeout);
                    gate.wake();
                }
            });
        }
        transition(id, previous, RunStatus.RUNNING, "started");

        thread.execute(() -> runInBackground(id, snapshot, future));
        return future;
    }

    private void runInBackground(long id, List<String> commands, CompletableFuture<ExecutionOutcome> future) {
        ExecutionOutcome outcome;
        try {
            outcome = runner.run(id, commands, token, gate, this::recordProgress);
        }
        catch (RuntimeException e) {
            log.error("Run {} aborted by an unexpected error", id, e);
            runner.sink().onError(new SequenceErrorEvent(runner.wallClock().now(), ErrorCategory.STRUCTURAL,
                    "run aborted: " + e.getMessage(), e));
            List<CommandResult> soFar;
            synchronized (lock) {
                soFar = List.copyOf(results);
            }
            outcome = ExecutionOutcome.failed("run aborted: " + e.getMessage(), null, null,
                    ErrorCategory.STRUCTURAL, soFar);
        }

        RunStatus from;
        synchronized (lock) {
            if (timeoutHandle != null) {
                timeoutHandle.cancel();
                timeoutHandle = null;
            }
            from = status;
            status = outcome.status();
            gate.resume();
        }
        transition(id, from, outcome.status(), outcome.message());
        future.complete(outcome);
    }

    private void recordProgress(CommandResult result, int index, int of) {
        synchronized (lock) {
            current = index;
            total = of;
            results.add(result);
        }
    }

    /**
     * @return whether the run was running and is now paused
     */
    public boolean pause() {
        long id;
        synchronized (lock) {
            if (status != RunStatus.RUNNING) {
                return false;
            }
            gate.pause();
            status = RunStatus.PAUSED;
            id = runId;
        }
        transition(id, RunStatus.RUNNING, RunStatus.PAUSED, "paused");
        return true;
    }

    /**
     * @return whether the run was paused and is now running
     */
    public boolean resume() {
        long id;
        synchronized (lock) {
            if (status != RunStatus.PAUSED) {
                return false;
            }
            status = RunStatus.RUNNING;
            gate.resume();
            id = runId;
        }
        transition(id, RunStatus.PAUSED, RunStatus.RUNNING, "resumed");
        return true;
    }

    /**
     * Requests cancellation of the active run. Returns immediately; the
     * run's future completes once the worker observes the request.
     *
     * @return whether a run was active
     */
    public boolean cancel() {
        long generation;
        synchronized (lock) {
            if (!status.isActive()) {
                return false;
            }
            generation = token.generation();
        }
        // A run that finished and restarted meanwhile has a new generation and is left alone.
        token.cancel(generation, ErrorCategory.CANCELLED, "cancelled on request");
        gate.wake();
        return true;
    }

    public ExecutionProgress progress() {
        synchronized (lock) {
            return new ExecutionProgress(status, current, total, results);
        }
    }

    public RunStatus status() {
        synchronized (lock) {
            return status;
        }
    }

    public boolean isRunning() {
        return status().isActive();
    }

    /**
     * Cancels any active run and stops the worker thread, waiting up to the
     * configured shutdown timeout.
     */
    @Override
    public void close() {
        synchronized (lock) {
            if (closed) {
                return;
            }
            closed = true;
        }
        cancel();
        thread.shutdown();
        try {
            if (!thread.awaitTermination(runner.timing().shutdownTimeout().toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Worker thread did not stop within {}", runner.timing().shutdownTimeout());
                thread.shutdownNow();
            }
        } catch (InterruptedException e) {
            thread.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private void transition(long id, RunStatus from, RunStatus to, String message) {
        runner.sink().onRunTransition(new RunTransitionEvent(runner.wallClock().now(), id, from, to, message));
    }
}
