package com.questrail.sequencer.api;

import java.util.List;
import java.util.Objects;

/**
 * Snapshot of the asynchronous worker.
 *
 * @param status  current lifecycle state
 * @param current number of commands processed so far
 * @param total   number of commands in the run
 * @param results per-command log in execution order
 */
public record ExecutionProgress(RunStatus status, int current, int total, List<CommandResult> results) {
    public ExecutionProgress {
        Objects.requireNonNull(status, "status");
        results = List.copyOf(Objects.requireNonNull(results, "results"));
    }

    public static ExecutionProgress idle() {
        return new ExecutionProgress(RunStatus.IDLE, 0, 0, List.of());
    }

    /**
     * Fraction of the run completed, in {@code [0, 1]}.
     */
    public double fraction() {
        return total == 0 ? 0.0 : Math.min(1.0, (double) current / total);
    }
}
