package com.questrail.sequencer.api;

import java.util.List;
import java.util.Objects;

/**
 * ExecutionOutcome
 * -----------------------------------------------------------------------------
 * Terminal result of a synchronous or asynchronous run.
 *
 * <p>For failures the outcome names the offending command and the raw device
 * response that caused it, when there was one. A cancelled run is reported
 * with {@link RunStatus#CANCELLED}, never as {@link RunStatus#FAILED}.</p>
 *
 * @param status           COMPLETED, FAILED or CANCELLED
 * @param message          summary suitable for display
 * @param offendingCommand command that stopped the run, or {@code null}
 * @param deviceResponse   raw acknowledgement line of that command, or {@code null}
 * @param category         failure category, {@code null} on success
 * @param results          per-command log
 */
public record ExecutionOutcome(
        RunStatus status,
        String message,
        String offendingCommand,
        String deviceResponse,
        ErrorCategory category,
        List<CommandResult> results
) {
    public ExecutionOutcome {
        Objects.requireNonNull(status, "status");
        Objects.requireNonNull(message, "message");
        results = List.copyOf(Objects.requireNonNull(results, "results"));
        if (!status.isTerminal()) {
            throw new IllegalArgumentException("outcome status must be terminal: " + status);
        }
    }

    public static ExecutionOutcome completed(String message, List<CommandResult> results) {
        return new ExecutionOutcome(RunStatus.COMPLETED, message, null, null, null, results);
    }

    public static ExecutionOutcome failed(String message, String offendingCommand, String deviceResponse,
                                          ErrorCategory category, List<CommandResult> results) {
        Objects.requireNonNull(category, "category");
        return new ExecutionOutcome(RunStatus.FAILED, message, offendingCommand, deviceResponse, category, results);
    }

    public static ExecutionOutcome cancelled(String message, String offendingCommand, List<CommandResult> results) {
        return new ExecutionOutcome(RunStatus.CANCELLED, message, offendingCommand, null,
                ErrorCategory.CANCELLED, results);
    }

    public boolean isSuccess() {
        return status == RunStatus.COMPLETED;
    }
}
