package com.questrail.sequencer.api;

import java.time.Duration;
import java.util.Objects;

/**
 * Log entry for one dispatched (or skipped) command.
 *
 * @param index          1-based position in the executed list
 * @param command        command text
 * @param success        whether the command succeeded
 * @param skipped        whether it was skipped by a suppressed conditional branch
 * @param message        short description of the result
 * @param executionTime  time spent on the command
 * @param category       failure category, {@code null} on success
 * @param deviceResponse raw device line, {@code null} when none was received
 */
public record CommandResult(
        int index,
        String command,
        boolean success,
        boolean skipped,
        String message,
        Duration executionTime,
        ErrorCategory category,
        String deviceResponse
) {
    public CommandResult {
        Objects.requireNonNull(command, "command");
        Objects.requireNonNull(message, "message");
        Objects.requireNonNull(executionTime, "executionTime");
    }

    /**
     * A failure is critical when its category stops the run under every policy.
     */
    public boolean critical() {
        return !success && category != null && category.isCritical();
    }
}
