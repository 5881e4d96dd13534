package com.questrail.sequencer.error;

import com.questrail.sequencer.api.ErrorCategory;

import java.util.Objects;

/**
 * SequenceException
 * -----------------------------------------------------------------------------
 * Base of the engine's unchecked exception hierarchy.
 *
 * <p>Every exception carries an {@link ErrorCategory} and, where one applies,
 * the command that caused it and the raw device response. The execution core
 * converts these exceptions into {@code CommandResult} and
 * {@code ExecutionOutcome} values; they do not escape the public facade,
 * except for contract violations reported with the standard
 * {@code IllegalArgumentException} and {@code IllegalStateException}.</p>
 */
public class SequenceException extends RuntimeException {

    private final ErrorCategory category;
    private final String command;
    private final String deviceResponse;

    public SequenceException(ErrorCategory category, String message) {
        this(category, message, null, null, null);
    }

    public SequenceException(ErrorCategory category, String message, String command,
                             String deviceResponse, Throwable cause) {
        super(message, cause);
        this.category = Objects.requireNonNull(category, "category");
        this.command = command;
        this.deviceResponse = deviceResponse;
    }

    public ErrorCategory category() {
        return category;
    }

    /**
     * @return the offending command, or {@code null}
     */
    public String command() {
        return command;
    }

    /**
     * @return the raw device line that triggered the failure, or {@code null}
     */
    public String deviceResponse() {
        return deviceResponse;
    }
}
