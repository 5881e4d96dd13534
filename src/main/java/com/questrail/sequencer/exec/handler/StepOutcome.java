package com.questrail.sequencer.exec.handler;

import java.util.Objects;

/**
 * Successful result of processing one command.
 * Failures are reported by throwing a {@code SequenceException}.
 *
 * @param message        short description for the result log
 * @param deviceResponse acknowledgement line, or {@code null}
 */
public record StepOutcome(String message, String deviceResponse) {
    public StepOutcome {
        Objects.requireNonNull(message, "message");
    }

    public static StepOutcome of(String message) {
        return new StepOutcome(message, null);
    }
}
