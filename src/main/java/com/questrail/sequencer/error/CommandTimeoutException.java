package com.questrail.sequencer.error;

import com.questrail.sequencer.api.ErrorCategory;

import java.time.Duration;

/**
 * Thrown when the device does not acknowledge a command before its deadline.
 */
public class CommandTimeoutException extends SequenceException {

    private final Duration timeout;

    public CommandTimeoutException(String command, Duration timeout) {
        super(ErrorCategory.TIMEOUT,
                "no acknowledgement for '" + command + "' within " + timeout.toMillis() + " ms",
                command, null, null);
        this.timeout = timeout;
    }

    public Duration timeout() {
        return timeout;
    }
}
