package com.questrail.sequencer.error;

import com.questrail.sequencer.api.ErrorCategory;

/**
 * Thrown when a command cannot be handed to the device link.
 */
public class TransportException extends SequenceException {

    public TransportException(String command, String message) {
        this(command, message, null);
    }

    public TransportException(String command, String message, Throwable cause) {
        super(ErrorCategory.TRANSPORT, message, command, null, cause);
    }
}
