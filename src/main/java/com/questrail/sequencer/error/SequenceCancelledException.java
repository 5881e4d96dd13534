package com.questrail.sequencer.error;

import com.questrail.sequencer.api.ErrorCategory;

/**
 * Thrown from a suspension point once the run's cancellation token is set.
 */
public class SequenceCancelledException extends SequenceException {

    public SequenceCancelledException(String message) {
        super(ErrorCategory.CANCELLED, message);
    }

    public SequenceCancelledException(String message, String command) {
        super(ErrorCategory.CANCELLED, message, command, null, null);
    }
}
