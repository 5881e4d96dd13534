package com.questrail.sequencer.error;

import com.questrail.sequencer.api.ErrorCategory;

/**
 * Thrown when a {@code stop_if_not} gate evaluates to false.
 */
public class ConditionHaltException extends SequenceException {

    public ConditionHaltException(String command, String condition) {
        super(ErrorCategory.CONDITION, "stopped: condition '" + condition + "' is false",
                command, null, null);
    }
}
