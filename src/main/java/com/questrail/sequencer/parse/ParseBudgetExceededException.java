package com.questrail.sequencer.parse;

import com.questrail.sequencer.api.ErrorCategory;
import com.questrail.sequencer.error.SequenceException;

/**
 * Thrown when a classification runs out of its step or time budget.
 */
public class ParseBudgetExceededException extends SequenceException {

    public ParseBudgetExceededException(String message) {
        super(ErrorCategory.TIMEOUT, message);
    }
}
