package com.questrail.sequencer.condition;

import com.questrail.sequencer.api.ErrorCategory;
import com.questrail.sequencer.error.SequenceException;

/**
 * Thrown by {@link ConditionParser} for expressions it cannot accept.
 * The category is {@link ErrorCategory#SYNTAX} or, for too many operands,
 * {@link ErrorCategory#RANGE}.
 */
public class ConditionSyntaxException extends SequenceException {

    public ConditionSyntaxException(ErrorCategory category, String message) {
        super(category, message);
    }
}
