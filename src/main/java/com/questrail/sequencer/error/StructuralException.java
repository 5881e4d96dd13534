package com.questrail.sequencer.error;

import com.questrail.sequencer.api.ErrorCategory;

/**
 * Thrown for unbalanced conditional blocks and unresolvable references
 * encountered at run time.
 */
public class StructuralException extends SequenceException {

    public StructuralException(String message) {
        super(ErrorCategory.STRUCTURAL, message);
    }

    public StructuralException(String message, String command) {
        super(ErrorCategory.STRUCTURAL, message, command, null, null);
    }
}
