package com.questrail.sequencer.api;

import java.util.Objects;

/**
 * One problem found while validating a sequence.
 *
 * @param index    1-based command index, or 0 when the issue concerns the
 *                 sequence as a whole
 * @param message  human readable description including the index
 * @param category failure category
 */
public record ValidationIssue(int index, String message, ErrorCategory category) {
    public ValidationIssue {
        if (index < 0) {
            throw new IllegalArgumentException("index must be >= 0");
        }
        Objects.requireNonNull(message, "message");
        Objects.requireNonNull(category, "category");
    }
}
