package com.questrail.sequencer.observability;

import java.time.Instant;

/**
 * An {@code if} or {@code stop_if_not} condition was evaluated.
 * {@code ignored} is set when the result had no effect because the enclosing
 * branch was already suppressed.
 */
public record ConditionEvaluatedEvent(
    Instant timestamp,
    String condition,
    boolean value,
    boolean ignored
) {
}
