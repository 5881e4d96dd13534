package com.questrail.sequencer.observability;

import com.questrail.sequencer.api.ErrorCategory;

import java.time.Instant;

/**
 * An error or anomaly in the engine. {@code cause} may be {@code null}.
 */
public record SequenceErrorEvent(
    Instant timestamp,
    ErrorCategory category,
    String message,
    Throwable cause
) {
}
