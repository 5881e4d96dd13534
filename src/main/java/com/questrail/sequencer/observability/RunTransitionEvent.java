package com.questrail.sequencer.observability;

import com.questrail.sequencer.api.RunStatus;

import java.time.Instant;

/**
 * A run changed lifecycle state.
 */
public record RunTransitionEvent(
    Instant timestamp,
    long runId,
    RunStatus from,
    RunStatus to,
    String message
) {
}
