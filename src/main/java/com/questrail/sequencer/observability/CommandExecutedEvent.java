package com.questrail.sequencer.observability;

import com.questrail.sequencer.api.CommandResult;

import java.time.Instant;

/**
 * A command finished (or was skipped). {@code current} counts processed
 * commands including this one.
 */
public record CommandExecutedEvent(
    Instant timestamp,
    long runId,
    CommandResult result,
    int current,
    int total
) {
}
