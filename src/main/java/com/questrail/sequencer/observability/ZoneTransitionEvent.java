package com.questrail.sequencer.observability;

import com.questrail.sequencer.zone.ZoneStatus;

import java.time.Instant;

/**
 * A zone changed status.
 */
public record ZoneTransitionEvent(
    Instant timestamp,
    int zone,
    ZoneStatus from,
    ZoneStatus to,
    String error
) {
}
