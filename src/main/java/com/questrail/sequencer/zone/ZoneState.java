package com.questrail.sequencer.zone;

import java.util.Objects;

/**
 * Snapshot of one zone.
 *
 * @param zone     zone id, 1..4
 * @param status   current status
 * @param progress completion fraction of the current fan-out for this zone
 * @param error    error text when {@code status} is ERROR, else {@code null}
 */
public record ZoneState(int zone, ZoneStatus status, double progress, String error) {
    public ZoneState {
        ZoneSet.checkZone(zone);
        Objects.requireNonNull(status, "status");
        if (progress < 0.0 || progress > 1.0) {
            throw new IllegalArgumentException("progress must be in [0, 1]");
        }
    }

    static ZoneState inactive(int zone) {
        return new ZoneState(zone, ZoneStatus.INACTIVE, 0.0, null);
    }
}
