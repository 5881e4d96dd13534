package com.questrail.sequencer.zone;

import com.questrail.sequencer.api.ErrorCategory;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of one zone fan-out.
 *
 * @param success        whether every active zone completed
 * @param completedZones zones that completed, ascending
 * @param failedZone     zone that failed, or {@code null}
 * @param message        summary
 * @param category       failure category, {@code null} on success
 * @param failedCommand  command that failed, or {@code null}
 * @param deviceResponse raw device line of the failure, or {@code null}
 */
public record FanOutResult(
        boolean success,
        List<Integer> completedZones,
        Integer failedZone,
        String message,
        ErrorCategory category,
        String failedCommand,
        String deviceResponse
) {
    public FanOutResult {
        completedZones = List.copyOf(Objects.requireNonNull(completedZones, "completedZones"));
        Objects.requireNonNull(message, "message");
        if (!success) {
            Objects.requireNonNull(category, "category");
        }
    }

    static FanOutResult succeeded(List<Integer> zones) {
        return new FanOutResult(true, zones, null, "completed in zones " + zones, null, null, null);
    }
}
