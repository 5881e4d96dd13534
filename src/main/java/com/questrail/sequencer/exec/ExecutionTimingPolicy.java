package com.questrail.sequencer.exec;

import java.time.Duration;
import java.util.Objects;

/**
 * ExecutionTimingPolicy
 * -----------------------------------------------------------------------------
 * Timing configuration for the execution core.
 *
 * <h2>Configuration Parameters</h2>
 * <ul>
 *   <li><b>ackTimeout</b>: deadline for the device to acknowledge a regular
 *       command. Exceeding it fails that command.</li>
 *   <li><b>zoneAckTimeout</b>: deadline for each acknowledgement during zone
 *       fan-out (mask command and base command).</li>
 *   <li><b>slice</b>: longest uninterrupted suspension. Waits, acknowledgement
 *       polls and paused idling are cut into slices of at most this length
 *       so cancellation is observed promptly.</li>
 *   <li><b>shutdownTimeout</b>: how long {@code close()} waits for the worker
 *       thread.</li>
 * </ul>
 *
 * <p>The slice bounds cancellation latency, so it must stay well below
 * 200 ms.</p>
 */
public record ExecutionTimingPolicy(
        Duration ackTimeout,
        Duration zoneAckTimeout,
        Duration slice,
        Duration shutdownTimeout
) {
    public ExecutionTimingPolicy {
        Objects.requireNonNull(ackTimeout, "ackTimeout");
        Objects.requireNonNull(zoneAckTimeout, "zoneAckTimeout");
        Objects.requireNonNull(slice, "slice");
        Objects.requireNonNull(shutdownTimeout, "shutdownTimeout");

        if (ackTimeout.isNegative() || ackTimeout.isZero()) {
            throw new IllegalArgumentException("ackTimeout must be positive");
        }
        if (zoneAckTimeout.isNegative() || zoneAckTimeout.isZero()) {
            throw new IllegalArgumentException("zoneAckTimeout must be positive");
        }
        if (slice.isNegative() || slice.isZero()) {
            throw new IllegalArgumentException("slice must be positive");
        }
        if (shutdownTimeout.isNegative()) {
            throw new IllegalArgumentException("shutdownTimeout must be non-negative");
        }
    }

    /**
     * Defaults: 10 s acknowledgement timeout, 5 s per zone acknowledgement,
     * 100 ms slices, 5 s shutdown.
     */
    public static ExecutionTimingPolicy defaults() {
        return new ExecutionTimingPolicy(
                Duration.ofSeconds(10),
                Duration.ofSeconds(5),
                Duration.ofMillis(100),
                Duration.ofSeconds(5)
        );
    }

    public ExecutionTimingPolicy withAckTimeout(Duration timeout) {
        return new ExecutionTimingPolicy(timeout, zoneAckTimeout, slice, shutdownTimeout);
    }

    public ExecutionTimingPolicy withZoneAckTimeout(Duration timeout) {
        return new ExecutionTimingPolicy(ackTimeout, timeout, slice, shutdownTimeout);
    }
}
