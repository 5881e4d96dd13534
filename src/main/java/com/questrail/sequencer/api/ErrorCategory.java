package com.questrail.sequencer.api;

/**
 * ErrorCategory
 * -----------------------------------------------------------------------------
 * Failure taxonomy shared by validation results, execution outcomes and the
 * exceptions in {@code com.questrail.sequencer.error}.
 *
 * <p>{@link #SYNTAX}, {@link #RANGE} and {@link #STRUCTURAL} are detected
 * before execution starts. The remaining categories arise while a run is in
 * progress.</p>
 */
public enum ErrorCategory {
    /** Unrecognized or malformed command. */
    SYNTAX,
    /** Numeric or size value out of bounds. */
    RANGE,
    /** Parse budget exceeded, acknowledgement timeout or overall run timeout. */
    TIMEOUT,
    /** Unbalanced conditional or unresolvable reference. */
    STRUCTURAL,
    /** The transport refused or failed to send a command. */
    TRANSPORT,
    /** The device answered with an error keyword. */
    DEVICE,
    /** A {@code stop_if_not} gate evaluated to false. */
    CONDITION,
    /** The run was cancelled on request. */
    CANCELLED;

    /**
     * Critical failures stop a run under every failure policy.
     * Device errors and acknowledgement timeouts are the non-critical ones.
     */
    public boolean isCritical() {
        return this != DEVICE && this != TIMEOUT;
    }
}
