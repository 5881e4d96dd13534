package com.questrail.sequencer.api;

/**
 * Lifecycle of an execution run.
 *
 * <pre>
 * IDLE -> RUNNING <-> PAUSED -> { COMPLETED, FAILED, CANCELLED }
 * </pre>
 */
public enum RunStatus {
    IDLE,
    RUNNING,
    PAUSED,
    COMPLETED,
    FAILED,
    CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }

    public boolean isActive() {
        return this == RUNNING || this == PAUSED;
    }
}
