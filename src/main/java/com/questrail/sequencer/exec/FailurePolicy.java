package com.questrail.sequencer.exec;

/**
 * What a run does after a command fails.
 */
public enum FailurePolicy {
    /** Stop at the first failed command. */
    FAIL_FAST,
    /**
     * Record device error and acknowledgement timeout failures and carry on.
     * Transport, structural and condition failures still stop the run.
     */
    CONTINUE_ON_NON_CRITICAL
}
