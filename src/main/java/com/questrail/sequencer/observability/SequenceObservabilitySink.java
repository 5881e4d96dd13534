package com.questrail.sequencer.observability;

/**
 * Receives engine observability events.
 * Implementations can provide logging, metrics, or UI updates.
 *
 * <p>Callbacks run on the thread doing the work (the caller for synchronous
 * runs, the worker thread for asynchronous ones) and should return quickly.</p>
 */
public interface SequenceObservabilitySink {
    /**
     * Called when a run changes lifecycle state, including the terminal transition.
     * @param event the transition
     */
    void onRunTransition(RunTransitionEvent event);

    /**
     * Called after each command of a run.
     * @param event the result and progress
     */
    void onCommandExecuted(CommandExecutedEvent event);

    /**
     * Called when a condition is evaluated.
     * @param event the condition and its value
     */
    void onConditionEvaluated(ConditionEvaluatedEvent event);

    /**
     * Called when a zone changes status.
     * @param event the zone transition
     */
    void onZoneTransition(ZoneTransitionEvent event);

    /**
     * Called for validation rejections and execution failures.
     * @param event the error
     */
    void onError(SequenceErrorEvent event);
}
