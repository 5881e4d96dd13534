package com.questrail.sequencer.observability;

/**
 * No-op implementation of SequenceObservabilitySink.
 */
public final class NullObservabilitySink implements SequenceObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onRunTransition(RunTransitionEvent event) {}

    @Override
    public void onCommandExecuted(CommandExecutedEvent event) {}

    @Override
    public void onConditionEvaluated(ConditionEvaluatedEvent event) {}

    @Override
    public void onZoneTransition(ZoneTransitionEvent event) {}

    @Override
    public void onError(SequenceErrorEvent event) {}
}
