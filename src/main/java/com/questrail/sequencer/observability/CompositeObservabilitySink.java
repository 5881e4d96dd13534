package com.questrail.sequencer.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * Fans events out to several sinks.
 *
 * <p>A sink that throws is logged and skipped; the remaining sinks still
 * receive the event and the run is unaffected.</p>
 */
public final class CompositeObservabilitySink implements SequenceObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(CompositeObservabilitySink.class);

    private final List<SequenceObservabilitySink> sinks;

    public CompositeObservabilitySink(List<SequenceObservabilitySink> sinks) {
        this.sinks = List.copyOf(Objects.requireNonNull(sinks, "sinks"));
    }

    public static CompositeObservabilitySink of(SequenceObservabilitySink... sinks) {
        return new CompositeObservabilitySink(List.of(sinks));
    }

    @Override
    public void onRunTransition(RunTransitionEvent event) {
        forEach(s -> s.onRunTransition(event));
    }

    @Override
    public void onCommandExecuted(CommandExecutedEvent event) {
        forEach(s -> s.onCommandExecuted(event));
    }

    @Override
    public void onConditionEvaluated(ConditionEvaluatedEvent event) {
        forEach(s -> s.onConditionEvaluated(event));
    }

    @Override
    public void onZoneTransition(ZoneTransitionEvent event) {
        forEach(s -> s.onZoneTransition(event));
    }

    @Override
    public void onError(SequenceErrorEvent event) {
        forEach(s -> s.onError(event));
    }

    private void forEach(Consumer<SequenceObservabilitySink> call) {
        for (SequenceObservabilitySink sink : sinks) {
            try {
                call.accept(sink);
            }
            catch (RuntimeException e) {
                log.warn("Observability sink {} threw; event dropped for that sink", sink.getClass().getName(), e);
            }
        }
    }
}
