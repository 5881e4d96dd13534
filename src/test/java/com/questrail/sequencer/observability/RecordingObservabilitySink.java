package com.questrail.sequencer.observability;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Test sink that records events for assertions.
 */
public final class RecordingObservabilitySink implements SequenceObservabilitySink {
    private final List<Object> events = new ArrayList<>();

    @Override
    public synchronized void onRunTransition(RunTransitionEvent event) {
        events.add(event);
    }

    @Override
    public synchronized void onCommandExecuted(CommandExecutedEvent event) {
        events.add(event);
    }

    @Override
    public synchronized void onConditionEvaluated(ConditionEvaluatedEvent event) {
        events.add(event);
    }

    @Override
    public synchronized void onZoneTransition(ZoneTransitionEvent event) {
        events.add(event);
    }

    @Override
    public synchronized void onError(SequenceErrorEvent event) {
        events.add(event);
    }

    public synchronized List<Object> getAllEvents() {
        return new ArrayList<>(events);
    }

    public synchronized <T> List<T> eventsOfType(Class<T> type) {
        return events.stream()
            .filter(type::isInstance)
            .map(type::cast)
            .collect(Collectors.toList());
    }

    public synchronized <T> boolean hasEventOfType(Class<T> type) {
        return events.stream().anyMatch(type::isInstance);
    }
}
