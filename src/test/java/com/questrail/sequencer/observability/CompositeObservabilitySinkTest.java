package com.questrail.sequencer.observability;

import com.questrail.sequencer.api.ErrorCategory;
import com.questrail.sequencer.api.RunStatus;
import com.questrail.sequencer.zone.ZoneStatus;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class CompositeObservabilitySinkTest {

    @Test
    void everySinkReceivesEveryEvent() {
        RecordingObservabilitySink a = new RecordingObservabilitySink();
        RecordingObservabilitySink b = new RecordingObservabilitySink();
        CompositeObservabilitySink sink = CompositeObservabilitySink.of(a, b);

        sink.onRunTransition(new RunTransitionEvent(Instant.EPOCH, 1, RunStatus.IDLE, RunStatus.RUNNING, "started"));
        sink.onZoneTransition(new ZoneTransitionEvent(Instant.EPOCH, 2, ZoneStatus.ACTIVE, ZoneStatus.EXECUTING, null));

        assertEquals(2, a.getAllEvents().size());
        assertEquals(2, b.getAllEvents().size());
        assertTrue(b.hasEventOfType(ZoneTransitionEvent.class));
    }

    @Test
    void throwingSinkDoesNotStarveOthers() {
        SequenceObservabilitySink broken = new SequenceObservabilitySink() {
            @Override
            public void onRunTransition(RunTransitionEvent event) {
                throw new IllegalStateException("boom");
            }

            @Override
            public void onCommandExecuted(CommandExecutedEvent event) {
            }

            @Override
            public void onConditionEvaluated(ConditionEvaluatedEvent event) {
            }

            @Override
            public void onZoneTransition(ZoneTransitionEvent event) {
            }

            @Override
            public void onError(SequenceErrorEvent event) {
                throw new IllegalStateException("boom");
            }
        };
        RecordingObservabilitySink recorder = new RecordingObservabilitySink();
        CompositeObservabilitySink sink = CompositeObservabilitySink.of(broken, recorder);

        assertDoesNotThrow(() -> sink.onRunTransition(
                new RunTransitionEvent(Instant.EPOCH, 1, RunStatus.RUNNING, RunStatus.FAILED, "x")));
        assertDoesNotThrow(() -> sink.onError(
                new SequenceErrorEvent(Instant.EPOCH, ErrorCategory.TRANSPORT, "link down", null)));

        assertEquals(2, recorder.getAllEvents().size());
    }

    @Test
    void slf4jSinkAcceptsAllEventKinds() {
        Slf4jSequenceObservabilitySink sink = new Slf4jSequenceObservabilitySink();

        assertDoesNotThrow(() -> {
            sink.onRunTransition(new RunTransitionEvent(Instant.EPOCH, 1, RunStatus.RUNNING, RunStatus.COMPLETED, "done"));
            sink.onZoneTransition(new ZoneTransitionEvent(Instant.EPOCH, 1, ZoneStatus.EXECUTING, ZoneStatus.ERROR, "nak"));
            sink.onError(new SequenceErrorEvent(Instant.EPOCH, ErrorCategory.DEVICE, "device error", null));
        });
    }
}
