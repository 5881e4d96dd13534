package com.questrail.sequencer.exec;

import com.questrail.sequencer.api.CommandResult;
import com.questrail.sequencer.api.ErrorCategory;
import com.questrail.sequencer.api.ExecutionOutcome;
import com.questrail.sequencer.api.RunStatus;
import com.questrail.sequencer.observability.RunTransitionEvent;
import com.questrail.sequencer.observability.SequenceErrorEvent;
import com.questrail.sequencer.test.ScriptedDeviceTransport.Reply;
import com.questrail.sequencer.zone.ZoneSet;
import com.questrail.sequencer.zone.ZoneStatus;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SequenceExecutorTest {

    @Test
    void completesWhenEveryCommandIsAcknowledged() {
        ExecFixture f = new ExecFixture();
        SequenceExecutor executor = new SequenceExecutor(f.runner);

        ExecutionOutcome outcome = executor.execute(List.of("led on", "wait 0.05", "led off"));

        assertEquals(RunStatus.COMPLETED, outcome.status());
        assertEquals("completed 3 commands", outcome.message());
        assertEquals(3, outcome.results().size());
        assertEquals(List.of("led on", "led off"), f.device.sent());

        List<RunTransitionEvent> transitions = f.sink.eventsOfType(RunTransitionEvent.class);
        assertEquals(2, transitions.size());
        assertEquals(RunStatus.RUNNING, transitions.get(0).to());
        assertEquals(RunStatus.COMPLETED, transitions.get(1).to());
    }

    @Test
    void invalidListFailsBeforeAnythingIsSent() {
        ExecFixture f = new ExecFixture();

        ExecutionOutcome outcome = new SequenceExecutor(f.runner).execute(List.of("led on", "endif"));

        assertEquals(RunStatus.FAILED, outcome.status());
        assertEquals(ErrorCategory.STRUCTURAL, outcome.category());
        assertTrue(outcome.message().startsWith("validation failed: Command 2"));
        assertEquals("endif", outcome.offendingCommand());
        assertTrue(f.device.sent().isEmpty());
        assertTrue(f.sink.hasEventOfType(SequenceErrorEvent.class));
    }

    @Test
    void emptyListFailsPreflight() {
        ExecFixture f = new ExecFixture();

        ExecutionOutcome outcome = new SequenceExecutor(f.runner).execute(List.of());

        assertEquals(RunStatus.FAILED, outcome.status());
        assertEquals(ErrorCategory.STRUCTURAL, outcome.category());
        assertNull(outcome.offendingCommand());
        assertTrue(f.device.sent().isEmpty());
    }

    @Test
    void outOfRangeWaitFailsPreflight() {
        ExecFixture f = new ExecFixture();

        ExecutionOutcome outcome = new SequenceExecutor(f.runner).execute(List.of("led on", "wait 99999"));

        assertEquals(ErrorCategory.RANGE, outcome.category());
        assertTrue(f.device.sent().isEmpty());
    }

    @Test
    void unexpandedReferenceFailsPreflight() {
        ExecFixture f = new ExecFixture();

        ExecutionOutcome outcome = new SequenceExecutor(f.runner).execute(List.of("sequence warmup"));

        assertEquals(RunStatus.FAILED, outcome.status());
        assertEquals(ErrorCategory.STRUCTURAL, outcome.category());
    }

    @Test
    void falseBranchIsSkipped() {
        ExecFixture f = new ExecFixture();
        f.flags.put("ready", true);

        ExecutionOutcome outcome = new SequenceExecutor(f.runner).execute(
                List.of("if flag:ready", "a", "else", "b", "endif", "c"));

        assertTrue(outcome.isSuccess());
        assertEquals(List.of("a", "c"), f.device.sent());
        CommandResult skipped = outcome.results().get(3);
        assertTrue(skipped.skipped());
        assertTrue(skipped.success());
    }

    @Test
    void stopIfNotHaltsWhenConditionFails() {
        ExecFixture f = new ExecFixture(FailurePolicy.CONTINUE_ON_NON_CRITICAL);

        ExecutionOutcome outcome = new SequenceExecutor(f.runner).execute(
                List.of("a", "stop_if_not flag:armed", "fire"));

        assertEquals(RunStatus.FAILED, outcome.status());
        assertEquals(ErrorCategory.CONDITION, outcome.category());
        assertEquals("stop_if_not flag:armed", outcome.offendingCommand());
        assertEquals(List.of("a"), f.device.sent());
    }

    @Test
    void stopIfNotInsideSuppressedBranchIsNotEvaluated() {
        ExecFixture f = new ExecFixture();

        ExecutionOutcome outcome = new SequenceExecutor(f.runner).execute(
                List.of("if flag:manual", "stop_if_not flag:armed", "endif", "fire"));

        assertTrue(outcome.isSuccess());
        assertEquals(List.of("fire"), f.device.sent());
    }

    @Test
    void failFastStopsAtDeviceError() {
        ExecFixture f = new ExecFixture(FailurePolicy.FAIL_FAST);
        f.device.script("a", Reply.error("a FAILED"));

        ExecutionOutcome outcome = new SequenceExecutor(f.runner).execute(List.of("a", "b"));

        assertEquals(RunStatus.FAILED, outcome.status());
        assertEquals(ErrorCategory.DEVICE, outcome.category());
        assertEquals("a FAILED", outcome.deviceResponse());
        assertEquals("a", outcome.offendingCommand());
        assertTrue(outcome.message().startsWith("Command 1 'a' failed"));
        assertEquals(List.of("a"), f.device.sent());
    }

    @Test
    void continuePolicyRecordsNonCriticalFailures() {
        ExecFixture f = new ExecFixture(FailurePolicy.CONTINUE_ON_NON_CRITICAL);
        f.device.script("a", Reply.silence());

        ExecutionOutcome outcome = new SequenceExecutor(f.runner).execute(List.of("a", "b"));

        assertEquals(RunStatus.FAILED, outcome.status());
        assertEquals(ErrorCategory.TIMEOUT, outcome.category());
        assertTrue(outcome.message().startsWith("1 of 2 commands failed"));
        assertEquals(List.of("a", "b"), f.device.sent());
    }

    @Test
    void transportFailureStopsEvenUnderContinuePolicy() {
        ExecFixture f = new ExecFixture(FailurePolicy.CONTINUE_ON_NON_CRITICAL);
        f.device.script("a", Reply.refuse());

        ExecutionOutcome outcome = new SequenceExecutor(f.runner).execute(List.of("a", "b"));

        assertEquals(ErrorCategory.TRANSPORT, outcome.category());
        assertEquals(1, outcome.results().size());
        assertTrue(f.device.sent().isEmpty());
    }

    @Test
    void cancelledTokenEndsCancelled() {
        ExecFixture f = new ExecFixture();
        CancellationToken token = new CancellationToken();
        token.cancel("operator stop");

        ExecutionOutcome outcome = new SequenceExecutor(f.runner)
                .execute(List.of("a", "b"), token, ProgressListener.NONE);

        assertEquals(RunStatus.CANCELLED, outcome.status());
        assertEquals(ErrorCategory.CANCELLED, outcome.category());
        assertEquals("operator stop", outcome.message());
        assertFalse(outcome.isSuccess());
        assertTrue(f.device.sent().isEmpty());
    }

    @Test
    void fanOutRunsOverSelectedZones() {
        ExecFixture f = new ExecFixture();
        f.zones.select(ZoneSet.of(1, 2));

        ExecutionOutcome outcome = new SequenceExecutor(f.runner).execute(List.of("og_multizone-pump on"));

        assertTrue(outcome.isSuccess());
        assertEquals(List.of("multizone 0001", "pump on", "multizone 0010", "pump on"), f.device.sent());
        assertEquals(ZoneStatus.COMPLETED, f.zones.state(2).status());
    }

    @Test
    void fanOutFailureFailsTheRun() {
        ExecFixture f = new ExecFixture(FailurePolicy.CONTINUE_ON_NON_CRITICAL);
        f.zones.select(ZoneSet.of(1, 2));
        f.device.script("multizone 0010", Reply.refuse());

        ExecutionOutcome outcome = new SequenceExecutor(f.runner)
                .execute(List.of("og_multizone-pump on", "after"));

        assertEquals(RunStatus.FAILED, outcome.status());
        assertEquals(ErrorCategory.TRANSPORT, outcome.category());
        assertEquals(ZoneStatus.COMPLETED, f.zones.state(1).status());
        assertEquals(ZoneStatus.ERROR, f.zones.state(2).status());
        assertFalse(f.device.sent().contains("after"));
    }

    @Test
    void listenerSeesEveryCommand() {
        ExecFixture f = new ExecFixture();
        List<Integer> seen = new ArrayList<>();

        new SequenceExecutor(f.runner).execute(List.of("a", "b", "c"), new CancellationToken(),
                (result, current, total) -> {
                    assertEquals(3, total);
                    seen.add(current);
                });

        assertEquals(List.of(1, 2, 3), seen);
    }
}
