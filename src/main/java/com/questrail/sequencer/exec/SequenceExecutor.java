package com.questrail.sequencer.exec;

import com.questrail.sequencer.api.ExecutionOutcome;
import com.questrail.sequencer.api.RunStatus;
import com.questrail.sequencer.observability.RunTransitionEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * SequenceExecutor
 * =============================================================================
 * Runs a command list on the calling thread and returns the terminal outcome.
 *
 * <p>The synchronous path has no pause control. It is cancellable through the
 * token the caller passes in; without one, it runs with a fresh token nobody
 * else holds.</p>
 */
public final class SequenceExecutor {
    private static final Logger log = LoggerFactory.getLogger(SequenceExecutor.class);

    private final SequenceRunner runner;

    public SequenceExecutor(SequenceRunner runner) {
        this.runner = Objects.requireNonNull(runner, "runner");
    }

    public ExecutionOutcome execute(List<String> commands) {
        return execute(commands, new CancellationToken(), ProgressListener.NONE);
    }

    public ExecutionOutcome execute(List<String> commands, CancellationToken token, ProgressListener listener) {
        Objects.requireNonNull(commands, "commands");
        Objects.requireNonNull(token, "token");
        Objects.requireNonNull(listener, "listener");

        long runId = runner.nextRunId();
        log.debug("Run {} starting with {} commands", runId, commands.size());
        transition(runId, RunStatus.IDLE, RunStatus.RUNNING, "started");

        ExecutionOutcome outcome = runner.run(runId, commands, token, null, listener);

        transition(runId, RunStatus.RUNNING, outcome.status(), outcome.message());
        return outcome;
    }

    private void transition(long runId, RunStatus from, RunStatus to, String message) {
        runner.sink().onRunTransition(new RunTransitionEvent(runner.wallClock().now(), runId, from, to, message));
    }
}
