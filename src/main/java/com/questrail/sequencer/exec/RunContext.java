package com.questrail.sequencer.exec;

import com.questrail.sequencer.condition.ConditionEvaluator;
import com.questrail.sequencer.condition.ConditionalContext;
import com.questrail.sequencer.observability.ConditionEvaluatedEvent;
import com.questrail.sequencer.observability.SequenceObservabilitySink;
import com.questrail.sequencer.time.WallClock;

import java.util.Objects;

/**
 * Per-run state handed to every {@link com.questrail.sequencer.exec.handler.CommandHandler}.
 *
 * <p>One context belongs to one run and is only touched by the thread
 * executing that run.</p>
 */
public final class RunContext {

    private final long runId;
    private final CancellationToken token;
    private final ConditionalContext conditionals;
    private final ConditionEvaluator evaluator;
    private final SequenceObservabilitySink sink;
    private final WallClock wallClock;

    public RunContext(long runId,
                      CancellationToken token,
                      ConditionalContext conditionals,
                      ConditionEvaluator evaluator,
                      SequenceObservabilitySink sink,
                      WallClock wallClock) {
        this.runId = runId;
        this.token = Objects.requireNonNull(token, "token");
        this.conditionals = Objects.requireNonNull(conditionals, "conditionals");
        this.evaluator = Objects.requireNonNull(evaluator, "evaluator");
        this.sink = Objects.requireNonNull(sink, "sink");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
    }

    public long runId() {
        return runId;
    }

    public CancellationToken token() {
        return token;
    }

    public ConditionalContext conditionals() {
        return conditionals;
    }

    public ConditionEvaluator evaluator() {
        return evaluator;
    }

    public SequenceObservabilitySink sink() {
        return sink;
    }

    public WallClock wallClock() {
        return wallClock;
    }

    public void reportCondition(String condition, boolean value, boolean ignored) {
        sink.onConditionEvaluated(new ConditionEvaluatedEvent(wallClock.now(), condition, value, ignored));
    }
}
