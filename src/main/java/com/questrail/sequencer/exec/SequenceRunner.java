package com.questrail.sequencer.exec;

import com.questrail.sequencer.api.CommandResult;
import com.questrail.sequencer.api.ErrorCategory;
import com.questrail.sequencer.api.ExecutionOutcome;
import com.questrail.sequencer.api.ValidationIssue;
import com.questrail.sequencer.api.ValidationOutcome;
import com.questrail.sequencer.api.ValidationReport;
import com.questrail.sequencer.condition.ConditionEvaluator;
import com.questrail.sequencer.condition.ConditionalContext;
import com.questrail.sequencer.condition.FlagSource;
import com.questrail.sequencer.condition.NestedConditionPolicy;
import com.questrail.sequencer.error.SequenceCancelledException;
import com.questrail.sequencer.exec.handler.CommandHandler;
import com.questrail.sequencer.observability.CommandExecutedEvent;
import com.questrail.sequencer.observability.SequenceErrorEvent;
import com.questrail.sequencer.observability.SequenceObservabilitySink;
import com.questrail.sequencer.parse.Command;
import com.questrail.sequencer.parse.CommandClassifier;
import com.questrail.sequencer.time.WallClock;
import com.questrail.sequencer.validate.SequenceValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * SequenceRunner
 * =============================================================================
 * The run loop shared by {@link SequenceExecutor} and {@link SequenceWorker}.
 *
 * <h2>Preflight</h2>
 * <p>Before the first command, the list is validated structurally and every
 * command is offered to its handler's {@code validate}. Any issue ends the
 * run as FAILED before anything reaches the device.</p>
 *
 * <h2>Loop</h2>
 * <p>Commands run strictly in order. Before each command the pause gate (if
 * any) is honoured and the cancellation token checked. Failures follow the
 * {@link FailurePolicy}; critical failures always stop the run.</p>
 *
 * <h2>Terminal outcome</h2>
 * <ul>
 *   <li>COMPLETED: every command succeeded and no block was left open</li>
 *   <li>FAILED: a failure stopped the run, failures were recorded under
 *       {@link FailurePolicy#CONTINUE_ON_NON_CRITICAL}, or the run timeout
 *       expired (category TIMEOUT)</li>
 *   <li>CANCELLED: cancellation was requested</li>
 * </ul>
 */
public final class SequenceRunner {
    private static final Logger log = LoggerFactory.getLogger(SequenceRunner.class);

    private final CommandClassifier classifier;
    private final SequenceValidator validator;
    private final CommandDispatcher dispatcher;
    private final FlagSource flags;
    private final NestedConditionPolicy nestedPolicy;
    private final FailurePolicy failurePolicy;
    private final ExecutionTimingPolicy timing;
    private final SequenceObservabilitySink sink;
    private final WallClock wallClock;
    private final AtomicLong runIds = new AtomicLong();

    public SequenceRunner(CommandClassifier classifier,
                          SequenceValidator validator,
                          CommandDispatcher dispatcher,
                          FlagSource flags,
                          NestedConditionPolicy nestedPolicy,
                          FailurePolicy failurePolicy,
                          ExecutionTimingPolicy timing,
                          SequenceObservabilitySink sink,
                          WallClock wallClock) {
        this.classifier = Objects.requireNonNull(classifier, "classifier");
        this.validator = Objects.requireNonNull(validator, "validator");
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");
        this.flags = Objects.requireNonNull(flags, "flags");
        this.nestedPolicy = Objects.requireNonNull(nestedPolicy, "nestedPolicy");
        this.failurePolicy = Objects.requireNonNull(failurePolicy, "failurePolicy");
        this.timing = Objects.requireNonNull(timing, "timing");
        this.sink = Objects.requireNonNull(sink, "sink");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
    }

    public long nextRunId() {
        return runIds.incrementAndGet();
    }

    public ExecutionTimingPolicy timing() {
        return timing;
    }

    public SequenceObservabilitySink sink() {
        return sink;
    }

    public WallClock wallClock() {
        return wallClock;
    }

    /**
     * Structural validation plus per-handler validation.
     */
    public ValidationReport preflight(List<String> commands) {
        ValidationReport report = validator.validateSequence(commands);
        if (!report.isOk()) {
            return report;
        }
        List<ValidationIssue> issues = new ArrayList<>();
        for (int i = 0; i < commands.size(); i++) {
            int index = i + 1;
            ValidationOutcome outcome = classifier.classify(commands.get(i));
            Command command = new Command(commands.get(i), outcome.kind(), outcome.payload());
            Optional<CommandHandler> handler = dispatcher.registry().handlerFor(outcome.kind());
            if (handler.isEmpty()) {
                issues.add(new ValidationIssue(index, "Command " + index + ": no handler for " + outcome.kind(),
                        ErrorCategory.STRUCTURAL));
                continue;
            }
            handler.get().validate(command).ifPresent(problem -> issues.add(
                    new ValidationIssue(index, "Command " + index + ": " + problem, ErrorCategory.STRUCTURAL)));
        }
        return new ValidationReport(issues);
    }

    public ExecutionOutcome run(long runId,
                                List<String> commands,
                                CancellationToken token,
                                PauseGate gate,
                                ProgressListener listener) {
        Objects.requireNonNull(commands, "commands");
        Objects.requireNonNull(token, "token");
        Objects.requireNonNull(listener, "listener");

        ValidationReport report = preflight(commands);
        if (!report.isOk()) {
            ValidationIssue first = report.issues().get(0);
            String message = "validation failed: " + String.join("; ", report.messages());
            sink.onError(new SequenceErrorEvent(wallClock.now(), first.category(), message, null));
            String offending = first.index() > 0 ? commands.get(first.index() - 1).strip() : null;
            return ExecutionOutcome.failed(message, offending, null, first.category(), List.of());
        }

        RunContext context = new RunContext(runId, token, new ConditionalContext(nestedPolicy),
                new ConditionEvaluator(flags), sink, wallClock);
        List<CommandResult> results = new ArrayList<>();
        CommandResult firstFailure = null;
        int failures = 0;
        int total = commands.size();

        try {
            for (int i = 0; i < total; i++) {
                if (gate != null) {
                    gate.awaitOpen(token, timing.slice());
                }
                CommandResult result = dispatcher.dispatch(i + 1, commands.get(i), context);
                results.add(result);
                sink.onCommandExecuted(new CommandExecutedEvent(wallClock.now(), runId, result, i + 1, total));
                listener.onCommand(result, i + 1, total);

                if (!result.success()) {
                    failures++;
                    if (firstFailure == null) {
                        firstFailure = result;
                    }
                    if (failurePolicy == FailurePolicy.FAIL_FAST || result.critical()) {
                        return failed(describe(result), result, results);
                    }
                }
            }
        }
        catch (SequenceCancelledException e) {
            String at = results.size() < total ? commands.get(results.size()).strip() : null;
            if (token.cause() == ErrorCategory.TIMEOUT) {
                String message = token.reason();
                sink.onError(new SequenceErrorEvent(wallClock.now(), ErrorCategory.TIMEOUT, message, null));
                return ExecutionOutcome.failed(message, at, null, ErrorCategory.TIMEOUT, results);
            }
            log.info("Run {} cancelled at command {} of {}", runId, results.size() + 1, total);
            return ExecutionOutcome.cancelled(token.reason(), at, results);
        }

        if (!context.conditionals().isBalanced()) {
            String message = "unclosed conditional block at end of sequence";
            sink.onError(new SequenceErrorEvent(wallClock.now(), ErrorCategory.STRUCTURAL, message, null));
            return ExecutionOutcome.failed(message, null, null, ErrorCategory.STRUCTURAL, results);
        }
        if (firstFailure != null) {
            return failed(failures + " of " + total + " commands failed; first: " + describe(firstFailure),
                    firstFailure, results);
        }
        return ExecutionOutcome.completed("completed " + total + " commands", results);
    }

    private ExecutionOutcome failed(String message, CommandResult cause, List<CommandResult> results) {
        sink.onError(new SequenceErrorEvent(wallClock.now(), cause.category(), message, null));
        return ExecutionOutcome.failed(message, cause.command(), cause.deviceResponse(), cause.category(), results);
    }

    private static String describe(CommandResult result) {
        return "Command " + result.index() + " '" + result.command() + "' failed: " + result.message();
    }
}
