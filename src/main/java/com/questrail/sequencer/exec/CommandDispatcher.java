package com.questrail.sequencer.exec;

import com.questrail.sequencer.api.CommandResult;
import com.questrail.sequencer.api.ErrorCategory;
import com.questrail.sequencer.api.ValidationOutcome;
import com.questrail.sequencer.error.SequenceCancelledException;
import com.questrail.sequencer.error.SequenceException;
import com.questrail.sequencer.exec.handler.CommandHandler;
import com.questrail.sequencer.exec.handler.CommandHandlerRegistry;
import com.questrail.sequencer.exec.handler.StepOutcome;
import com.questrail.sequencer.parse.Command;
import com.questrail.sequencer.parse.CommandClassifier;
import com.questrail.sequencer.time.MonotonicClock;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * CommandDispatcher
 * =============================================================================
 * Per-command logic shared by the synchronous executor and the worker.
 *
 * <h2>Order of checks</h2>
 * <ol>
 *   <li>cancellation</li>
 *   <li>classification (invalid commands fail with their category)</li>
 *   <li>suppression: inside an inactive branch everything except
 *       {@code if/else/endif} is skipped, so a suppressed {@code stop_if_not}
 *       is never evaluated</li>
 *   <li>dispatch by kind through the {@link CommandHandlerRegistry}</li>
 * </ol>
 *
 * <p>Handler failures ({@link SequenceException}) become failed
 * {@link CommandResult}s. Cancellation is the exception: it propagates so the
 * run can end in CANCELLED.</p>
 */
public final class CommandDispatcher {

    private final CommandClassifier classifier;
    private final CommandHandlerRegistry registry;
    private final MonotonicClock clock;

    public CommandDispatcher(CommandClassifier classifier, CommandHandlerRegistry registry, MonotonicClock clock) {
        this.classifier = Objects.requireNonNull(classifier, "classifier");
        this.registry = Objects.requireNonNull(registry, "registry");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public CommandHandlerRegistry registry() {
        return registry;
    }

    /**
     * @param index 1-based position in the run
     * @throws SequenceCancelledException if the run is cancelled before or during the command
     */
    public CommandResult dispatch(int index, String raw, RunContext context) {
        long start = clock.nowNanos();
        context.token().throwIfCancelled();

        String text = raw == null ? "" : raw.strip();
        ValidationOutcome outcome = classifier.classify(raw);
        if (!outcome.valid()) {
            return failure(index, text, outcome.errorMessage(), outcome.category(), null, start);
        }
        Command command = new Command(raw, outcome.kind(), outcome.payload());

        if (context.conditionals().isSuppressed() && !command.kind().isConditionalKeyword()) {
            return new CommandResult(index, text, true, true, "skipped (inactive branch)",
                    elapsed(start), null, null);
        }

        Optional<CommandHandler> handler = registry.handlerFor(command.kind());
        if (handler.isEmpty()) {
            return failure(index, text, "no handler for " + command.kind(), ErrorCategory.STRUCTURAL, null, start);
        }

        try {
            StepOutcome step = handler.get().process(command, context);
            return new CommandResult(index, text, true, false, step.message(), elapsed(start),
                    null, step.deviceResponse());
        }
        catch (SequenceCancelledException e) {
            throw e;
        }
        catch (SequenceException e) {
            return failure(index, text, e.getMessage(), e.category(), e.deviceResponse(), start);
        }
    }

    private CommandResult failure(int index, String text, String message, ErrorCategory category,
                                  String deviceResponse, long start) {
        return new CommandResult(index, text, false, false, message, elapsed(start), category, deviceResponse);
    }

    private Duration elapsed(long startNanos) {
        return Duration.ofNanos(Math.max(0, clock.nowNanos() - startNanos));
    }
}
