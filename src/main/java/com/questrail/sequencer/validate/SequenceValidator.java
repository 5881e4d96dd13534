package com.questrail.sequencer.validate;

import com.questrail.sequencer.api.ErrorCategory;
import com.questrail.sequencer.api.ValidationIssue;
import com.questrail.sequencer.api.ValidationOutcome;
import com.questrail.sequencer.api.ValidationReport;
import com.questrail.sequencer.macro.DependencyGraph;
import com.questrail.sequencer.macro.Reference;
import com.questrail.sequencer.macro.ReferenceResolver;
import com.questrail.sequencer.parse.CommandClassifier;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * SequenceValidator
 * =============================================================================
 * Whole-sequence checks that run before anything is executed.
 *
 * <h2>Structure ({@link #validateSequence})</h2>
 * <ul>
 *   <li>non-empty, at most {@code maxSequenceLength} commands</li>
 *   <li>every command classifies as valid</li>
 *   <li>every {@code endif} and {@code else} has an open {@code if}; every
 *       {@code if} is closed by the end of the list</li>
 * </ul>
 *
 * <h2>References ({@link #validateReferences})</h2>
 * <ul>
 *   <li>{@code sequence <name>} and {@code button <name>} name existing entries</li>
 *   <li>no referenced sequence lies on a reference cycle</li>
 * </ul>
 *
 * <p>Among non-empty lists of valid commands, the only structural failures
 * are an unmatched {@code if}, {@code else} or {@code endif}. An empty list is
 * rejected on its own as STRUCTURAL at index 0, since there is nothing to
 * run; the facade relies on this so that executing an empty sequence fails
 * preflight rather than completing vacuously.</p>
 *
 * <p>Issue messages start with {@code "Command N:"} using 1-based indices.
 * The validator has no side effects and is thread-safe.</p>
 */
public final class SequenceValidator {

    private final CommandClassifier classifier;
    private final ReferenceResolver resolver;

    public SequenceValidator(CommandClassifier classifier, ReferenceResolver resolver) {
        this.classifier = Objects.requireNonNull(classifier, "classifier");
        this.resolver = Objects.requireNonNull(resolver, "resolver");
    }

    public ValidationReport validateSequence(List<String> commands) {
        Objects.requireNonNull(commands, "commands");
        if (commands.isEmpty()) {
            return single(0, "sequence is empty", ErrorCategory.STRUCTURAL);
        }
        int max = classifier.limits().maxSequenceLength();
        if (commands.size() > max) {
            return single(0, "sequence has " + commands.size() + " commands; at most " + max + " allowed",
                    ErrorCategory.RANGE);
        }

        List<ValidationIssue> issues = new ArrayList<>();
        Deque<Integer> openIfs = new ArrayDeque<>();

        for (int i = 0; i < commands.size(); i++) {
            int index = i + 1;
            ValidationOutcome outcome = classifier.classify(commands.get(i));
            if (!outcome.valid()) {
                issues.add(issue(index, outcome.errorMessage(), outcome.category()));
                continue;
            }
            switch (outcome.kind()) {
                case IF -> openIfs.push(index);
                case ELSE -> {
                    if (openIfs.isEmpty()) {
                        issues.add(issue(index, "else without matching if", ErrorCategory.STRUCTURAL));
                    }
                }
                case END_IF -> {
                    if (openIfs.poll() == null) {
                        issues.add(issue(index, "endif without matching if", ErrorCategory.STRUCTURAL));
                    }
                }
                default -> { }
            }
        }

        // Report unclosed blocks outermost first.
        List<Integer> unclosed = new ArrayList<>(openIfs);
        for (int k = unclosed.size() - 1; k >= 0; k--) {
            int index = unclosed.get(k);
            issues.add(issue(index, "unclosed conditional starting at index " + index, ErrorCategory.STRUCTURAL));
        }
        return new ValidationReport(issues);
    }

    public ValidationReport validateReferences(List<String> commands,
                                               Map<String, List<String>> sequences,
                                               Map<String, String> buttons) {
        Objects.requireNonNull(commands, "commands");
        DependencyGraph graph = null;
        List<ValidationIssue> issues = new ArrayList<>();

        for (int i = 0; i < commands.size(); i++) {
            int index = i + 1;
            Reference ref = resolver.resolve(commands.get(i), sequences, buttons);
            if (ref.isSequence()) {
                if (!sequences.containsKey(ref.name())) {
                    issues.add(issue(index, "unknown sequence '" + ref.name() + "'", ErrorCategory.STRUCTURAL));
                    continue;
                }
                if (graph == null) {
                    graph = DependencyGraph.build(sequences, buttons, resolver);
                }
                if (graph.isOnCycle(ref.name())) {
                    issues.add(issue(index, "sequence '" + ref.name() + "' is part of a reference cycle",
                            ErrorCategory.STRUCTURAL));
                }
            }
            else if (ref.isButton() && !buttons.containsKey(ref.name())) {
                issues.add(issue(index, "unknown button '" + ref.name() + "'", ErrorCategory.STRUCTURAL));
            }
        }
        return new ValidationReport(issues);
    }

    private static ValidationIssue issue(int index, String message, ErrorCategory category) {
        return new ValidationIssue(index, "Command " + index + ": " + message, category);
    }

    private static ValidationReport single(int index, String message, ErrorCategory category) {
        return new ValidationReport(List.of(new ValidationIssue(index, message, category)));
    }
}
