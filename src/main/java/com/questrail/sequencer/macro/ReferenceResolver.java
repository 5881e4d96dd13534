package com.questrail.sequencer.macro;

import com.questrail.sequencer.api.ValidationOutcome;
import com.questrail.sequencer.parse.Command;
import com.questrail.sequencer.parse.CommandClassifier;

import java.util.Map;
import java.util.Objects;

/**
 * ReferenceResolver
 * -----------------------------------------------------------------------------
 * Decides whether a sequence item refers to another sequence or to a button.
 *
 * <ul>
 *   <li>{@code sequence <name>} and {@code button <name>} are explicit
 *       references, whether or not the target exists.</li>
 *   <li>Language keywords ({@code wait}, {@code if}, {@code multizone}, ...)
 *       are never references.</li>
 *   <li>Any other item whose trimmed text equals a stored sequence name is a
 *       sequence reference; failing that, one equal to a button name is a
 *       button reference.</li>
 * </ul>
 */
public final class ReferenceResolver {

    private final CommandClassifier classifier;

    public ReferenceResolver(CommandClassifier classifier) {
        this.classifier = Objects.requireNonNull(classifier, "classifier");
    }

    public Reference resolve(String item, Map<String, ?> sequences, Map<String, String> buttons) {
        if (item == null) {
            return Reference.none();
        }
        ValidationOutcome outcome = classifier.classify(item);
        switch (outcome.kind()) {
            case SEQUENCE_REF:
                return outcome.valid()
                        ? Reference.sequence((String) outcome.payload().get(Command.SEQUENCE_NAME))
                        : Reference.none();
            case BUTTON_REF:
                return outcome.valid()
                        ? Reference.button((String) outcome.payload().get(Command.BUTTON_PARAMS))
                        : Reference.none();
            case REGULAR:
            case UNKNOWN:
                String bare = item.strip();
                if (sequences.containsKey(bare)) {
                    return Reference.sequence(bare);
                }
                if (buttons.containsKey(bare)) {
                    return Reference.button(bare);
                }
                return bare.isEmpty() ? Reference.none() : Reference.unresolved(bare);
            default:
                return Reference.none();
        }
    }
}
