package com.questrail.sequencer.exec.handler;

import com.questrail.sequencer.api.CommandKind;
import com.questrail.sequencer.condition.ConditionalContext;
import com.questrail.sequencer.exec.RunContext;
import com.questrail.sequencer.parse.Command;

import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;

/**
 * Drives the run's {@link ConditionalContext} for {@code if}, {@code else} and
 * {@code endif}. Nothing is sent to the device.
 */
final class ConditionalCommandHandler implements CommandHandler {

    @Override
    public Set<CommandKind> kinds() {
        return EnumSet.of(CommandKind.IF, CommandKind.ELSE, CommandKind.END_IF);
    }

    @Override
    public StepOutcome process(Command command, RunContext context) {
        ConditionalContext conditionals = context.conditionals();
        switch (command.kind()) {
            case IF: {
                boolean nested = conditionals.isSuppressed();
                String condition = command.string(Command.CONDITION);
                Optional<Boolean> value = conditionals.enterIf(
                        () -> context.evaluator().evaluate(command.expression()));
                value.ifPresent(v -> context.reportCondition(condition, v, nested));
                if (nested) {
                    return StepOutcome.of("nested in inactive branch");
                }
                return StepOutcome.of("condition is " + value.orElse(Boolean.FALSE));
            }
            case ELSE:
                conditionals.enterElse();
                return StepOutcome.of(conditionals.isSuppressed() ? "else branch inactive" : "else branch active");
            case END_IF:
                conditionals.exitIf();
                return StepOutcome.of("block closed");
            default:
                throw new IllegalArgumentException("not a conditional command: " + command.kind());
        }
    }
}
