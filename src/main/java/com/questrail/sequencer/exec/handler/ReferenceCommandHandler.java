package com.questrail.sequencer.exec.handler;

import com.questrail.sequencer.api.CommandKind;
import com.questrail.sequencer.error.StructuralException;
import com.questrail.sequencer.exec.RunContext;
import com.questrail.sequencer.parse.Command;

import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;

/**
 * Explicit {@code sequence} and {@code button} references are resolved by
 * expansion before a run. One that reaches the executor names something that
 * does not exist.
 */
final class ReferenceCommandHandler implements CommandHandler {

    @Override
    public Set<CommandKind> kinds() {
        return EnumSet.of(CommandKind.SEQUENCE_REF, CommandKind.BUTTON_REF);
    }

    @Override
    public Optional<String> validate(Command command) {
        return Optional.of(describe(command));
    }

    @Override
    public StepOutcome process(Command command, RunContext context) {
        throw new StructuralException(describe(command), command.text());
    }

    private static String describe(Command command) {
        return command.kind() == CommandKind.SEQUENCE_REF
                ? "unresolved sequence reference '" + command.string(Command.SEQUENCE_NAME) + "'"
                : "unresolved button reference '" + command.string(Command.BUTTON_PARAMS) + "'";
    }
}
