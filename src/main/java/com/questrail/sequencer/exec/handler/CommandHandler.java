package com.questrail.sequencer.exec.handler;

import com.questrail.sequencer.api.CommandKind;
import com.questrail.sequencer.exec.RunContext;
import com.questrail.sequencer.parse.Command;

import java.util.Optional;
import java.util.Set;

/**
 * Executes the commands of one or more {@link CommandKind}s.
 *
 * <p>Handlers are registered in a {@link CommandHandlerRegistry} and selected
 * by kind only.</p>
 */
public interface CommandHandler {

    /**
     * Kinds this handler is registered for.
     */
    Set<CommandKind> kinds();

    /**
     * Checks a classified command before the run starts.
     *
     * @return a problem description, or empty if the command can run
     */
    default Optional<String> validate(Command command) {
        return Optional.empty();
    }

    /**
     * Executes the command.
     *
     * @throws com.questrail.sequencer.error.SequenceException when the command fails
     */
    StepOutcome process(Command command, RunContext context);
}
