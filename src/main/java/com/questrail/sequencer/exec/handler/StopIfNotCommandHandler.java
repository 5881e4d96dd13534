package com.questrail.sequencer.exec.handler;

import com.questrail.sequencer.api.CommandKind;
import com.questrail.sequencer.error.ConditionHaltException;
import com.questrail.sequencer.exec.RunContext;
import com.questrail.sequencer.parse.Command;

import java.util.EnumSet;
import java.util.Set;

/**
 * Gate evaluated before the commands that follow it: a false condition stops
 * the run.
 */
final class StopIfNotCommandHandler implements CommandHandler {

    @Override
    public Set<CommandKind> kinds() {
        return EnumSet.of(CommandKind.STOP_IF_NOT);
    }

    @Override
    public StepOutcome process(Command command, RunContext context) {
        String condition = command.string(Command.CONDITION);
        boolean value = context.evaluator().evaluate(command.expression());
        context.reportCondition(condition, value, false);
        if (!value) {
            throw new ConditionHaltException(command.text(), condition);
        }
        return StepOutcome.of("condition holds");
    }
}
