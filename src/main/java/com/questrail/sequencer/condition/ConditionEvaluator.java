package com.questrail.sequencer.condition;

import java.util.Objects;

/**
 * Evaluates parsed conditions against an explicit {@link FlagSource}.
 */
public final class ConditionEvaluator {

    private final FlagSource flags;

    public ConditionEvaluator(FlagSource flags) {
        this.flags = Objects.requireNonNull(flags, "flags");
    }

    public boolean evaluate(ConditionExpression expression) {
        return Objects.requireNonNull(expression, "expression").evaluate(flags);
    }
}
