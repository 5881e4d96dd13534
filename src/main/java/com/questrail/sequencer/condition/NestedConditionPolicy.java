package com.questrail.sequencer.condition;

/**
 * What happens to the expression of an {@code if} that is reached inside an
 * already suppressed branch. Suppression is unaffected either way.
 */
public enum NestedConditionPolicy {
    /** Do not evaluate the nested expression. */
    SKIP,
    /** Evaluate it (flag reads, observability) and discard the result. */
    EVALUATE_AND_IGNORE
}
