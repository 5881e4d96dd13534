package com.questrail.sequencer.condition;

import java.util.Locale;
import java.util.Objects;

/**
 * ConditionExpression
 * -----------------------------------------------------------------------------
 * Parsed form of the boolean expression used by {@code if} and
 * {@code stop_if_not}.
 *
 * <p>Evaluation order is left to right with short-circuiting for
 * {@link And} and {@link Or}. Text that is not part of the grammar is kept as
 * {@link Unrecognized} and evaluates to {@code true}, so an unknown expression
 * never blocks a sequence.</p>
 */
public interface ConditionExpression {

    boolean evaluate(FlagSource flags);

    /**
     * Comparison operator of a flag test.
     */
    enum Comparison {
        EQUALS("=="),
        NOT_EQUALS("!=");

        private final String symbol;

        Comparison(String symbol) {
            this.symbol = symbol;
        }

        public String symbol() {
            return symbol;
        }
    }

    /**
     * {@code flag:name}, optionally compared against a literal.
     * The comparison is case-insensitive against {@code "true"}/{@code "false"}.
     */
    record Flag(String name, Comparison comparison, String literal) implements ConditionExpression {
        public Flag {
            Objects.requireNonNull(name, "name");
            if ((comparison == null) != (literal == null)) {
                throw new IllegalArgumentException("comparison and literal go together");
            }
        }

        public static Flag of(String name) {
            return new Flag(name, null, null);
        }

        @Override
        public boolean evaluate(FlagSource flags) {
            boolean value = flags.getFlag(name);
            if (comparison == null) {
                return value;
            }
            boolean equal = Boolean.toString(value).equals(literal.toLowerCase(Locale.ROOT));
            return comparison == Comparison.EQUALS ? equal : !equal;
        }
    }

    record Not(ConditionExpression operand) implements ConditionExpression {
        public Not {
            Objects.requireNonNull(operand, "operand");
        }

        @Override
        public boolean evaluate(FlagSource flags) {
            return !operand.evaluate(flags);
        }
    }

    record And(ConditionExpression left, ConditionExpression right) implements ConditionExpression {
        public And {
            Objects.requireNonNull(left, "left");
            Objects.requireNonNull(right, "right");
        }

        @Override
        public boolean evaluate(FlagSource flags) {
            return left.evaluate(flags) && right.evaluate(flags);
        }
    }

    record Or(ConditionExpression left, ConditionExpression right) implements ConditionExpression {
        public Or {
            Objects.requireNonNull(left, "left");
            Objects.requireNonNull(right, "right");
        }

        @Override
        public boolean evaluate(FlagSource flags) {
            return left.evaluate(flags) || right.evaluate(flags);
        }
    }

    /**
     * Text outside the grammar. Always true.
     */
    record Unrecognized(String text) implements ConditionExpression {
        public Unrecognized {
            Objects.requireNonNull(text, "text");
        }

        @Override
        public boolean evaluate(FlagSource flags) {
            return true;
        }
    }
}
