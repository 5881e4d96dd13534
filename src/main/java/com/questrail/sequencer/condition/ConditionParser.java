package com.questrail.sequencer.condition;

import com.questrail.sequencer.api.ErrorCategory;
import com.questrail.sequencer.parse.ParseBudget;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * ConditionParser
 * =============================================================================
 * Recursive-descent parser for condition expressions.
 *
 * <h2>Grammar</h2>
 * <pre>
 * or      := and ( '||' and )*
 * and     := unary ( '&amp;&amp;' unary )*
 * unary   := '!' unary | primary
 * primary := 'flag:' NAME [ ('==' | '!=') LITERAL ]
 *          | WORD+                       (unrecognized, true)
 * </pre>
 *
 * <p>A bare word directly under {@code !} names a flag, so {@code !ready}
 * reads the same as {@code !flag:ready}.</p>
 *
 * <h2>Cost</h2>
 * <p>Lexing is a single forward pass and parsing never backtracks. Every
 * character and token is charged to the caller's {@link ParseBudget}.</p>
 */
public final class ConditionParser {

    private static final String FLAG_PREFIX = "flag:";

    private final int maxOperands;

    public ConditionParser(int maxOperands) {
        if (maxOperands <= 0) {
            throw new IllegalArgumentException("maxOperands must be positive");
        }
        this.maxOperands = maxOperands;
    }

    /**
     * @throws ConditionSyntaxException for malformed expressions
     * @throws com.questrail.sequencer.parse.ParseBudgetExceededException when the budget runs out
     */
    public ConditionExpression parse(String text, ParseBudget budget) {
        Objects.requireNonNull(text, "text");
        Objects.requireNonNull(budget, "budget");

        List<Token> tokens = lex(text.strip(), budget);
        if (tokens.isEmpty()) {
            throw new ConditionSyntaxException(ErrorCategory.SYNTAX, "condition is empty");
        }
        long operands = tokens.stream().filter(t -> t.type == TokenType.WORD).count();
        if (operands > maxOperands) {
            throw new ConditionSyntaxException(ErrorCategory.RANGE,
                    "condition has " + operands + " operands; at most " + maxOperands + " allowed");
        }

        Cursor cursor = new Cursor(tokens, budget);
        ConditionExpression expr = parseOr(cursor);
        if (!cursor.atEnd()) {
            throw new ConditionSyntaxException(ErrorCategory.SYNTAX,
                    "unexpected '" + cursor.peek().text + "' in condition");
        }
        return expr;
    }

    private ConditionExpression parseOr(Cursor c) {
        ConditionExpression left = parseAnd(c);
        while (c.accept(TokenType.OR)) {
            left = new ConditionExpression.Or(left, parseAnd(c));
        }
        return left;
    }

    private ConditionExpression parseAnd(Cursor c) {
        ConditionExpression left = parseUnary(c, false);
        while (c.accept(TokenType.AND)) {
            left = new ConditionExpression.And(left, parseUnary(c, false));
        }
        return left;
    }

    private ConditionExpression parseUnary(Cursor c, boolean negated) {
        if (c.accept(TokenType.NOT)) {
            return new ConditionExpression.Not(parseUnary(c, true));
        }
        return parsePrimary(c, negated);
    }

    private ConditionExpression parsePrimary(Cursor c, boolean negated) {
        Token first = c.expectWord();

        if (first.text.regionMatches(true, 0, FLAG_PREFIX, 0, FLAG_PREFIX.length())) {
            String name = first.text.substring(FLAG_PREFIX.length());
            if (name.isEmpty()) {
                throw new ConditionSyntaxException(ErrorCategory.SYNTAX, "flag: requires a name");
            }
            return withComparison(c, name);
        }

        if (negated && !c.peekIs(TokenType.WORD)) {
            return withComparison(c, first.text);
        }

        // Consume the rest of an unrecognized phrase, comparisons included.
        StringBuilder phrase = new StringBuilder(first.text);
        while (c.peekIs(TokenType.WORD) || c.peekIs(TokenType.EQ) || c.peekIs(TokenType.NEQ)) {
            phrase.append(' ').append(c.next().text);
        }
        return new ConditionExpression.Unrecognized(phrase.toString());
    }

    private ConditionExpression withComparison(Cursor c, String flagName) {
        ConditionExpression.Comparison comparison = null;
        if (c.accept(TokenType.EQ)) {
            comparison = ConditionExpression.Comparison.EQUALS;
        }
        else if (c.accept(TokenType.NEQ)) {
            comparison = ConditionExpression.Comparison.NOT_EQUALS;
        }
        if (comparison == null) {
            return ConditionExpression.Flag.of(flagName);
        }
        if (!c.peekIs(TokenType.WORD)) {
            throw new ConditionSyntaxException(ErrorCategory.SYNTAX,
                    "expected a value after '" + comparison.symbol() + "'");
        }
        return new ConditionExpression.Flag(flagName, comparison, c.next().text);
    }

    // -------------------------------------------------------------------------
    // Lexer
    // -------------------------------------------------------------------------

    private enum TokenType { OR, AND, NOT, EQ, NEQ, WORD }

    private record Token(TokenType type, String text) {
    }

    private static List<Token> lex(String s, ParseBudget budget) {
        List<Token> tokens = new ArrayList<>();
        int i = 0;
        int n = s.length();
        while (i < n) {
            budget.step();
            char ch = s.charAt(i);
            if (Character.isWhitespace(ch)) {
                i++;
                continue;
            }
            TokenType op = operatorAt(s, i);
            if (op != null) {
                int len = op == TokenType.NOT ? 1 : 2;
                tokens.add(new Token(op, s.substring(i, i + len)));
                i += len;
                continue;
            }
            int start = i;
            while (i < n && !Character.isWhitespace(s.charAt(i)) && operatorAt(s, i) == null) {
                budget.step();
                i++;
            }
            tokens.add(new Token(TokenType.WORD, s.substring(start, i)));
        }
        return tokens;
    }

    private static TokenType operatorAt(String s, int i) {
        if (s.startsWith("||", i)) {
            return TokenType.OR;
        }
        if (s.startsWith("&&", i)) {
            return TokenType.AND;
        }
        if (s.startsWith("!=", i)) {
            return TokenType.NEQ;
        }
        if (s.startsWith("==", i)) {
            return TokenType.EQ;
        }
        if (s.charAt(i) == '!') {
            return TokenType.NOT;
        }
        return null;
    }

    private static final class Cursor {
        private final List<Token> tokens;
        private final ParseBudget budget;
        private int pos;

        private Cursor(List<Token> tokens, ParseBudget budget) {
            this.tokens = tokens;
            this.budget = budget;
        }

        boolean atEnd() {
            return pos >= tokens.size();
        }

        Token peek() {
            return tokens.get(pos);
        }

        boolean peekIs(TokenType type) {
            return !atEnd() && peek().type == type;
        }

        Token next() {
            budget.step();
            return tokens.get(pos++);
        }

        boolean accept(TokenType type) {
            if (peekIs(type)) {
                next();
                return true;
            }
            return false;
        }

        Token expectWord() {
            if (atEnd()) {
                String after = pos == 0 ? "start" : "'" + tokens.get(pos - 1).text + "'";
                throw new ConditionSyntaxException(ErrorCategory.SYNTAX, "expected an operand after " + after);
            }
            if (peek().type != TokenType.WORD) {
                throw new ConditionSyntaxException(ErrorCategory.SYNTAX,
                        "expected an operand but found '" + peek().text.toLowerCase(Locale.ROOT) + "'");
            }
            return next();
        }
    }
}
