package com.questrail.sequencer.condition;

import com.questrail.sequencer.api.ErrorCategory;
import com.questrail.sequencer.parse.ParseBudget;
import com.questrail.sequencer.time.SystemMonotonicClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ConditionParserTest {

    private final ConditionParser parser = new ConditionParser(10);

    private ConditionExpression parse(String text) {
        return parser.parse(text, ParseBudget.start(SystemMonotonicClock.INSTANCE, Duration.ofSeconds(1), text.length()));
    }

    private static FlagSource flags(Map<String, Boolean> values) {
        return name -> values.getOrDefault(name, false);
    }

    @Test
    void flagReadsTheSource() {
        ConditionExpression expr = parse("flag:ready");

        assertEquals(ConditionExpression.Flag.of("ready"), expr);
        assertTrue(expr.evaluate(flags(Map.of("ready", true))));
        assertFalse(expr.evaluate(FlagSource.none()));
    }

    @Test
    void bareWordUnderNotIsAFlag() {
        ConditionExpression expr = parse("!ready");

        assertEquals(new ConditionExpression.Not(ConditionExpression.Flag.of("ready")), expr);
        assertFalse(expr.evaluate(flags(Map.of("ready", true))));
    }

    @Test
    void andBindsTighterThanOr() {
        ConditionExpression expr = parse("flag:a || flag:b && flag:c");

        assertInstanceOf(ConditionExpression.Or.class, expr);
        assertTrue(expr.evaluate(flags(Map.of("a", true))));
        assertFalse(expr.evaluate(flags(Map.of("b", true))));
        assertTrue(expr.evaluate(flags(Map.of("b", true, "c", true))));
    }

    @Test
    void comparisonIsCaseInsensitiveAgainstFlagValue() {
        FlagSource source = flags(Map.of("door", true));

        assertTrue(parse("flag:door == TRUE").evaluate(source));
        assertFalse(parse("flag:door != true").evaluate(source));
        assertTrue(parse("flag:window == false").evaluate(source));
    }

    @Test
    void unrecognizedTextIsTrue() {
        ConditionExpression expr = parse("sensor reads high");

        assertEquals(new ConditionExpression.Unrecognized("sensor reads high"), expr);
        assertTrue(expr.evaluate(FlagSource.none()));
    }

    @Test
    void malformedExpressionsAreSyntaxErrors() {
        for (String text : new String[] { "&& flag:a", "flag:a &&", "flag:", "flag:a == ", "!" }) {
            ConditionSyntaxException e = assertThrows(ConditionSyntaxException.class, () -> parse(text), text);
            assertEquals(ErrorCategory.SYNTAX, e.category(), text);
        }
    }

    @Test
    void tooManyOperandsIsRangeError() {
        String text = "flag:a1 || flag:a2 || flag:a3 || flag:a4 || flag:a5 || flag:a6"
                + " || flag:a7 || flag:a8 || flag:a9 || flag:a10 || flag:a11";

        ConditionSyntaxException e = assertThrows(ConditionSyntaxException.class, () -> parse(text));
        assertEquals(ErrorCategory.RANGE, e.category());
    }

    @Test
    void shortCircuitStopsEvaluation() {
        int[] reads = new int[1];
        FlagSource counting = name -> {
            reads[0]++;
            return name.equals("a");
        };

        assertTrue(parse("flag:a || flag:b").evaluate(counting));
        assertEquals(1, reads[0]);

        reads[0] = 0;
        assertFalse(parse("flag:b && flag:a").evaluate(counting));
        assertEquals(1, reads[0]);
    }
}
