package com.questrail.sequencer.condition;

import com.questrail.sequencer.error.StructuralException;
import org.junit.jupiter.api.Test;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class ConditionalContextTest {

    @Test
    void falseIfSuppressesUntilElse() {
        ConditionalContext ctx = new ConditionalContext(NestedConditionPolicy.SKIP);

        assertEquals(Optional.of(false), ctx.enterIf(() -> false));
        assertTrue(ctx.isSuppressed());

        ctx.enterElse();
        assertFalse(ctx.isSuppressed());

        ctx.exitIf();
        assertFalse(ctx.isSuppressed());
        assertTrue(ctx.isBalanced());
    }

    @Test
    void depthTracksUnmatchedIfs() {
        ConditionalContext ctx = new ConditionalContext(NestedConditionPolicy.SKIP);

        ctx.enterIf(() -> true);
        ctx.enterIf(() -> true);
        assertEquals(2, ctx.depth());

        ctx.exitIf();
        assertEquals(1, ctx.depth());
        assertFalse(ctx.isBalanced());
    }

    @Test
    void nestedIfUnderSuppressedBranchIsNotEvaluatedWhenSkipping() {
        ConditionalContext ctx = new ConditionalContext(NestedConditionPolicy.SKIP);
        AtomicInteger evaluations = new AtomicInteger();

        ctx.enterIf(() -> false);
        Optional<Boolean> nested = ctx.enterIf(() -> {
            evaluations.incrementAndGet();
            return true;
        });

        assertEquals(Optional.empty(), nested);
        assertEquals(0, evaluations.get());
        assertTrue(ctx.isSuppressed());
    }

    @Test
    void nestedIfUnderSuppressedBranchIsEvaluatedButIgnored() {
        ConditionalContext ctx = new ConditionalContext(NestedConditionPolicy.EVALUATE_AND_IGNORE);

        ctx.enterIf(() -> false);
        Optional<Boolean> nested = ctx.enterIf(() -> true);

        assertEquals(Optional.of(true), nested);
        assertTrue(ctx.isSuppressed(), "a true nested condition must not lift the outer suppression");
    }

    @Test
    void elseOfInertFrameStaysSuppressed() {
        ConditionalContext ctx = new ConditionalContext(NestedConditionPolicy.SKIP);

        ctx.enterIf(() -> false);
        ctx.enterIf(() -> true);
        ctx.enterElse();
        assertTrue(ctx.isSuppressed());

        ctx.exitIf();
        assertTrue(ctx.isSuppressed());
        ctx.enterElse();
        assertFalse(ctx.isSuppressed());
    }

    @Test
    void unbalancedKeywordsAreStructuralErrors() {
        ConditionalContext ctx = new ConditionalContext(NestedConditionPolicy.SKIP);

        assertThrows(StructuralException.class, ctx::enterElse);
        assertThrows(StructuralException.class, ctx::exitIf);
    }
}
