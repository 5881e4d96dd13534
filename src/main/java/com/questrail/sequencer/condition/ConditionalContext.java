package com.questrail.sequencer.condition;

import com.questrail.sequencer.error.StructuralException;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;
import java.util.Optional;
import java.util.function.BooleanSupplier;

/**
 * ConditionalContext
 * =============================================================================
 * Run-time state machine for nested {@code if / else / endif} blocks.
 *
 * <h2>Model</h2>
 * <p>Each open {@code if} pushes a frame holding its branch value and whether
 * the enclosing context was already suppressed. A frame is suppressed when its
 * parent was, or when its own value is false. The context is suppressed when
 * the top frame is; an empty stack is never suppressed.</p>
 *
 * <ul>
 *   <li>{@code if} pushes a frame. Under a suppressed parent the frame is inert
 *       and the condition is handled per {@link NestedConditionPolicy}.</li>
 *   <li>{@code else} flips the innermost value. An inert frame stays
 *       suppressed.</li>
 *   <li>{@code endif} pops one frame.</li>
 * </ul>
 *
 * <p>Stack depth always equals the number of unmatched {@code if}s seen so far.
 * Not thread-safe: one context belongs to one run.</p>
 */
public final class ConditionalContext {

    private final NestedConditionPolicy nestedPolicy;
    private final Deque<Frame> frames = new ArrayDeque<>();

    public ConditionalContext(NestedConditionPolicy nestedPolicy) {
        this.nestedPolicy = Objects.requireNonNull(nestedPolicy, "nestedPolicy");
    }

    private record Frame(boolean value, boolean parentSuppressed) {
        boolean suppressed() {
            return parentSuppressed || !value;
        }

        Frame flipped() {
            return new Frame(!value, parentSuppressed);
        }
    }

    public boolean isSuppressed() {
        Frame top = frames.peek();
        return top != null && top.suppressed();
    }

    /**
     * Opens a block.
     *
     * @param condition evaluated unless the block is nested in a suppressed
     *                  branch and the policy is {@link NestedConditionPolicy#SKIP}
     * @return the evaluated value, or empty when the condition was not evaluated
     */
    public Optional<Boolean> enterIf(BooleanSupplier condition) {
        Objects.requireNonNull(condition, "condition");
        boolean parentSuppressed = isSuppressed();
        if (!parentSuppressed) {
            boolean value = condition.getAsBoolean();
            frames.push(new Frame(value, false));
            return Optional.of(value);
        }
        if (nestedPolicy == NestedConditionPolicy.EVALUATE_AND_IGNORE) {
            boolean ignored = condition.getAsBoolean();
            frames.push(new Frame(false, true));
            return Optional.of(ignored);
        }
        frames.push(new Frame(false, true));
        return Optional.empty();
    }

    /**
     * @throws StructuralException when no block is open
     */
    public void enterElse() {
        Frame top = frames.poll();
        if (top == null) {
            throw new StructuralException("else without if");
        }
        frames.push(top.flipped());
    }

    /**
     * @throws StructuralException when no block is open
     */
    public void exitIf() {
        if (frames.poll() == null) {
            throw new StructuralException("endif without if");
        }
    }

    public int depth() {
        return frames.size();
    }

    public boolean isBalanced() {
        return frames.isEmpty();
    }
}
