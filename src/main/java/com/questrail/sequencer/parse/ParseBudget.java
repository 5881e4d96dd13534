package com.questrail.sequencer.parse;

import com.questrail.sequencer.time.MonotonicClock;

import java.time.Duration;
import java.util.Objects;

/**
 * ParseBudget
 * -----------------------------------------------------------------------------
 * Single-threaded cost guard for one classification.
 *
 * <p>The scanner charges one step per character or token it consumes. The
 * budget fails when the step count exceeds a ceiling proportional to the input
 * length, or when the monotonic clock passes the deadline. The clock is read
 * every {@value #CLOCK_CHECK_INTERVAL} steps.</p>
 *
 * <p>Not thread-safe; a budget belongs to exactly one parse.</p>
 */
public final class ParseBudget {

    static final int CLOCK_CHECK_INTERVAL = 32;
    private static final long STEPS_PER_CHAR = 16;
    private static final long BASE_STEPS = 256;

    private final MonotonicClock clock;
    private final long maxSteps;
    private final long deadlineNanos;
    private long steps;

    private ParseBudget(MonotonicClock clock, long maxSteps, long deadlineNanos) {
        this.clock = clock;
        this.maxSteps = maxSteps;
        this.deadlineNanos = deadlineNanos;
    }

    public static ParseBudget start(MonotonicClock clock, Duration timeBudget, int inputLength) {
        Objects.requireNonNull(clock, "clock");
        Objects.requireNonNull(timeBudget, "timeBudget");
        long maxSteps = BASE_STEPS + STEPS_PER_CHAR * Math.max(0, inputLength);
        return new ParseBudget(clock, maxSteps, clock.nowNanos() + timeBudget.toNanos());
    }

    /**
     * @throws ParseBudgetExceededException when either limit is exhausted
     */
    public void step() {
        steps++;
        if (steps > maxSteps) {
            throw new ParseBudgetExceededException("parse exceeded its step budget of " + maxSteps);
        }
        if (steps % CLOCK_CHECK_INTERVAL == 0 && clock.nowNanos() - deadlineNanos > 0) {
            throw new ParseBudgetExceededException("parse exceeded its time budget");
        }
    }

    public long steps() {
        return steps;
    }
}
