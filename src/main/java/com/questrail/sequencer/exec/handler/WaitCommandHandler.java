package com.questrail.sequencer.exec.handler;

import com.questrail.sequencer.api.CommandKind;
import com.questrail.sequencer.error.SequenceCancelledException;
import com.questrail.sequencer.exec.RunContext;
import com.questrail.sequencer.parse.Command;
import com.questrail.sequencer.time.MonotonicClock;

import java.time.Duration;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * Sleeps for the requested time in slices, waking at once on cancellation.
 */
final class WaitCommandHandler implements CommandHandler {

    private final MonotonicClock clock;
    private final Duration slice;

    WaitCommandHandler(MonotonicClock clock, Duration slice) {
        this.clock = Objects.requireNonNull(clock, "clock");
        this.slice = Objects.requireNonNull(slice, "slice");
    }

    @Override
    public Set<CommandKind> kinds() {
        return EnumSet.of(CommandKind.WAIT);
    }

    @Override
    public StepOutcome process(Command command, RunContext context) {
        double seconds = command.waitSeconds();
        long deadline = clock.nowNanos() + (long) (seconds * 1_000_000_000L);
        long sliceNanos = slice.toNanos();

        long remaining;
        while ((remaining = deadline - clock.nowNanos()) > 0) {
            if (context.token().awaitCancellation(Duration.ofNanos(Math.min(remaining, sliceNanos)))) {
                throw new SequenceCancelledException(context.token().reason(), command.text());
            }
        }
        return StepOutcome.of("waited " + seconds + " s");
    }
}
