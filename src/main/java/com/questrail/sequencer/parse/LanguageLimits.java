package com.questrail.sequencer.parse;

import java.time.Duration;
import java.util.Objects;

/**
 * LanguageLimits
 * -----------------------------------------------------------------------------
 * Size and cost ceilings applied to the sequence language.
 *
 * <h2>Parameters</h2>
 * <ul>
 *   <li><b>maxCommandLength</b>: commands longer than this (after trimming) are
 *       rejected before any scanning.</li>
 *   <li><b>maxArgumentGroups</b>: upper bound on argument tokens of a command
 *       and on operands of a condition.</li>
 *   <li><b>maxWaitSeconds</b>: ceiling for {@code wait}.</li>
 *   <li><b>parseTimeBudget</b>: wall time a single classification may take
 *       before it is aborted, measured on the monotonic clock.</li>
 *   <li><b>maxSequenceLength</b>: commands per validated sequence.</li>
 *   <li><b>maxExpansionDepth</b>: nesting depth of sequence references.</li>
 * </ul>
 */
public record LanguageLimits(
        int maxCommandLength,
        int maxArgumentGroups,
        double maxWaitSeconds,
        Duration parseTimeBudget,
        int maxSequenceLength,
        int maxExpansionDepth
) {
    public LanguageLimits {
        Objects.requireNonNull(parseTimeBudget, "parseTimeBudget");
        if (maxCommandLength <= 0) {
            throw new IllegalArgumentException("maxCommandLength must be positive");
        }
        if (maxArgumentGroups <= 0) {
            throw new IllegalArgumentException("maxArgumentGroups must be positive");
        }
        if (!(maxWaitSeconds > 0)) {
            throw new IllegalArgumentException("maxWaitSeconds must be positive");
        }
        if (parseTimeBudget.isNegative() || parseTimeBudget.isZero()) {
            throw new IllegalArgumentException("parseTimeBudget must be positive");
        }
        if (maxSequenceLength <= 0) {
            throw new IllegalArgumentException("maxSequenceLength must be positive");
        }
        if (maxExpansionDepth <= 0) {
            throw new IllegalArgumentException("maxExpansionDepth must be positive");
        }
    }

    /**
     * Default limits: 1000 characters, 10 argument groups, 3600 s waits,
     * 1 s parse budget, 10 000 commands per sequence, depth 20.
     */
    public static LanguageLimits defaults() {
        return new LanguageLimits(1000, 10, 3600.0, Duration.ofSeconds(1), 10_000, 20);
    }

    public LanguageLimits withMaxExpansionDepth(int depth) {
        return new LanguageLimits(maxCommandLength, maxArgumentGroups, maxWaitSeconds,
                parseTimeBudget, maxSequenceLength, depth);
    }

    public LanguageLimits withMaxSequenceLength(int length) {
        return new LanguageLimits(maxCommandLength, maxArgumentGroups, maxWaitSeconds,
                parseTimeBudget, length, maxExpansionDepth);
    }
}
