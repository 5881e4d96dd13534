package com.questrail.sequencer.api;

import java.util.List;
import java.util.Objects;

/**
 * Aggregate counters reported by {@link SequenceEngine#statistics()}.
 */
public record EngineStatistics(
        int sequenceCount,
        int buttonCount,
        long totalRuns,
        long successfulRuns,
        long failedRuns,
        long cancelledRuns,
        long commandsExecuted,
        long commandsSucceeded,
        long commandsFailed,
        List<CacheStatistics> caches
) {
    public EngineStatistics {
        caches = List.copyOf(Objects.requireNonNull(caches, "caches"));
    }
}
