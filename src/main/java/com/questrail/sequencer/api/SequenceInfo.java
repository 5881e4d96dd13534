package com.questrail.sequencer.api;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Descriptive summary of a stored sequence, computed from its expansion.
 *
 * @param name              sequence name
 * @param commandCount      number of commands as stored
 * @param expandedCount     number of commands after expansion
 * @param kindCounts        histogram of command kinds in the expansion
 * @param estimatedDuration wait time plus a fixed allowance per dispatched command
 * @param complexityScore   weighted command count
 * @param dependencies      names whose definition can change the expansion
 */
public record SequenceInfo(
        String name,
        int commandCount,
        int expandedCount,
        Map<CommandKind, Integer> kindCounts,
        Duration estimatedDuration,
        int complexityScore,
        Set<String> dependencies
) {
    public SequenceInfo {
        Objects.requireNonNull(name, "name");
        kindCounts = Map.copyOf(kindCounts);
        Objects.requireNonNull(estimatedDuration, "estimatedDuration");
        dependencies = Set.copyOf(dependencies);
    }
}
