package com.questrail.sequencer.macro;

import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Result of expanding one sequence.
 *
 * @param commands     flat command list
 * @param dependencies every name whose definition can change the result:
 *                     sequence and button names consulted, referenced names
 *                     that were not defined, bare items that matched no name,
 *                     and the members of any cycle a reference was dropped for
 * @param truncated    whether a branch was cut at the depth limit
 */
public record Expansion(List<String> commands, Set<String> dependencies, boolean truncated) {
    public Expansion {
        commands = List.copyOf(Objects.requireNonNull(commands, "commands"));
        dependencies = Set.copyOf(Objects.requireNonNull(dependencies, "dependencies"));
    }

    public static Expansion empty(Set<String> dependencies) {
        return new Expansion(List.of(), dependencies, false);
    }
}
