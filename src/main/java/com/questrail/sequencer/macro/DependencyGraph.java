package com.questrail.sequencer.macro;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * DependencyGraph
 * =============================================================================
 * Directed graph of sequence-to-sequence references, built from one snapshot
 * of the sequence table.
 *
 * <p>Edges point from a sequence to every sequence name its items reference,
 * including names that are not defined. Cycle membership is answered by an
 * iterative reachability scan, so deep chains cannot overflow the stack.
 * Answers are memoized for the lifetime of the graph.</p>
 */
public final class DependencyGraph {

    private final Map<String, Set<String>> edges;
    private final Map<String, Boolean> cycleMemo = new HashMap<>();

    private DependencyGraph(Map<String, Set<String>> edges) {
        this.edges = edges;
    }

    public static DependencyGraph build(Map<String, List<String>> sequences,
                                        Map<String, String> buttons,
                                        ReferenceResolver resolver) {
        Objects.requireNonNull(sequences, "sequences");
        Objects.requireNonNull(buttons, "buttons");
        Objects.requireNonNull(resolver, "resolver");

        Map<String, Set<String>> edges = new HashMap<>();
        sequences.forEach((name, items) -> {
            Set<String> targets = new LinkedHashSet<>();
            for (String item : items) {
                Reference ref = resolver.resolve(item, sequences, buttons);
                if (ref.isSequence()) {
                    targets.add(ref.name());
                }
            }
            edges.put(name, targets);
        });
        return new DependencyGraph(edges);
    }

    public Set<String> referencesOf(String name) {
        return Collections.unmodifiableSet(edges.getOrDefault(name, Set.of()));
    }

    /**
     * Every sequence name reachable from {@code name} through one or more
     * references. Contains {@code name} itself only when it lies on a cycle.
     */
    public Set<String> reachableFrom(String name) {
        Set<String> seen = new LinkedHashSet<>();
        Deque<String> work = new ArrayDeque<>(referencesOf(name));
        while (!work.isEmpty()) {
            String next = work.pop();
            if (seen.add(next)) {
                work.addAll(referencesOf(next));
            }
        }
        return seen;
    }

    public boolean isOnCycle(String name) {
        return cycleMemo.computeIfAbsent(name, n -> reachableFrom(n).contains(n));
    }

    /**
     * Names of all sequences that take part in at least one cycle.
     */
    public Set<String> cyclicSequences() {
        Set<String> cyclic = new HashSet<>();
        for (String name : edges.keySet()) {
            if (isOnCycle(name)) {
                cyclic.add(name);
            }
        }
        return cyclic;
    }
}
