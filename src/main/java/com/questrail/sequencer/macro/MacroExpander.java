package com.questrail.sequencer.macro;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * MacroExpander
 * =============================================================================
 * Flattens sequence-of-sequence and button references into a plain command
 * list.
 *
 * <h2>Rules</h2>
 * <ul>
 *   <li>An unknown sequence name expands to nothing.</li>
 *   <li>A sequence that lies on a reference cycle (directly or through other
 *       sequences) expands to nothing. Inside an acyclic sequence, a reference
 *       to a cyclic sequence is dropped. Cycle membership comes from a
 *       {@link DependencyGraph} reachability scan taken before recursing.</li>
 *   <li>A branch deeper than the configured limit expands to nothing and the
 *       expansion is flagged as truncated.</li>
 *   <li>Button references become the button's command; references to
 *       undefined names and all other items pass through unchanged.</li>
 * </ul>
 *
 * <h2>Complexity</h2>
 * <p>Each sequence is expanded at most once per call; repeated references
 * reuse the memoized result, so work is proportional to the output size.</p>
 *
 * <p>The expander is stateless and thread-safe. Callers pass consistent
 * snapshots of the tables.</p>
 */
public final class MacroExpander {
    private static final Logger log = LoggerFactory.getLogger(MacroExpander.class);

    private final ReferenceResolver resolver;
    private final int maxDepth;

    public MacroExpander(ReferenceResolver resolver, int maxDepth) {
        this.resolver = Objects.requireNonNull(resolver, "resolver");
        if (maxDepth <= 0) {
            throw new IllegalArgumentException("maxDepth must be positive");
        }
        this.maxDepth = maxDepth;
    }

    public Expansion expand(String name, Map<String, List<String>> sequences, Map<String, String> buttons) {
        Objects.requireNonNull(sequences, "sequences");
        Objects.requireNonNull(buttons, "buttons");
        if (name == null || !sequences.containsKey(name)) {
            return Expansion.empty(name == null ? Set.of() : Set.of(name));
        }

        DependencyGraph graph = DependencyGraph.build(sequences, buttons, resolver);
        if (graph.isOnCycle(name)) {
            log.warn("Sequence '{}' references itself; expansion is empty", name);
            Set<String> deps = new HashSet<>(graph.reachableFrom(name));
            deps.add(name);
            return Expansion.empty(deps);
        }

        Run run = new Run(sequences, buttons, graph);
        List<String> commands = run.expandSequence(name, 1);
        return new Expansion(commands, run.dependencies, run.truncatedAnywhere);
    }

    /**
     * Expands an unnamed command list, as submitted for direct execution.
     * Top-level references are one level deep.
     */
    public Expansion expandItems(List<String> items,
                                 Map<String, List<String>> sequences,
                                 Map<String, String> buttons) {
        Objects.requireNonNull(items, "items");
        Objects.requireNonNull(sequences, "sequences");
        Objects.requireNonNull(buttons, "buttons");

        Run run = new Run(sequences, buttons, DependencyGraph.build(sequences, buttons, resolver));
        List<String> out = new ArrayList<>();
        run.expandItems(items, "<commands>", 0, out);
        return new Expansion(List.copyOf(out), run.dependencies, run.truncatedAnywhere);
    }

    /**
     * State of one {@link #expand} or {@link #expandItems} call.
     */
    private final class Run {
        private final Map<String, List<String>> sequences;
        private final Map<String, String> buttons;
        private final DependencyGraph graph;

        private final Map<String, List<String>> memo = new HashMap<>();
        private final Set<String> path = new HashSet<>();
        private final Set<String> dependencies = new LinkedHashSet<>();
        private boolean truncated;
        private boolean truncatedAnywhere;

        private Run(Map<String, List<String>> sequences, Map<String, String> buttons, DependencyGraph graph) {
            this.sequences = sequences;
            this.buttons = buttons;
            this.graph = graph;
        }

        List<String> expandSequence(String name, int depth) {
            dependencies.add(name);
            if (depth > maxDepth) {
                log.warn("Expansion of '{}' exceeds depth {}; branch dropped", name, maxDepth);
                truncated = true;
                truncatedAnywhere = true;
                return List.of();
            }
            if (path.contains(name)) {
                return List.of();
            }
            List<String> memoized = memo.get(name);
            if (memoized != null) {
                return memoized;
            }

            boolean outerTruncated = truncated;
            truncated = false;
            path.add(name);

            List<String> out = new ArrayList<>();
            expandItems(sequences.get(name), name, depth, out);

            path.remove(name);
            List<String> result = List.copyOf(out);
            // Depth-limited results depend on where they were reached from.
            if (!truncated) {
                memo.put(name, result);
            }
            truncated = truncated || outerTruncated;
            return result;
        }

        void expandItems(List<String> items, String owner, int depth, List<String> out) {
            for (String item : items) {
                Reference ref = resolver.resolve(item, sequences, buttons);
                switch (ref.type()) {
                    case SEQUENCE -> {
                        dependencies.add(ref.name());
                        if (!sequences.containsKey(ref.name())) {
                            out.add(item);
                        }
                        else if (graph.isOnCycle(ref.name())) {
                            // Breaking the cycle anywhere revives this branch.
                            dependencies.addAll(graph.reachableFrom(ref.name()));
                            log.debug("Dropping cyclic reference '{}' inside '{}'", ref.name(), owner);
                        }
                        else {
                            out.addAll(expandSequence(ref.name(), depth + 1));
                        }
                    }
                    case BUTTON -> {
                        dependencies.add(ref.name());
                        String command = buttons.get(ref.name());
                        out.add(command != null ? command : item);
                    }
                    case UNRESOLVED -> {
                        dependencies.add(ref.name());
                        out.add(item);
                    }
                    default -> out.add(item);
                }
            }
        }
    }
}
