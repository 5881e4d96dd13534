package com.questrail.sequencer.macro;

import com.questrail.sequencer.parse.CommandClassifier;
import com.questrail.sequencer.parse.LanguageLimits;
import com.questrail.sequencer.time.SystemMonotonicClock;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class MacroExpanderTest {

    private final ReferenceResolver resolver =
            new ReferenceResolver(new CommandClassifier(LanguageLimits.defaults(), SystemMonotonicClock.INSTANCE));
    private final MacroExpander expander = new MacroExpander(resolver, 20);

    @Test
    void nestedSequencesFlattenInOrder() {
        Map<String, List<String>> seqs = new LinkedHashMap<>();
        seqs.put("seq1", List.of("wait 1.0", "c1"));
        seqs.put("seq2", List.of("seq1", "wait 2.0", "c3"));
        seqs.put("seq3", List.of("seq2", "if f1", "c1", "endif", "c2"));

        Expansion exp = expander.expand("seq3", seqs, Map.of());

        assertEquals(List.of("wait 1.0", "c1", "wait 2.0", "c3", "if f1", "c1", "endif", "c2"),
                exp.commands());
        assertEquals(Set.of("seq1", "seq2", "seq3", "c1", "c2", "c3"), exp.dependencies());
        assertFalse(exp.truncated());
    }

    @Test
    void selfReferenceExpandsToNothing() {
        Map<String, List<String>> seqs = Map.of("loop", List.of("c1", "loop", "c2"));

        Expansion exp = expander.expand("loop", seqs, Map.of());

        assertTrue(exp.commands().isEmpty());
        assertTrue(exp.dependencies().contains("loop"));
    }

    @Test
    void indirectCycleExpandsToNothingFromEitherEnd() {
        Map<String, List<String>> seqs = Map.of(
                "a", List.of("x", "b"),
                "b", List.of("y", "sequence a"));

        assertTrue(expander.expand("a", seqs, Map.of()).commands().isEmpty());
        assertTrue(expander.expand("b", seqs, Map.of()).commands().isEmpty());
    }

    @Test
    void referenceToCyclicSequenceIsDroppedFromAcyclicParent() {
        Map<String, List<String>> seqs = Map.of(
                "loop", List.of("c9", "loop"),
                "outer", List.of("c1", "loop", "c2"));

        Expansion exp = expander.expand("outer", seqs, Map.of());

        assertEquals(List.of("c1", "c2"), exp.commands());
        assertTrue(exp.dependencies().contains("loop"));
    }

    @Test
    void droppedCyclicReferenceDependsOnWholeCycle() {
        Map<String, List<String>> seqs = Map.of(
                "a", List.of("a1", "b"),
                "b", List.of("b1", "a"),
                "c", List.of("c0", "a"));

        Expansion exp = expander.expand("c", seqs, Map.of());

        assertEquals(List.of("c0"), exp.commands());
        assertTrue(exp.dependencies().containsAll(Set.of("a", "b", "c")));
    }

    @Test
    void unmatchedBareItemIsRecordedAsDependency() {
        Map<String, List<String>> seqs = Map.of("p", List.of("x", "later", "wait 1"));

        Expansion exp = expander.expand("p", seqs, Map.of());

        assertEquals(List.of("x", "later", "wait 1"), exp.commands());
        assertTrue(exp.dependencies().containsAll(Set.of("x", "later")));
        assertFalse(exp.dependencies().contains("wait 1"));
    }

    @Test
    void unknownSequenceExpandsToNothing() {
        Expansion exp = expander.expand("missing", Map.of(), Map.of());

        assertTrue(exp.commands().isEmpty());
        assertEquals(Set.of("missing"), exp.dependencies());
    }

    @Test
    void repeatedReferenceIsExpandedEachTime() {
        Map<String, List<String>> seqs = Map.of(
                "blink", List.of("led on", "led off"),
                "twice", List.of("blink", "blink"));

        assertEquals(List.of("led on", "led off", "led on", "led off"),
                expander.expand("twice", seqs, Map.of()).commands());
    }

    @Test
    void branchBeyondDepthLimitIsDroppedAndFlagged() {
        MacroExpander shallow = new MacroExpander(resolver, 2);
        Map<String, List<String>> seqs = Map.of(
                "a", List.of("b", "x"),
                "b", List.of("c", "y"),
                "c", List.of("z"));

        Expansion exp = shallow.expand("a", seqs, Map.of());

        assertEquals(List.of("y", "x"), exp.commands());
        assertTrue(exp.truncated());
    }

    @Test
    void buttonsBecomeTheirCommand() {
        Map<String, List<String>> seqs = Map.of("s", List.of("start", "button stop", "c1"));
        Map<String, String> buttons = Map.of("start", "motor on", "stop", "motor off");

        Expansion exp = expander.expand("s", seqs, buttons);

        assertEquals(List.of("motor on", "motor off", "c1"), exp.commands());
        assertTrue(exp.dependencies().containsAll(Set.of("s", "start", "stop")));
    }

    @Test
    void sequenceNameWinsOverButtonOfSameName() {
        Map<String, List<String>> seqs = Map.of(
                "prime", List.of("p1", "p2"),
                "main", List.of("prime"));
        Map<String, String> buttons = Map.of("prime", "prime pump");

        assertEquals(List.of("p1", "p2"), expander.expand("main", seqs, buttons).commands());
    }

    @Test
    void explicitReferenceToUndefinedSequencePassesThrough() {
        Map<String, List<String>> seqs = Map.of("s", List.of("sequence ghost", "c1"));

        Expansion exp = expander.expand("s", seqs, Map.of());

        assertEquals(List.of("sequence ghost", "c1"), exp.commands());
        assertTrue(exp.dependencies().contains("ghost"));
    }

    @Test
    void expandItemsResolvesTopLevelReferences() {
        Map<String, List<String>> seqs = Map.of("warmup", List.of("heat on", "wait 1"));

        Expansion exp = expander.expandItems(List.of("warmup", "measure"), seqs, Map.of("measure", "read temp"));

        assertEquals(List.of("heat on", "wait 1", "read temp"), exp.commands());
        assertEquals(Set.of("warmup", "measure", "heat on"), exp.dependencies());
    }

    @Test
    void keywordsAreNeverReferences() {
        Map<String, List<String>> seqs = Map.of("wait", List.of("c1"));

        Expansion exp = expander.expandItems(List.of("wait 1"), seqs, Map.of());

        assertEquals(List.of("wait 1"), exp.commands());
    }
}
