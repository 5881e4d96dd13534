package com.questrail.sequencer.validate;

import com.questrail.sequencer.api.ErrorCategory;
import com.questrail.sequencer.api.ValidationIssue;
import com.questrail.sequencer.api.ValidationReport;
import com.questrail.sequencer.macro.ReferenceResolver;
import com.questrail.sequencer.parse.CommandClassifier;
import com.questrail.sequencer.parse.LanguageLimits;
import com.questrail.sequencer.time.SystemMonotonicClock;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SequenceValidatorTest {

    private final CommandClassifier classifier =
            new CommandClassifier(LanguageLimits.defaults(), SystemMonotonicClock.INSTANCE);
    private final SequenceValidator validator = new SequenceValidator(classifier, new ReferenceResolver(classifier));

    @Test
    void balancedBlocksAreValid() {
        ValidationReport report = validator.validateSequence(
                List.of("if flag:a", "x", "if flag:b", "y", "else", "z", "endif", "endif"));

        assertTrue(report.isOk(), report.messages().toString());
    }

    @Test
    void unmatchedEndifIsReportedWithIndex() {
        ValidationReport report = validator.validateSequence(List.of("x", "endif"));

        assertFalse(report.isOk());
        ValidationIssue issue = report.issues().get(0);
        assertEquals(2, issue.index());
        assertEquals(ErrorCategory.STRUCTURAL, issue.category());
        assertTrue(issue.message().startsWith("Command 2:"));
    }

    @Test
    void unclosedIfsAreReportedOutermostFirst() {
        ValidationReport report = validator.validateSequence(List.of("if flag:a", "if flag:b", "x"));

        assertEquals(2, report.issues().size());
        assertEquals(1, report.issues().get(0).index());
        assertEquals(2, report.issues().get(1).index());
    }

    @Test
    void elseWithoutIfIsStructural() {
        ValidationReport report = validator.validateSequence(List.of("else", "x"));

        assertEquals(ErrorCategory.STRUCTURAL, report.issues().get(0).category());
    }

    @Test
    void invalidCommandsKeepTheirCategory() {
        ValidationReport report = validator.validateSequence(List.of("wait -1", "wait", "x"));

        assertEquals(2, report.issues().size());
        assertEquals(1, report.issues().get(0).index());
        assertEquals(2, report.issues().get(1).index());
    }

    @Test
    void emptyAndOversizedSequencesAreRejected() {
        ValidationReport empty = validator.validateSequence(List.of());
        assertFalse(empty.isOk());
        assertEquals(1, empty.issues().size());
        assertEquals(ErrorCategory.STRUCTURAL, empty.issues().get(0).category());
        assertEquals(0, empty.issues().get(0).index());
        assertTrue(validator.validateSequence(List.of("x")).isOk());

        int max = LanguageLimits.defaults().maxSequenceLength();
        List<String> tooLong = new ArrayList<>(Collections.nCopies(max + 1, "x"));
        ValidationReport report = validator.validateSequence(tooLong);
        assertEquals(ErrorCategory.RANGE, report.issues().get(0).category());
    }

    @Test
    void unknownReferencesAreStructural() {
        ValidationReport report = validator.validateReferences(
                List.of("sequence ghost", "button phantom", "x"), Map.of(), Map.of());

        assertEquals(2, report.issues().size());
        assertTrue(report.messages().get(0).contains("unknown sequence 'ghost'"));
        assertTrue(report.messages().get(1).contains("unknown button 'phantom'"));
    }

    @Test
    void cyclicReferenceIsStructural() {
        Map<String, List<String>> seqs = Map.of(
                "a", List.of("b"),
                "b", List.of("a"));

        ValidationReport report = validator.validateReferences(List.of("x", "a"), seqs, Map.of());

        assertEquals(1, report.issues().size());
        assertEquals(2, report.issues().get(0).index());
        assertTrue(report.messages().get(0).contains("reference cycle"));
    }

    @Test
    void knownReferencesPass() {
        ValidationReport report = validator.validateReferences(
                List.of("prime", "button go"), Map.of("prime", List.of("p1")), Map.of("go", "start"));

        assertTrue(report.isOk());
    }
}
