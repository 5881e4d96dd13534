package com.questrail.sequencer.api;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Outcome of validating a whole sequence.
 */
public record ValidationReport(List<ValidationIssue> issues) {

    public ValidationReport {
        issues = List.copyOf(Objects.requireNonNull(issues, "issues"));
    }

    public static ValidationReport ok() {
        return new ValidationReport(List.of());
    }

    public boolean isOk() {
        return issues.isEmpty();
    }

    public List<String> messages() {
        return issues.stream().map(ValidationIssue::message).toList();
    }

    /**
     * Returns a report holding the issues of this report followed by those of {@code other}.
     */
    public ValidationReport merge(ValidationReport other) {
        if (other.isOk()) {
            return this;
        }
        List<ValidationIssue> merged = new ArrayList<>(issues);
        merged.addAll(other.issues);
        return new ValidationReport(merged);
    }
}
