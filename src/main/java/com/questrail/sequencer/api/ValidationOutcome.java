package com.questrail.sequencer.api;

import java.util.Map;
import java.util.Objects;

/**
 * Result of classifying one command.
 *
 * @param valid        whether the command is well formed
 * @param errorMessage description of the problem, {@code null} when valid
 * @param kind         recognized (or best-guess) kind
 * @param payload      parsed arguments keyed by name; empty when invalid
 * @param category     failure category, {@code null} when valid
 */
public record ValidationOutcome(
        boolean valid,
        String errorMessage,
        CommandKind kind,
        Map<String, Object> payload,
        ErrorCategory category
) {
    public ValidationOutcome {
        Objects.requireNonNull(kind, "kind");
        payload = Map.copyOf(Objects.requireNonNull(payload, "payload"));
        if (!valid) {
            Objects.requireNonNull(errorMessage, "errorMessage");
            Objects.requireNonNull(category, "category");
        }
    }

    public static ValidationOutcome valid(CommandKind kind, Map<String, Object> payload) {
        return new ValidationOutcome(true, null, kind, payload, null);
    }

    public static ValidationOutcome invalid(CommandKind kind, String message, ErrorCategory category) {
        return new ValidationOutcome(false, message, kind, Map.of(), category);
    }
}
