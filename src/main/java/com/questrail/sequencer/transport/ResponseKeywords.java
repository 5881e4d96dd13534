package com.questrail.sequencer.transport;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Keyword lists that classify device response lines.
 *
 * <p>Keywords are stored lower-case and matched as case-insensitive
 * substrings.</p>
 */
public record ResponseKeywords(List<String> success, List<String> error) {

    public ResponseKeywords {
        success = normalize(Objects.requireNonNull(success, "success"));
        error = normalize(Objects.requireNonNull(error, "error"));
        if (success.isEmpty()) {
            throw new IllegalArgumentException("at least one success keyword is required");
        }
    }

    /**
     * success: complete, completed, done; error: err, error, fail.
     */
    public static ResponseKeywords defaults() {
        return new ResponseKeywords(List.of("complete", "completed", "done"), List.of("err", "error", "fail"));
    }

    private static List<String> normalize(List<String> keywords) {
        return keywords.stream()
                .map(k -> Objects.requireNonNull(k, "keyword").strip().toLowerCase(Locale.ROOT))
                .filter(k -> !k.isEmpty())
                .distinct()
                .toList();
    }
}
