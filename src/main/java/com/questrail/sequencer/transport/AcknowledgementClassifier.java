package com.questrail.sequencer.transport;

import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Maps a response line to an acknowledgement status.
 *
 * <p>Error keywords are checked first, so {@code "done with errors"} is an
 * error. Lines that match neither list are not acknowledgements.</p>
 */
public final class AcknowledgementClassifier {

    private final ResponseKeywords keywords;

    public AcknowledgementClassifier(ResponseKeywords keywords) {
        this.keywords = Objects.requireNonNull(keywords, "keywords");
    }

    public Optional<Acknowledgement> classify(String line) {
        if (line == null || line.isBlank()) {
            return Optional.empty();
        }
        String lower = line.toLowerCase(Locale.ROOT);
        for (String keyword : keywords.error()) {
            if (lower.contains(keyword)) {
                return Optional.of(Acknowledgement.error(line));
            }
        }
        for (String keyword : keywords.success()) {
            if (lower.contains(keyword)) {
                return Optional.of(Acknowledgement.success(line));
            }
        }
        return Optional.empty();
    }
}
