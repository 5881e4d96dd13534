package com.questrail.sequencer.transport;

import java.util.Objects;

/**
 * Classified device response.
 *
 * @param status      classification
 * @param rawResponse line that decided the classification, {@code null} on timeout
 */
public record Acknowledgement(AckStatus status, String rawResponse) {
    public Acknowledgement {
        Objects.requireNonNull(status, "status");
        if (status != AckStatus.TIMEOUT) {
            Objects.requireNonNull(rawResponse, "rawResponse");
        }
    }

    public static Acknowledgement success(String line) {
        return new Acknowledgement(AckStatus.SUCCESS, line);
    }

    public static Acknowledgement error(String line) {
        return new Acknowledgement(AckStatus.ERROR_KEYWORD, line);
    }

    public static Acknowledgement timeout() {
        return new Acknowledgement(AckStatus.TIMEOUT, null);
    }
}
