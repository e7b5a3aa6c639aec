package com.mikov.accountvalidator.probe;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.List;
import java.util.Locale;

/**
 * Error codes inferred from probe failure messages.
 *
 * @author zahari.mikov
 */
@Getter
@RequiredArgsConstructor
public enum ProbeErrorCode {
    // Remote rejection codes, in lookup order
    FORBIDDEN("403", false),
    UNAUTHORIZED("401", false),
    NOT_FOUND("404", true),
    RATE_LIMITED("429", false),
    SERVER_ERROR("500", false),

    TIMEOUT("TIMEOUT", false),
    UNKNOWN("UNKNOWN", false),

    // Fault that escaped the whole pipeline
    FATAL("FATAL", true);

    private static final List<ProbeErrorCode> REJECTION_CODES =
            List.of(FORBIDDEN, UNAUTHORIZED, NOT_FOUND, RATE_LIMITED, SERVER_ERROR);
    private static final List<String> FATAL_KEYWORDS = List.of("404", "permanently", "deleted", "terminated");

    private final String code;
    private final boolean fatal;

    public static ProbeErrorCode fromMessage(final String message) {
        if (message == null) {
            return UNKNOWN;
        }
        for (final var errorCode : REJECTION_CODES) {
            if (message.contains(errorCode.code)) {
                return errorCode;
            }
        }

        final var lower = message.toLowerCase(Locale.ROOT);
        if (lower.contains("timeout")) {
            return TIMEOUT;
        }
        if (lower.contains("forbidden")) {
            return FORBIDDEN;
        }
        return UNKNOWN;
    }

    /**
     * Fatal failures point at permanent unreachability and are never retried.
     */
    public static boolean isFatal(final String message) {
        if (message == null) {
            return false;
        }
        final var lower = message.toLowerCase(Locale.ROOT);
        return FATAL_KEYWORDS.stream().anyMatch(lower::contains);
    }
}
