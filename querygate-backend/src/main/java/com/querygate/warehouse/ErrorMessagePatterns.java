package com.querygate.warehouse;

import java.util.List;
import java.util.Locale;

/**
 * Last-resort message sniffing, used only when an error carries no structured reason or code.
 */
final class ErrorMessagePatterns {

    private static final List<String> LOGIC_MARKERS = List.of(
            "syntax error",
            "unrecognized name",
            "no matching signature",
            "neither grouped nor aggregated",
            "is not grouped",
            "must appear in the group by",
            "column not found",
            "does not exist",
            "invalid identifier",
            "cannot be coerced",
            "type mismatch"
    );

    private static final List<String> TRANSIENT_MARKERS = List.of(
            "connection reset",
            "connection refused",
            "temporarily unavailable",
            "service unavailable",
            "try again"
    );

    private ErrorMessagePatterns() {
    }

    static boolean looksLikeLogicError(String message) {
        return containsAny(message, LOGIC_MARKERS);
    }

    static boolean looksTransient(String message) {
        return containsAny(message, TRANSIENT_MARKERS);
    }

    private static boolean containsAny(String message, List<String> markers) {
        if (message == null || message.isBlank()) {
            return false;
        }
        String lower = message.toLowerCase(Locale.ROOT);
        for (String marker : markers) {
            if (lower.contains(marker)) {
                return true;
            }
        }
        return false;
    }
}
