package com.acme.render.core;

import jakarta.inject.Singleton;
import java.util.List;
import java.util.Locale;

/**
 * Maps a failure to a category by keyword. Rules are checked in declaration order and the
 * first hit wins, so a message mentioning both "429" and "503" is a rate limit.
 */
@Singleton
public class ErrorClassifier {

    private record Rule(ErrorCategory category, boolean retryable, String action, List<String> keywords) {
        boolean matches(String message) {
            return keywords.stream().anyMatch(message::contains);
        }
    }

    private static final List<Rule> RULES = List.of(
        new Rule(ErrorCategory.RATE_LIMIT, true,
            "Retry with exponential backoff. Consider implementing request throttling.",
            List.of("429", "rate limit", "rate_limit", "rate-limit", "too many requests",
                "resource_exhausted", "resource exhausted")),
        new Rule(ErrorCategory.TIMEOUT, true,
            "Retry with increased timeout. Check network connectivity.",
            List.of("timeout", "timed out", "etimedout")),
        new Rule(ErrorCategory.NETWORK, true,
            "Retry after brief delay. Check network stability.",
            List.of("econnreset", "connection reset", "connection refused", "network", "enotfound",
                "unknownhost", "unknown host")),
        new Rule(ErrorCategory.SERVER, true,
            "Retry after delay. Server may be temporarily unavailable.",
            List.of("500", "502", "503", "504")),
        new Rule(ErrorCategory.CLIENT, false,
            "Do not retry. Fix request parameters or authentication.",
            List.of("400", "401", "403", "404"))
    );

    private static final ErrorClassification UNKNOWN = new ErrorClassification(ErrorCategory.UNKNOWN, false,
        "Review error details to determine if retry is appropriate.");

    public ErrorClassification categorizeError(Throwable error) {
        if (error == null) {
            return UNKNOWN;
        }
        String message = (error.getMessage() != null ? error.getMessage() : error.toString())
            .toLowerCase(Locale.ROOT);
        for (Rule rule : RULES) {
            if (rule.matches(message)) {
                return new ErrorClassification(rule.category(), rule.retryable(), rule.action());
            }
        }
        return UNKNOWN;
    }
}
