package com.acme.render.core;

public record ErrorClassification(ErrorCategory category, boolean isRetryable, String recommendedAction) {
}
