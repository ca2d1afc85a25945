package com.acme.render.core;

/**
 * Raised without calling the dependency while its circuit is open.
 */
public class CircuitOpenException extends RuntimeException {
    private final String operation;
    private final long retryAfterMs;

    public CircuitOpenException(String operation, long retryAfterMs) {
        super("Circuit breaker open for " + operation + ". Service temporarily unavailable.");
        this.operation = operation;
        this.retryAfterMs = retryAfterMs;
    }

    public String getOperation() {
        return operation;
    }

    public long getRetryAfterMs() {
        return retryAfterMs;
    }
}
