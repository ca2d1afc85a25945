package com.acme.render.core;

/**
 * Backoff parameters for {@link ResilientCallExecutor}. Delays are in milliseconds.
 */
public record RetryPolicy(int maxRetries, long baseDelayMs, long maxDelayMs, double exponentialBase, double jitterFactor) {

    public RetryPolicy {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0");
        }
        if (baseDelayMs < 0 || maxDelayMs < 0) {
            throw new IllegalArgumentException("delays must be >= 0");
        }
        if (exponentialBase < 1.0) {
            throw new IllegalArgumentException("exponentialBase must be >= 1");
        }
        if (jitterFactor < 0.0 || jitterFactor > 1.0) {
            throw new IllegalArgumentException("jitterFactor must be within [0, 1]");
        }
    }

    public static RetryPolicy defaults() {
        return new RetryPolicy(3, 1000, 32000, 2.0, 0.1);
    }

    public RetryPolicy withMaxRetries(int value) {
        return new RetryPolicy(value, baseDelayMs, maxDelayMs, exponentialBase, jitterFactor);
    }

    public RetryPolicy withBaseDelayMs(long value) {
        return new RetryPolicy(maxRetries, value, maxDelayMs, exponentialBase, jitterFactor);
    }

    public RetryPolicy withMaxDelayMs(long value) {
        return new RetryPolicy(maxRetries, baseDelayMs, value, exponentialBase, jitterFactor);
    }

    public RetryPolicy withExponentialBase(double value) {
        return new RetryPolicy(maxRetries, baseDelayMs, maxDelayMs, value, jitterFactor);
    }

    public RetryPolicy withJitterFactor(double value) {
        return new RetryPolicy(maxRetries, baseDelayMs, maxDelayMs, exponentialBase, value);
    }
}
