package com.acme.render.config;

import com.acme.render.core.RetryPolicy;
import io.micronaut.context.annotation.ConfigurationProperties;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Default retry policy applied by {@link com.acme.render.core.ResilientCallExecutor}
 * when a caller does not pass its own.
 */
@ConfigurationProperties("resilience.retry")
public class RetryConfig {

    /**
     * Case-insensitive markers of transient provider failures.
     */
    public static final List<String> DEFAULT_RETRYABLE_ERRORS = List.of(
        "429",
        "500",
        "502",
        "503",
        "504",
        "ECONNRESET",
        "CONNECTION RESET",
        "ETIMEDOUT",
        "TIMEOUT",
        "TIMED OUT",
        "ENOTFOUND",
        "UNKNOWNHOST",
        "RESOURCE_EXHAUSTED",
        "RATE_LIMIT",
        "NETWORK"
    );

    private int maxRetries = 3;
    private Duration baseDelay = Duration.ofSeconds(1);
    private Duration maxDelay = Duration.ofSeconds(32);
    private double exponentialBase = 2.0;
    private double jitterFactor = 0.1;
    private List<String> retryableErrors = new ArrayList<>(DEFAULT_RETRYABLE_ERRORS);

    public int getMaxRetries() {
        return maxRetries;
    }

    public void setMaxRetries(int maxRetries) {
        this.maxRetries = maxRetries;
    }

    public Duration getBaseDelay() {
        return baseDelay;
    }

    public void setBaseDelay(Duration baseDelay) {
        this.baseDelay = baseDelay;
    }

    public Duration getMaxDelay() {
        return maxDelay;
    }

    public void setMaxDelay(Duration maxDelay) {
        this.maxDelay = maxDelay;
    }

    public double getExponentialBase() {
        return exponentialBase;
    }

    public void setExponentialBase(double exponentialBase) {
        this.exponentialBase = exponentialBase;
    }

    public double getJitterFactor() {
        return jitterFactor;
    }

    public void setJitterFactor(double jitterFactor) {
        this.jitterFactor = jitterFactor;
    }

    public List<String> getRetryableErrors() {
        return retryableErrors;
    }

    public void setRetryableErrors(List<String> retryableErrors) {
        this.retryableErrors = retryableErrors;
    }

    public RetryPolicy toPolicy() {
        return new RetryPolicy(maxRetries, baseDelay.toMillis(), maxDelay.toMillis(), exponentialBase, jitterFactor);
    }
}
