package com.acme.render.core;

import com.acme.render.config.RetryConfig;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs a call against a flaky dependency, retrying transient failures with exponential
 * backoff and jitter. Once the budget is spent the last failure is rethrown as-is.
 */
@Singleton
public class ResilientCallExecutor {
    private static final Logger LOG = LoggerFactory.getLogger(ResilientCallExecutor.class);

    private final RetryPolicy defaultPolicy;
    private final List<String> defaultRetryableErrors;
    private final Sleeper sleeper;
    private final DoubleSupplier random;

    @Inject
    public ResilientCallExecutor(RetryConfig config) {
        this(config.toPolicy(), config.getRetryableErrors(), Sleeper.THREAD,
            () -> ThreadLocalRandom.current().nextDouble());
    }

    ResilientCallExecutor(RetryPolicy defaultPolicy, List<String> defaultRetryableErrors,
                          Sleeper sleeper, DoubleSupplier random) {
        this.defaultPolicy = defaultPolicy;
        this.defaultRetryableErrors = List.copyOf(defaultRetryableErrors);
        this.sleeper = sleeper;
        this.random = random;
    }

    public <T> T executeWithRetry(ProviderCall<T> operation, String name) throws Exception {
        return executeWithRetry(operation, name, null, null, null);
    }

    public <T> T executeWithRetry(ProviderCall<T> operation, String name, RetryPolicy policy) throws Exception {
        return executeWithRetry(operation, name, policy, null, null);
    }

    /**
     * @param policy          overrides the configured policy when not null
     * @param retryableErrors overrides the configured retryable markers when not null
     * @param onRetry         notified before each backoff sleep, may be null
     */
    public <T> T executeWithRetry(ProviderCall<T> operation, String name, RetryPolicy policy,
                                  List<String> retryableErrors, RetryListener onRetry) throws Exception {
        RetryPolicy config = policy != null ? policy : defaultPolicy;
        List<String> markers = retryableErrors != null ? retryableErrors : defaultRetryableErrors;
        int maxAttempts = config.maxRetries() + 1;
        int attempt = 0;

        while (true) {
            try {
                LOG.debug("Executing {} attempt {}/{}", name, attempt + 1, maxAttempts);
                T result = operation.call();
                if (attempt > 0) {
                    LOG.info("{} succeeded after {} attempts", name, attempt + 1);
                }
                return result;
            } catch (Exception e) {
                attempt++;
                boolean retryable = isRetryable(e, markers);
                if (!retryable || attempt > config.maxRetries()) {
                    LOG.error("{} failed on attempt {}/{} ({}): {}", name, attempt, maxAttempts,
                        retryable ? "max retries exceeded" : "non-retryable error", e.getMessage());
                    throw e;
                }

                long delayMs = calculateDelay(attempt, config);
                LOG.warn("{} failed on attempt {}/{}, retrying in {}ms: {}", name, attempt, maxAttempts,
                    delayMs, e.getMessage());
                if (onRetry != null) {
                    onRetry.onRetry(attempt, e, delayMs);
                }
                pause(delayMs, e);
            }
        }
    }

    /**
     * Delay before the attempt that follows failed attempt {@code attempt} (1-indexed):
     * {@code base * exponentialBase^(attempt-1)} with {@code +/- jitterFactor/2} jitter, capped at the max delay.
     */
    public long calculateDelay(int attempt, RetryPolicy config) {
        double exponential = config.baseDelayMs() * Math.pow(config.exponentialBase(), attempt - 1);
        double jitter = exponential * config.jitterFactor() * (random.getAsDouble() - 0.5);
        double delay = Math.min(exponential + jitter, config.maxDelayMs());
        return Math.max(0L, (long) delay);
    }

    public boolean isRetryable(Throwable error) {
        return isRetryable(error, defaultRetryableErrors);
    }

    static boolean isRetryable(Throwable error, List<String> markers) {
        if (error instanceof CircuitOpenException) {
            return false;
        }
        for (Throwable t = error; t != null; t = t.getCause() == t ? null : t.getCause()) {
            String message = t.getMessage() == null ? "" : t.getMessage().toUpperCase(Locale.ROOT);
            String text = t.toString().toUpperCase(Locale.ROOT);
            for (String marker : markers) {
                String m = marker.toUpperCase(Locale.ROOT);
                if (message.contains(m) || text.contains(m)) {
                    return true;
                }
            }
        }
        return false;
    }

    private void pause(long delayMs, Exception failure) throws Exception {
        try {
            sleeper.sleep(delayMs);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            failure.addSuppressed(ie);
            throw failure;
        }
    }
}
