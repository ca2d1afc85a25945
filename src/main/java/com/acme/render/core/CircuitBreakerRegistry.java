package com.acme.render.core;

import com.acme.render.config.CircuitBreakerConfig;
import jakarta.annotation.PreDestroy;
import jakarta.inject.Singleton;
import java.time.Clock;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Circuit breakers keyed by operation name. A circuit opens after {@code failureThreshold}
 * consecutive failures, rejects calls until {@code resetTimeoutMs} has passed, then lets a
 * single trial call through: success closes it, failure re-opens it.
 */
@Singleton
public class CircuitBreakerRegistry {
    private static final Logger LOG = LoggerFactory.getLogger(CircuitBreakerRegistry.class);

    private final ConcurrentMap<String, Circuit> circuits = new ConcurrentHashMap<>();
    private final Clock clock;
    private final int defaultFailureThreshold;
    private final long defaultResetTimeoutMs;

    public CircuitBreakerRegistry(CircuitBreakerConfig config, Clock clock) {
        this.clock = clock;
        this.defaultFailureThreshold = config.getFailureThreshold();
        this.defaultResetTimeoutMs = config.getResetTimeout().toMillis();
    }

    public <T> T executeWithCircuitBreaker(ProviderCall<T> operation, String name) throws Exception {
        return executeWithCircuitBreaker(operation, name, defaultFailureThreshold, defaultResetTimeoutMs);
    }

    public <T> T executeWithCircuitBreaker(ProviderCall<T> operation, String name,
                                           int failureThreshold, long resetTimeoutMs) throws Exception {
        Circuit circuit = circuits.computeIfAbsent(name, n -> new Circuit());
        long now = clock.millis();

        switch (circuit.tryAcquire(now, resetTimeoutMs)) {
            case REJECTED -> {
                long remaining = circuit.remainingMs(now, resetTimeoutMs);
                LOG.warn("Circuit breaker is open for {} ({} failures), {}s until reset",
                    name, circuit.snapshot().failureCount(), Math.round(remaining / 1000.0));
                throw new CircuitOpenException(name, remaining);
            }
            case TRIAL -> LOG.info("Circuit breaker attempting reset for {}", name);
            case CLOSED -> { }
        }

        T result;
        try {
            result = operation.call();
        } catch (Throwable e) {
            // errors count too, otherwise a failed trial would leave the circuit half-open for good
            if (circuit.recordFailure(clock.millis(), failureThreshold)) {
                LOG.warn("Circuit breaker opened for {} after failure: {}", name, e.getMessage());
            } else {
                LOG.debug("Circuit breaker failure recorded for {} (threshold {})", name, failureThreshold);
            }
            throw e;
        }
        circuit.recordSuccess();
        return result;
    }

    public CircuitState state(String name) {
        Circuit circuit = circuits.get(name);
        return circuit == null ? CircuitState.closed() : circuit.snapshot();
    }

    public void reset(String name) {
        Circuit circuit = circuits.get(name);
        if (circuit != null) {
            circuit.recordSuccess();
            LOG.info("Circuit breaker reset for {}", name);
        }
    }

    @PreDestroy
    void shutdown() {
        circuits.clear();
    }
}
