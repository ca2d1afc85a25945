package com.acme.render.core;

/**
 * Point-in-time view of one named circuit.
 */
public record CircuitState(boolean isOpen, int failureCount, long openedAt) {

    public static CircuitState closed() {
        return new CircuitState(false, 0, 0L);
    }
}
