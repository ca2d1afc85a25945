package com.acme.render.core;

/**
 * Mutable bookkeeping behind one named circuit. All transitions happen under the instance lock.
 */
final class Circuit {

    enum Permit { CLOSED, TRIAL, REJECTED }

    private boolean open;
    private boolean halfOpen;
    private int failureCount;
    private long openedAt;

    synchronized Permit tryAcquire(long now, long resetTimeoutMs) {
        if (!open) {
            return Permit.CLOSED;
        }
        // one trial at a time; everyone else keeps failing fast until it reports back
        if (halfOpen || now - openedAt < resetTimeoutMs) {
            return Permit.REJECTED;
        }
        halfOpen = true;
        failureCount = 0;
        return Permit.TRIAL;
    }

    synchronized void recordSuccess() {
        open = false;
        halfOpen = false;
        failureCount = 0;
        openedAt = 0L;
    }

    /**
     * @return true when this failure opened (or re-opened) the circuit
     */
    synchronized boolean recordFailure(long now, int failureThreshold) {
        failureCount++;
        if (halfOpen) {
            halfOpen = false;
            openedAt = now;
            return true;
        }
        if (!open && failureCount >= failureThreshold) {
            open = true;
            openedAt = now;
            return true;
        }
        return false;
    }

    synchronized long remainingMs(long now, long resetTimeoutMs) {
        return Math.max(0L, resetTimeoutMs - (now - openedAt));
    }

    synchronized CircuitState snapshot() {
        return new CircuitState(open, failureCount, openedAt);
    }
}
