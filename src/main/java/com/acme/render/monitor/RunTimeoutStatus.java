package com.acme.render.monitor;

public record RunTimeoutStatus(boolean isTimedOut, long runningTimeMs, long timeoutThresholdMs) {

    public static RunTimeoutStatus unknown() {
        return new RunTimeoutStatus(false, 0L, 0L);
    }
}
