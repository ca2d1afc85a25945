package com.acme.render.core;

@FunctionalInterface
public interface RetryListener {
    void onRetry(int attempt, Exception error, long delayMs);
}
