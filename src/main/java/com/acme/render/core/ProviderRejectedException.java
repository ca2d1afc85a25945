package com.acme.render.core;

import java.util.UUID;

/**
 * The provider refused the request itself (bad input, content policy). Resubmitting the same
 * request will not help; the original failure is kept as the cause.
 */
public class ProviderRejectedException extends RuntimeException {
    private final UUID runId;

    public ProviderRejectedException(UUID runId, Throwable cause) {
        super("Video generation request was rejected", cause);
        this.runId = runId;
    }

    public UUID getRunId() {
        return runId;
    }
}
