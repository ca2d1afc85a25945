package com.acme.render.core;

import java.util.UUID;

/**
 * The provider could not take the job: its circuit is open or the retry budget ran out.
 * The original failure is kept as the cause.
 */
public class ProviderUnavailableException extends RuntimeException {
    private final UUID runId;

    public ProviderUnavailableException(UUID runId, Throwable cause) {
        super("Video generation temporarily unavailable", cause);
        this.runId = runId;
    }

    public UUID getRunId() {
        return runId;
    }
}
