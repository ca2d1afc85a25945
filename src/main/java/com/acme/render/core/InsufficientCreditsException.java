package com.acme.render.core;

import java.util.UUID;

public class InsufficientCreditsException extends RuntimeException {
    private final UUID userId;
    private final int required;
    private final long available;

    public InsufficientCreditsException(UUID userId, int required, long available) {
        super("Insufficient credits: required " + required + ", available " + available);
        this.userId = userId;
        this.required = required;
        this.available = available;
    }

    public UUID getUserId() {
        return userId;
    }

    public int getRequired() {
        return required;
    }

    public long getAvailable() {
        return available;
    }
}
