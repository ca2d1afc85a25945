package com.acme.render.spi;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

public enum RunState {
    QUEUED("queued"),
    RUNNING("running"),
    SUCCEEDED("succeeded"),
    FAILED("failed");

    /**
     * States a run may still leave. Every transition out of them is conditional on still being in one.
     */
    public static final Set<RunState> ACTIVE = Collections.unmodifiableSet(EnumSet.of(QUEUED, RUNNING));

    private final String value;

    RunState(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED;
    }

    public static RunState fromValue(String value) {
        for (RunState s : values()) {
            if (s.value.equals(value)) {
                return s;
            }
        }
        throw new IllegalArgumentException("Unknown run state " + value);
    }
}
