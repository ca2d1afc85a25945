package com.acme.render.core;

/**
 * Renders are only accepted on engines the timeout monitor watches.
 */
public class UnsupportedEngineException extends RuntimeException {
    private final String engineClass;

    public UnsupportedEngineException(String engineClass) {
        super("Engine " + engineClass + " is not supported");
        this.engineClass = engineClass;
    }

    public String getEngineClass() {
        return engineClass;
    }
}
