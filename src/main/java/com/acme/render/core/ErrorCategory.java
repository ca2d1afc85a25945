package com.acme.render.core;

public enum ErrorCategory {
    RATE_LIMIT("rate_limit"),
    TIMEOUT("timeout"),
    NETWORK("network"),
    SERVER("server"),
    CLIENT("client"),
    UNKNOWN("unknown");

    private final String value;

    ErrorCategory(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }
}
