package com.acme.render.spi;

/**
 * UI-facing mirror of the latest run outcome for a variant.
 */
public enum VariantStatus {
    PENDING("pending"),
    RENDERING("rendering"),
    COMPLETED("completed"),
    ERROR("error");

    private final String value;

    VariantStatus(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static VariantStatus fromValue(String value) {
        for (VariantStatus s : values()) {
            if (s.value.equals(value)) {
                return s;
            }
        }
        throw new IllegalArgumentException("Unknown variant status " + value);
    }
}
