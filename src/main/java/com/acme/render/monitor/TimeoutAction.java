package com.acme.render.monitor;

import java.util.UUID;

/**
 * What the monitor did about one elapsed run.
 */
public record TimeoutAction(UUID runId, UUID variantId, Kind action, String reason, int creditsToRefund) {

    public enum Kind {
        RETRY("retry"),
        REFUND("refund"),
        MARK_FAILED("mark_failed");

        private final String value;

        Kind(String value) {
            this.value = value;
        }

        public String value() {
            return value;
        }
    }
}
