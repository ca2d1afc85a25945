package com.acme.render.config;

import io.micronaut.context.annotation.ConfigurationProperties;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Deadlines and cadence of the timeout monitor, plus the outbox relay backoff.
 */
@ConfigurationProperties("timeout")
public class TimeoutConfig {

    private Duration previewTimeout = Duration.ofMinutes(10);
    private Duration finalTimeout = Duration.ofMinutes(20);
    private Duration checkInterval = Duration.ofSeconds(60);
    private boolean monitorEnabled = true;
    private List<String> monitoredEngines = new ArrayList<>(List.of("veo_fast"));
    private int finalDurationMarker = 24;
    private int refundCredits = 1;
    private Duration maxBackoff = Duration.ofMinutes(5);
    private int outboxBatchSize = 500;

    public Duration getPreviewTimeout() {
        return previewTimeout;
    }

    public void setPreviewTimeout(Duration previewTimeout) {
        this.previewTimeout = previewTimeout;
    }

    public Duration getFinalTimeout() {
        return finalTimeout;
    }

    public void setFinalTimeout(Duration finalTimeout) {
        this.finalTimeout = finalTimeout;
    }

    public Duration getCheckInterval() {
        return checkInterval;
    }

    public void setCheckInterval(Duration checkInterval) {
        this.checkInterval = checkInterval;
    }

    public boolean isMonitorEnabled() {
        return monitorEnabled;
    }

    public void setMonitorEnabled(boolean monitorEnabled) {
        this.monitorEnabled = monitorEnabled;
    }

    public List<String> getMonitoredEngines() {
        return monitoredEngines;
    }

    public void setMonitoredEngines(List<String> monitoredEngines) {
        this.monitoredEngines = monitoredEngines;
    }

    public int getFinalDurationMarker() {
        return finalDurationMarker;
    }

    public void setFinalDurationMarker(int finalDurationMarker) {
        this.finalDurationMarker = finalDurationMarker;
    }

    public int getRefundCredits() {
        return refundCredits;
    }

    public void setRefundCredits(int refundCredits) {
        this.refundCredits = refundCredits;
    }

    public Duration getMaxBackoff() {
        return maxBackoff;
    }

    public void setMaxBackoff(Duration maxBackoff) {
        this.maxBackoff = maxBackoff;
    }

    public long getMaxBackoffMillis() {
        return maxBackoff.toMillis();
    }

    public int getOutboxBatchSize() {
        return outboxBatchSize;
    }

    public void setOutboxBatchSize(int outboxBatchSize) {
        this.outboxBatchSize = outboxBatchSize;
    }

    /**
     * The shorter of the two deadlines; anything younger cannot have timed out yet.
     */
    public Duration getShortestTimeout() {
        return previewTimeout.compareTo(finalTimeout) <= 0 ? previewTimeout : finalTimeout;
    }
}
