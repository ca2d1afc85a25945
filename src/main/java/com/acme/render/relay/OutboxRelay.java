package com.acme.render.relay;

import com.acme.render.config.TimeoutConfig;
import com.acme.render.spi.EventPublisher;
import com.acme.render.spi.OutboxStore;
import io.micronaut.scheduling.annotation.Scheduled;
import jakarta.inject.Singleton;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Publishes outbox rows to Kafka. Rows are normally pushed right after commit by the fast
 * path; the sweep picks up whatever that missed and anything rescheduled after a failure.
 */
@Singleton
public class OutboxRelay {
    private static final Logger LOG = LoggerFactory.getLogger(OutboxRelay.class);

    private final OutboxStore store;
    private final EventPublisher kafka;
    private final TimeoutConfig timeoutConfig;

    public OutboxRelay(OutboxStore s, EventPublisher k, TimeoutConfig timeoutConfig) {
        this.store = s;
        this.kafka = k;
        this.timeoutConfig = timeoutConfig;
    }

    public void publishNow(UUID id) {
        store.claimOne(id).ifPresent(this::sendAndMark);
    }

    @Scheduled(fixedDelay = "${outbox.sweep-interval:30s}", initialDelay = "${outbox.initial-delay:30s}")
    void sweepOnce() {
        List<OutboxStore.OutboxRow> rows;
        try {
            rows = store.claim(timeoutConfig.getOutboxBatchSize(), host());
        } catch (RuntimeException e) {
            LOG.error("Outbox sweep could not claim rows", e);
            return;
        }
        if (!rows.isEmpty()) {
            LOG.debug("Outbox sweep claimed {} rows", rows.size());
        }
        rows.forEach(this::sendAndMark);
    }

    private void sendAndMark(OutboxStore.OutboxRow r) {
        try {
            switch (r.category()) {
                case "event" -> kafka.publish(r.topic(), r.key(), r.payload(), r.headers());
                default -> throw new IllegalArgumentException("Unknown category " + r.category());
            }
            store.markPublished(r.id());
        } catch (Exception e) {
            long backoff = Math.min(timeoutConfig.getMaxBackoffMillis(),
                (long) Math.pow(2, Math.max(1, r.attempts() + 1)) * 1000L);
            LOG.warn("Publishing outbox row {} ({}) failed, retrying in {}ms: {}", r.id(), r.type(), backoff, e.toString());
            store.reschedule(r.id(), backoff, e.toString());
        }
    }

    private String host() {
        return java.net.InetAddress.getLoopbackAddress().getHostName();
    }
}
