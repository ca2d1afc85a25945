package com.acme.render.core;

import com.acme.render.config.MessagingConfig;
import com.acme.render.spi.OutboxStore.OutboxRow;
import jakarta.inject.Singleton;
import java.util.Map;
import java.util.UUID;

/**
 * Builds outbox rows for run lifecycle events. The run id is the message key so all
 * events of one run land on the same partition.
 */
@Singleton
public final class Outbox {

    public static final String RESUBMISSION_REQUIRED = "RunResubmissionRequired";
    public static final String RUN_REFUNDED = "RunRefunded";
    public static final String RUN_FAILED = "RunFailed";

    private final MessagingConfig config;

    public Outbox(MessagingConfig config) {
        this.config = config;
    }

    public OutboxRow rowRunEvent(String type, UUID runId, UUID variantId, Map<String, ?> body) {
        return new OutboxRow(
            UUID.randomUUID(),
            "event",
            config.getTopicNaming().buildEventTopic(type),
            runId.toString(),
            type,
            Jsons.toJson(body),
            Map.of(
                "runId", runId.toString(),
                "variantId", variantId.toString(),
                "eventType", type
            ),
            0
        );
    }
}
