package com.acme.render.core;

import com.acme.render.relay.OutboxRelay;
import io.micronaut.transaction.TransactionOperations;
import io.micronaut.transaction.support.TransactionSynchronization;
import jakarta.inject.Singleton;
import java.sql.Connection;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Publishes an outbox row right after the surrounding transaction commits instead of
 * waiting for the next relay sweep. A failed fast-path publish stays in the outbox.
 */
@Singleton
public class FastPathPublisher {
    private static final Logger LOG = LoggerFactory.getLogger(FastPathPublisher.class);

    private final TransactionOperations<Connection> transactionOps;
    private final OutboxRelay relay;

    public FastPathPublisher(TransactionOperations<Connection> transactionOps, OutboxRelay relay) {
        this.transactionOps = transactionOps;
        this.relay = relay;
    }

    public void registerAfterCommit(UUID outboxId) {
        transactionOps.findTransactionStatus().ifPresent(status -> {
            status.registerSynchronization(new TransactionSynchronization() {
                @Override
                public void afterCommit() {
                    try {
                        relay.publishNow(outboxId);
                    } catch (Exception e) {
                        LOG.warn("Fast-path publish of outbox row {} failed, relay sweep will retry: {}",
                            outboxId, e.getMessage());
                    }
                }
            });
        });
    }
}
