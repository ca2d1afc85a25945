package com.acme.render.core;

import com.acme.render.relay.OutboxRelay;
import io.micronaut.transaction.TransactionOperations;
import io.micronaut.transaction.TransactionStatus;
import io.micronaut.transaction.support.TransactionSynchronization;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.sql.Connection;
import java.util.Optional;
import java.util.UUID;

import static org.mockito.Mockito.*;

class FastPathPublisherTest {

    private TransactionOperations<Connection> transactionOps;
    private TransactionStatus<Connection> transactionStatus;
    private OutboxRelay relay;
    private FastPathPublisher fastPath;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        transactionOps = mock(TransactionOperations.class);
        transactionStatus = mock(TransactionStatus.class);
        relay = mock(OutboxRelay.class);
        fastPath = new FastPathPublisher(transactionOps, relay);
    }

    @SuppressWarnings({"unchecked", "rawtypes"})
    private TransactionSynchronization registeredSync(UUID outboxId) {
        when(transactionOps.findTransactionStatus()).thenReturn((Optional) Optional.of(transactionStatus));
        ArgumentCaptor<TransactionSynchronization> captor = ArgumentCaptor.forClass(TransactionSynchronization.class);

        fastPath.registerAfterCommit(outboxId);

        verify(transactionStatus).registerSynchronization(captor.capture());
        return captor.getValue();
    }

    @Test
    void testPublishesOnlyAfterCommit() {
        UUID outboxId = UUID.randomUUID();

        TransactionSynchronization sync = registeredSync(outboxId);
        verifyNoInteractions(relay);

        sync.afterCommit();
        verify(relay).publishNow(outboxId);
    }

    @Test
    void testFailedFastPathDoesNotPropagate() {
        UUID outboxId = UUID.randomUUID();
        doThrow(new RuntimeException("broker down")).when(relay).publishNow(any());

        registeredSync(outboxId).afterCommit();

        verify(relay).publishNow(outboxId);
    }

    @Test
    void testNoOpWhenNoTransactionActive() {
        when(transactionOps.findTransactionStatus()).thenReturn(Optional.empty());

        fastPath.registerAfterCommit(UUID.randomUUID());

        verify(transactionStatus, never()).registerSynchronization(any());
        verifyNoInteractions(relay);
    }
}
