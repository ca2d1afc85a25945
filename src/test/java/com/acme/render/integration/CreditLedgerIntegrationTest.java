package com.acme.render.integration;

import com.acme.render.spi.CreditLedger;
import com.acme.render.spi.CreditLedger.TransactionType;
import io.micronaut.test.extensions.junit5.annotation.MicronautTest;
import jakarta.inject.Inject;
import org.junit.jupiter.api.Test;

import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

@MicronautTest(transactional = true, rollback = true)
class CreditLedgerIntegrationTest {

    @Inject
    CreditLedger ledger;

    @Test
    void testBalanceIsSumOfEntries() {
        UUID userId = UUID.randomUUID();
        assertEquals(0L, ledger.balance(userId));

        ledger.appendTransaction(userId, 5, TransactionType.PURCHASE, "Starter pack", null, null);
        ledger.appendTransaction(userId, -1, TransactionType.USAGE, "Final render", null, null, UUID.randomUUID());
        ledger.appendTransaction(userId, 1, TransactionType.REFUND, "Refund: timeout", null, null, UUID.randomUUID());

        assertEquals(5L, ledger.balance(userId));
        assertEquals(3, ledger.history(userId).size());
    }

    @Test
    void testHistoryKeepsAttribution() {
        UUID userId = UUID.randomUUID();
        UUID projectId = UUID.randomUUID();
        UUID variantId = UUID.randomUUID();
        UUID runId = UUID.randomUUID();

        ledger.appendTransaction(userId, 1, TransactionType.REFUND, "Refund: Final render timeout after 20 minutes",
            projectId, variantId, runId);

        var tx = ledger.history(userId).get(0);
        assertEquals(TransactionType.REFUND, tx.type());
        assertEquals(1, tx.amount());
        assertEquals(projectId, tx.projectId());
        assertEquals(variantId, tx.variantId());
        assertEquals(runId, tx.runId());
        assertEquals("Refund: Final render timeout after 20 minutes", tx.description());
    }

    @Test
    void testHasTransactionForRun() {
        UUID userId = UUID.randomUUID();
        UUID runId = UUID.randomUUID();

        assertFalse(ledger.hasTransactionForRun(runId, TransactionType.REFUND));
        ledger.appendTransaction(userId, -1, TransactionType.USAGE, "Final render", null, null, runId);

        assertTrue(ledger.hasTransactionForRun(runId, TransactionType.USAGE));
        assertFalse(ledger.hasTransactionForRun(runId, TransactionType.REFUND));
    }

    @Test
    void testEntriesWithoutRunDoNotCollide() {
        UUID userId = UUID.randomUUID();

        ledger.appendTransaction(userId, 5, TransactionType.PURCHASE, "a", null, null);
        ledger.appendTransaction(userId, 5, TransactionType.PURCHASE, "b", null, null);

        assertEquals(10L, ledger.balance(userId));
    }

    @Test
    void testSecondRefundForSameRunIsRejected() {
        UUID userId = UUID.randomUUID();
        UUID runId = UUID.randomUUID();
        ledger.appendTransaction(userId, 1, TransactionType.REFUND, "Refund: first", null, null, runId);

        assertThrows(RuntimeException.class,
            () -> ledger.appendTransaction(userId, 1, TransactionType.REFUND, "Refund: second", null, null, runId));
    }

    @Test
    void testUserIsRequired() {
        assertThrows(IllegalArgumentException.class,
            () -> ledger.appendTransaction(null, 1, TransactionType.REFUND, "x", null, null, UUID.randomUUID()));
    }

    @Test
    void testDebitWritesUsageEntryWhenBalanceCovers() {
        UUID userId = UUID.randomUUID();
        UUID runId = UUID.randomUUID();
        ledger.appendTransaction(userId, 2, TransactionType.PURCHASE, "Starter pack", null, null);

        var tx = ledger.debit(userId, 1, "Final render", null, null, runId).orElseThrow();

        assertEquals(-1, tx.amount());
        assertEquals(TransactionType.USAGE, tx.type());
        assertTrue(ledger.hasTransactionForRun(runId, TransactionType.USAGE));
        assertEquals(1L, ledger.balance(userId));
    }

    @Test
    void testDebitRefusedWhenBalanceTooLow() {
        UUID userId = UUID.randomUUID();
        UUID runId = UUID.randomUUID();
        ledger.appendTransaction(userId, 1, TransactionType.PURCHASE, "Starter pack", null, null);
        ledger.debit(userId, 1, "Final render", null, null, UUID.randomUUID());

        assertTrue(ledger.debit(userId, 1, "Final render", null, null, runId).isEmpty());

        assertFalse(ledger.hasTransactionForRun(runId, TransactionType.USAGE));
        assertEquals(0L, ledger.balance(userId));
    }
}
