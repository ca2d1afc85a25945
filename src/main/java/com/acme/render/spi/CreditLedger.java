package com.acme.render.spi;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Append-only credit log. A user's balance is the sum of their entries; entries are never
 * changed or removed.
 */
public interface CreditLedger {
    Transaction appendTransaction(UUID userId, int amount, TransactionType type, String description,
                                  UUID projectId, UUID variantId, UUID runId);

    default Transaction appendTransaction(UUID userId, int amount, TransactionType type, String description,
                                          UUID projectId, UUID variantId) {
        return appendTransaction(userId, amount, type, description, projectId, variantId, null);
    }

    /**
     * Writes a usage entry of {@code -credits} for {@code runId} if the user's balance covers it.
     * Concurrent debits for the same user are serialized, so the balance never goes negative
     * through this method.
     *
     * @return the entry written, or empty when the balance was too low
     */
    Optional<Transaction> debit(UUID userId, int credits, String description,
                                UUID projectId, UUID variantId, UUID runId);

    boolean hasTransactionForRun(UUID runId, TransactionType type);

    long balance(UUID userId);

    List<Transaction> history(UUID userId);

    enum TransactionType {
        PURCHASE("purchase"),
        USAGE("usage"),
        REFUND("refund");

        private final String value;

        TransactionType(String value) {
            this.value = value;
        }

        public String value() {
            return value;
        }

        public static TransactionType fromValue(String value) {
            for (TransactionType t : values()) {
                if (t.value.equals(value)) {
                    return t;
                }
            }
            throw new IllegalArgumentException("Unknown transaction type " + value);
        }
    }

    record Transaction(
        UUID id,
        UUID userId,
        int amount,
        TransactionType type,
        String description,
        UUID projectId,
        UUID variantId,
        UUID runId,
        Instant createdAt
    ) {}
}
