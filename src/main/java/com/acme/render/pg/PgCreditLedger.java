package com.acme.render.pg;

import com.acme.render.spi.CreditLedger;
import io.micronaut.data.connection.ConnectionOperations;
import jakarta.inject.Singleton;
import jakarta.transaction.Transactional;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Insert-only ledger. {@code credit_transactions} has a unique key on
 * {@code (run_id, transaction_type)}, so a second refund for the same run fails at the database.
 */
@Singleton
public class PgCreditLedger implements CreditLedger {
    private final JdbcSupport jdbc;
    private final Clock clock;

    public PgCreditLedger(ConnectionOperations<Connection> connectionOps, Clock clock) {
        this.jdbc = new JdbcSupport(connectionOps);
        this.clock = clock;
    }

    @Override
    public Transaction appendTransaction(UUID userId, int amount, TransactionType type, String description,
                                         UUID projectId, UUID variantId, UUID runId) {
        if (userId == null) {
            throw new IllegalArgumentException("Ledger entries need a user");
        }
        UUID id = UUID.randomUUID();
        Instant now = clock.instant();
        jdbc.update(
            "insert into credit_transactions(id, user_id, amount, transaction_type, description, " +
            "project_id, variant_id, run_id, created_at) values (?,?,?,?,?,?,?,?,?)", ps -> {
                ps.setObject(1, id);
                ps.setObject(2, userId);
                ps.setInt(3, amount);
                ps.setString(4, type.value());
                ps.setString(5, description);
                setNullable(ps, 6, projectId);
                setNullable(ps, 7, variantId);
                setNullable(ps, 8, runId);
                ps.setTimestamp(9, JdbcSupport.ts(now));
            });
        return new Transaction(id, userId, amount, type, description, projectId, variantId, runId, now);
    }

    @Override
    @Transactional
    public Optional<Transaction> debit(UUID userId, int credits, String description,
                                       UUID projectId, UUID variantId, UUID runId) {
        // row locks on the user's projects serialize check-and-debit per user
        jdbc.lock("select id from projects where user_id=? for update", ps -> ps.setObject(1, userId));
        if (balance(userId) < credits) {
            return Optional.empty();
        }
        return Optional.of(appendTransaction(userId, -credits, TransactionType.USAGE, description,
            projectId, variantId, runId));
    }

    @Override
    public boolean hasTransactionForRun(UUID runId, TransactionType type) {
        return jdbc.queryOne("select 1 from credit_transactions where run_id=? and transaction_type=?", ps -> {
            ps.setObject(1, runId);
            ps.setString(2, type.value());
        }, rs -> rs.getInt(1)).isPresent();
    }

    @Override
    public long balance(UUID userId) {
        return jdbc.queryOne("select coalesce(sum(amount), 0) from credit_transactions where user_id=?",
            ps -> ps.setObject(1, userId), rs -> rs.getLong(1)).orElse(0L);
    }

    @Override
    public List<Transaction> history(UUID userId) {
        return jdbc.query(
            "select id, user_id, amount, transaction_type, description, project_id, variant_id, run_id, created_at " +
            "from credit_transactions where user_id=? order by created_at, id",
            ps -> ps.setObject(1, userId), PgCreditLedger::mapTransaction);
    }

    private static void setNullable(java.sql.PreparedStatement ps, int index, UUID value) throws SQLException {
        if (value != null) {
            ps.setObject(index, value);
        } else {
            ps.setNull(index, Types.OTHER);
        }
    }

    private static Transaction mapTransaction(ResultSet rs) throws SQLException {
        return new Transaction(
            JdbcSupport.uuid(rs, "id"),
            JdbcSupport.uuid(rs, "user_id"),
            rs.getInt("amount"),
            TransactionType.fromValue(rs.getString("transaction_type")),
            rs.getString("description"),
            JdbcSupport.uuid(rs, "project_id"),
            JdbcSupport.uuid(rs, "variant_id"),
            JdbcSupport.uuid(rs, "run_id"),
            JdbcSupport.instant(rs.getTimestamp("created_at"))
        );
    }
}
