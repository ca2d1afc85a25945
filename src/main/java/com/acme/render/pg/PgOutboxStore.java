package com.acme.render.pg;

import com.acme.render.core.Jsons;
import com.acme.render.spi.OutboxStore;
import io.micronaut.data.connection.ConnectionOperations;
import jakarta.inject.Singleton;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Outbox rows move NEW -> CLAIMED -> PUBLISHED; a failed publish puts the row back to NEW
 * with a {@code next_at} in the future. Claiming is a conditional update, so two relays
 * never publish the same row from one claim.
 */
@Singleton
public class PgOutboxStore implements OutboxStore {
    private static final String ROW_COLUMNS = "id, category, topic, msg_key, type, payload, headers, attempts";

    private final JdbcSupport jdbc;
    private final Clock clock;
    private final String hostname;

    public PgOutboxStore(ConnectionOperations<Connection> connectionOps, Clock clock) {
        this.jdbc = new JdbcSupport(connectionOps);
        this.clock = clock;
        this.hostname = java.net.InetAddress.getLoopbackAddress().getHostName();
    }

    @Override
    public UUID addReturningId(OutboxRow r) {
        var id = r.id() != null ? r.id() : UUID.randomUUID();
        jdbc.update(
            "insert into outbox(id, category, topic, msg_key, type, payload, headers, status, attempts, created_at) " +
            "values (?,?,?,?,?,?,?,'NEW',0,?)", ps -> {
                ps.setObject(1, id);
                ps.setString(2, r.category());
                ps.setString(3, r.topic());
                ps.setString(4, r.key());
                ps.setString(5, r.type());
                ps.setString(6, r.payload());
                ps.setString(7, Jsons.toJson(r.headers() != null ? r.headers() : Map.of()));
                ps.setTimestamp(8, JdbcSupport.ts(clock.instant()));
            });
        return id;
    }

    @Override
    public Optional<OutboxRow> claimOne(UUID id) {
        return claimById(id, hostname);
    }

    @Override
    public List<OutboxRow> claim(int max, String claimer) {
        List<UUID> candidates = jdbc.query(
            "select id from outbox where status='NEW' and (next_at is null or next_at <= ?) " +
            "order by created_at limit ?", ps -> {
                ps.setTimestamp(1, JdbcSupport.ts(clock.instant()));
                ps.setInt(2, max);
            }, rs -> JdbcSupport.uuid(rs, "id"));

        List<OutboxRow> result = new ArrayList<>();
        for (UUID id : candidates) {
            claimById(id, claimer).ifPresent(result::add);
        }
        return result;
    }

    @Override
    public void markPublished(UUID id) {
        jdbc.update("update outbox set status='PUBLISHED', published_at=? where id=?", ps -> {
            ps.setTimestamp(1, JdbcSupport.ts(clock.instant()));
            ps.setObject(2, id);
        });
    }

    @Override
    public void reschedule(UUID id, long backoffMs, String err) {
        Instant nextAt = clock.instant().plusMillis(backoffMs);
        jdbc.update("update outbox set status='NEW', claimed_by=null, attempts=attempts+1, next_at=?, last_error=? " +
            "where id=?", ps -> {
                ps.setTimestamp(1, JdbcSupport.ts(nextAt));
                ps.setString(2, err);
                ps.setObject(3, id);
            });
    }

    private Optional<OutboxRow> claimById(UUID id, String claimer) {
        int claimed = jdbc.update("update outbox set status='CLAIMED', claimed_by=? where id=? and status='NEW'", ps -> {
            ps.setString(1, claimer);
            ps.setObject(2, id);
        });
        if (claimed != 1) {
            return Optional.empty();
        }
        return jdbc.queryOne("select " + ROW_COLUMNS + " from outbox where id=?",
            ps -> ps.setObject(1, id), PgOutboxStore::mapRow);
    }

    @SuppressWarnings("unchecked")
    private static OutboxRow mapRow(ResultSet rs) throws SQLException {
        String headersJson = rs.getString("headers");
        Map<String, String> headers = headersJson != null ? Jsons.fromJson(headersJson, Map.class) : Map.of();
        return new OutboxRow(
            JdbcSupport.uuid(rs, "id"),
            rs.getString("category"),
            rs.getString("topic"),
            rs.getString("msg_key"),
            rs.getString("type"),
            rs.getString("payload"),
            headers,
            rs.getInt("attempts")
        );
    }
}
