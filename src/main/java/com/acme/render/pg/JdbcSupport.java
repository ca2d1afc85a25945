package com.acme.render.pg;

import io.micronaut.data.connection.ConnectionOperations;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Statement helpers shared by the stores. Every call joins the connection of the current
 * transaction when there is one.
 */
final class JdbcSupport {
    private final ConnectionOperations<Connection> connectionOps;

    JdbcSupport(ConnectionOperations<Connection> connectionOps) {
        this.connectionOps = connectionOps;
    }

    int update(String sql, SqlApplier a) {
        return connectionOps.executeWrite(status -> {
            try (var ps = status.getConnection().prepareStatement(sql)) {
                a.apply(ps);
                return ps.executeUpdate();
            } catch(SQLException e) {
                throw new RuntimeException(e);
            }
        });
    }

    /**
     * Runs a locking select on the write connection and discards the rows.
     */
    void lock(String sql, SqlApplier a) {
        connectionOps.executeWrite(status -> {
            try (var ps = status.getConnection().prepareStatement(sql)) {
                a.apply(ps);
                try (var rs = ps.executeQuery()) {
                    while (rs.next()) {
                        // drain so every matching row is locked
                    }
                }
                return null;
            } catch(SQLException e) {
                throw new RuntimeException(e);
            }
        });
    }

    <T> List<T> query(String sql, SqlApplier a, RowMapper<T> mapper) {
        return connectionOps.executeRead(status -> {
            try (var ps = status.getConnection().prepareStatement(sql)) {
                a.apply(ps);
                try (var rs = ps.executeQuery()) {
                    List<T> rows = new ArrayList<>();
                    while (rs.next()) {
                        rows.add(mapper.map(rs));
                    }
                    return rows;
                }
            } catch(SQLException e) {
                throw new RuntimeException(e);
            }
        });
    }

    <T> Optional<T> queryOne(String sql, SqlApplier a, RowMapper<T> mapper) {
        List<T> rows = query(sql, a, mapper);
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    /**
     * True when {@code e} wraps a unique or primary key violation (SQLState 23505).
     */
    static boolean isUniqueViolation(Throwable e) {
        for (Throwable t = e; t != null; t = t.getCause()) {
            if (t instanceof SQLException && "23505".equals(((SQLException) t).getSQLState())) {
                return true;
            }
        }
        return false;
    }

    static String placeholders(Collection<?> values) {
        return String.join(",", java.util.Collections.nCopies(values.size(), "?"));
    }

    static Timestamp ts(Instant instant) {
        return instant == null ? null : Timestamp.from(instant);
    }

    static Instant instant(Timestamp ts) {
        return ts == null ? null : ts.toInstant();
    }

    static UUID uuid(java.sql.ResultSet rs, String column) throws SQLException {
        return rs.getObject(column, UUID.class);
    }
}
