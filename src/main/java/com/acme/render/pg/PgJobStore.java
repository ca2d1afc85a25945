package com.acme.render.pg;

import com.acme.render.spi.JobStore;
import com.acme.render.spi.RunState;
import com.acme.render.spi.VariantStatus;
import io.micronaut.data.connection.ConnectionOperations;
import jakarta.inject.Singleton;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

@Singleton
public class PgJobStore implements JobStore {
    private static final String RUN_COLUMNS =
        "id, variant_id, engine, state, request_json, response_json, retry_of, error, created_at";

    private final JdbcSupport jdbc;
    private final Clock clock;

    public PgJobStore(ConnectionOperations<Connection> connectionOps, Clock clock) {
        this.jdbc = new JdbcSupport(connectionOps);
        this.clock = clock;
    }

    @Override
    public UUID createProject(UUID userId) {
        UUID id = UUID.randomUUID();
        jdbc.update("insert into projects(id, user_id, created_at) values (?,?,?)", ps -> {
            ps.setObject(1, id);
            ps.setObject(2, userId);
            ps.setTimestamp(3, JdbcSupport.ts(clock.instant()));
        });
        return id;
    }

    @Override
    public UUID createVariant(UUID projectId) {
        UUID id = UUID.randomUUID();
        jdbc.update("insert into variants(id, project_id, status) values (?,?,?)", ps -> {
            ps.setObject(1, id);
            ps.setObject(2, projectId);
            ps.setString(3, VariantStatus.PENDING.value());
        });
        return id;
    }

    @Override
    public UUID createRun(UUID variantId, String engineClass, String requestJson, UUID retryOf) {
        UUID id = UUID.randomUUID();
        Instant now = clock.instant();
        try {
            insertRun(id, now, variantId, engineClass, requestJson, retryOf);
        } catch (RuntimeException e) {
            if (retryOf != null && JdbcSupport.isUniqueViolation(e)) {
                throw new IllegalStateException("Run " + retryOf + " has already been resubmitted", e);
            }
            throw e;
        }
        return id;
    }

    private void insertRun(UUID id, Instant now, UUID variantId, String engineClass, String requestJson, UUID retryOf) {
        jdbc.update(
            "insert into runs(id, variant_id, engine, state, request_json, retry_of, created_at, updated_at) " +
            "values (?,?,?,?,?,?,?,?)", ps -> {
                ps.setObject(1, id);
                ps.setObject(2, variantId);
                ps.setString(3, engineClass);
                ps.setString(4, RunState.QUEUED.value());
                ps.setString(5, requestJson);
                if (retryOf != null) {
                    ps.setObject(6, retryOf);
                } else {
                    ps.setNull(6, Types.OTHER);
                }
                ps.setTimestamp(7, JdbcSupport.ts(now));
                ps.setTimestamp(8, JdbcSupport.ts(now));
            });
    }

    @Override
    public Optional<RunRow> findRun(UUID id) {
        return jdbc.queryOne("select " + RUN_COLUMNS + " from runs where id=?",
            ps -> ps.setObject(1, id), PgJobStore::mapRun);
    }

    @Override
    public Optional<VariantRow> findVariant(UUID id) {
        return jdbc.queryOne("select id, project_id, status from variants where id=?",
            ps -> ps.setObject(1, id),
            rs -> new VariantRow(
                JdbcSupport.uuid(rs, "id"),
                JdbcSupport.uuid(rs, "project_id"),
                VariantStatus.fromValue(rs.getString("status"))));
    }

    @Override
    public Optional<ProjectRow> findProject(UUID id) {
        return jdbc.queryOne("select id, user_id from projects where id=?",
            ps -> ps.setObject(1, id),
            rs -> new ProjectRow(JdbcSupport.uuid(rs, "id"), JdbcSupport.uuid(rs, "user_id")));
    }

    @Override
    public List<RunRow> getElapsedJobs(Set<RunState> states, String engineClass, Instant cutoff) {
        if (states.isEmpty()) {
            return List.of();
        }
        List<RunState> ordered = new ArrayList<>(states);
        String sql = "select " + RUN_COLUMNS + " from runs where state in (" + JdbcSupport.placeholders(ordered) +
            ") and engine=? and created_at < ? order by created_at";
        return jdbc.query(sql, ps -> {
            int i = 1;
            for (RunState s : ordered) {
                ps.setString(i++, s.value());
            }
            ps.setString(i++, engineClass);
            ps.setTimestamp(i, JdbcSupport.ts(cutoff));
        }, PgJobStore::mapRun);
    }

    @Override
    public boolean markRunning(UUID id) {
        return transitionRun(id, Set.of(RunState.QUEUED), RunState.RUNNING, null, null);
    }

    @Override
    public boolean transitionRun(UUID id, Set<RunState> from, RunState to, String responseJson, String error) {
        List<RunState> ordered = new ArrayList<>(from);
        String sql = "update runs set state=?, response_json=coalesce(?, response_json), " +
            "error=coalesce(?, error), updated_at=? where id=? and state in (" + JdbcSupport.placeholders(ordered) + ")";
        return jdbc.update(sql, ps -> {
            int i = 1;
            ps.setString(i++, to.value());
            ps.setString(i++, responseJson);
            ps.setString(i++, error);
            ps.setTimestamp(i++, JdbcSupport.ts(clock.instant()));
            ps.setObject(i++, id);
            for (RunState s : ordered) {
                ps.setString(i++, s.value());
            }
        }) == 1;
    }

    @Override
    public boolean updateRunResponse(UUID id, String responseJson) {
        return jdbc.update("update runs set response_json=?, updated_at=? where id=? and state in (?,?)", ps -> {
            ps.setString(1, responseJson);
            ps.setTimestamp(2, JdbcSupport.ts(clock.instant()));
            ps.setObject(3, id);
            ps.setString(4, RunState.QUEUED.value());
            ps.setString(5, RunState.RUNNING.value());
        }) == 1;
    }

    @Override
    public void updateVariant(UUID id, VariantStatus status) {
        jdbc.update("update variants set status=? where id=?", ps -> {
            ps.setString(1, status.value());
            ps.setObject(2, id);
        });
    }

    @Override
    public int countRetries(UUID runId) {
        return jdbc.queryOne("select count(*) from runs where retry_of=?",
            ps -> ps.setObject(1, runId), rs -> rs.getInt(1)).orElse(0);
    }

    private static RunRow mapRun(ResultSet rs) throws SQLException {
        return new RunRow(
            JdbcSupport.uuid(rs, "id"),
            JdbcSupport.uuid(rs, "variant_id"),
            rs.getString("engine"),
            RunState.fromValue(rs.getString("state")),
            rs.getString("request_json"),
            rs.getString("response_json"),
            JdbcSupport.uuid(rs, "retry_of"),
            rs.getString("error"),
            JdbcSupport.instant(rs.getTimestamp("created_at"))
        );
    }
}
