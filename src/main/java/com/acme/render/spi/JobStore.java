package com.acme.render.spi;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Persisted render jobs and their owning variants and projects.
 */
public interface JobStore {
    UUID createProject(UUID userId);
    UUID createVariant(UUID projectId);

    /**
     * Inserts a queued run. A run can be the {@code retryOf} target of at most one other run.
     *
     * @throws IllegalStateException if {@code retryOf} already has a retry
     */
    UUID createRun(UUID variantId, String engineClass, String requestJson, UUID retryOf);

    Optional<RunRow> findRun(UUID id);
    Optional<VariantRow> findVariant(UUID id);
    Optional<ProjectRow> findProject(UUID id);

    /**
     * Runs of one engine class still in one of {@code states} and created before {@code cutoff}.
     */
    List<RunRow> getElapsedJobs(Set<RunState> states, String engineClass, Instant cutoff);

    /**
     * queued -> running; false if the run has already moved on.
     */
    boolean markRunning(UUID id);

    /**
     * Moves the run to {@code to} only while it is still in one of {@code from}. Null
     * {@code responseJson} or {@code error} leave the stored values untouched.
     *
     * @return true if this call changed the row, false if another writer got there first
     */
    boolean transitionRun(UUID id, Set<RunState> from, RunState to, String responseJson, String error);

    /**
     * Replaces the response payload of a run that has not reached a terminal state.
     */
    boolean updateRunResponse(UUID id, String responseJson);

    void updateVariant(UUID id, VariantStatus status);

    int countRetries(UUID runId);

    record RunRow(
        UUID id,
        UUID variantId,
        String engineClass,
        RunState state,
        String requestJson,
        String responseJson,
        UUID retryOf,
        String error,
        Instant createdAt
    ) {}

    record VariantRow(UUID id, UUID projectId, VariantStatus status) {}

    record ProjectRow(UUID id, UUID userId) {}
}
