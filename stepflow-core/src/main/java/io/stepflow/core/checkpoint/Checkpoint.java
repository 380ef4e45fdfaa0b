package io.stepflow.core.checkpoint;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/// Audit record of one executed step occurrence.
///
/// A checkpoint is written `pending` before the step runs and rewritten with its final status
/// afterwards. `(runId, stepIndex)` identifies it; `stepIndex` counts step occurrences within
/// the run, so loop iterations each get their own checkpoint.
///
/// @param runId owning run, not null
/// @param stepIndex occurrence counter within the run, zero-based
/// @param stepId step id, not null
/// @param stepName display name, not null
/// @param status lifecycle status, not null
/// @param inputs resolved inputs, never null
/// @param outputs step result, may be null
/// @param error failure message, may be null
/// @param retryCount retries used before the final outcome
/// @param startedAt when the step began, not null
/// @param completedAt when the step finished, null while pending
public record Checkpoint(
        String runId,
        int stepIndex,
        String stepId,
        String stepName,
        CheckpointStatus status,
        Map<String, Object> inputs,
        Object outputs,
        String error,
        int retryCount,
        Instant startedAt,
        Instant completedAt) {

    public Checkpoint {
        Objects.requireNonNull(runId, "runId must not be null");
        Objects.requireNonNull(stepId, "stepId must not be null");
        Objects.requireNonNull(stepName, "stepName must not be null");
        Objects.requireNonNull(status, "status must not be null");
        Objects.requireNonNull(startedAt, "startedAt must not be null");
        inputs =
                inputs != null
                        ? Collections.unmodifiableMap(new LinkedHashMap<>(inputs))
                        : Map.of();
    }

    /// Creates the `pending` checkpoint written before a step runs.
    public static Checkpoint pending(
            String runId,
            int stepIndex,
            String stepId,
            String stepName,
            Map<String, Object> inputs,
            Instant startedAt) {
        return new Checkpoint(
                runId,
                stepIndex,
                stepId,
                stepName,
                CheckpointStatus.PENDING,
                inputs,
                null,
                null,
                0,
                startedAt,
                null);
    }

    public Checkpoint completed(Object result, int retries, Instant at) {
        return finish(CheckpointStatus.COMPLETED, result, null, retries, at);
    }

    public Checkpoint failed(String message, int retries, Instant at) {
        return finish(CheckpointStatus.FAILED, null, message, retries, at);
    }

    public Checkpoint skipped(Instant at) {
        return finish(CheckpointStatus.SKIPPED, null, null, 0, at);
    }

    /// Returns a copy with the resolved inputs filled in.
    public Checkpoint withInputs(Map<String, Object> resolvedInputs) {
        return new Checkpoint(
                runId,
                stepIndex,
                stepId,
                stepName,
                status,
                resolvedInputs,
                outputs,
                error,
                retryCount,
                startedAt,
                completedAt);
    }

    private Checkpoint finish(
            CheckpointStatus newStatus, Object result, String message, int retries, Instant at) {
        return new Checkpoint(
                runId,
                stepIndex,
                stepId,
                stepName,
                newStatus,
                inputs,
                result,
                message,
                retries,
                startedAt,
                at);
    }
}
