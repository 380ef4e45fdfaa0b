package io.stepflow.core.checkpoint;

import io.stepflow.core.execution.ExecutionStatus;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/// Run-level audit record, created when a run starts and rewritten when it ends.
///
/// @param runId run identifier, not null
/// @param workflowId executed workflow, not null
/// @param status run status, not null
/// @param startedAt start time, not null
/// @param completedAt end time, null while running
/// @param inputs effective run inputs, never null
/// @param outputs published outputs, may be null
/// @param error failure message, may be null
/// @param totalSteps step occurrences executed so far
public record ExecutionRecord(
        String runId,
        String workflowId,
        ExecutionStatus status,
        Instant startedAt,
        Instant completedAt,
        Map<String, Object> inputs,
        Map<String, Object> outputs,
        String error,
        int totalSteps) {

    public ExecutionRecord {
        Objects.requireNonNull(runId, "runId must not be null");
        Objects.requireNonNull(workflowId, "workflowId must not be null");
        Objects.requireNonNull(status, "status must not be null");
        Objects.requireNonNull(startedAt, "startedAt must not be null");
        inputs = inputs != null ? copy(inputs) : Map.of();
        outputs = outputs != null ? copy(outputs) : null;
    }

    public static ExecutionRecord started(
            String runId, String workflowId, Map<String, Object> inputs, Instant startedAt) {
        return new ExecutionRecord(
                runId, workflowId, ExecutionStatus.RUNNING, startedAt, null, inputs, null, null, 0);
    }

    public ExecutionRecord finished(
            ExecutionStatus finalStatus,
            Map<String, Object> finalOutputs,
            String finalError,
            int steps,
            Instant at) {
        return new ExecutionRecord(
                runId,
                workflowId,
                finalStatus,
                startedAt,
                at,
                inputs,
                finalOutputs,
                finalError,
                steps);
    }

    private static Map<String, Object> copy(Map<String, Object> map) {
        return Collections.unmodifiableMap(new LinkedHashMap<>(map));
    }
}
