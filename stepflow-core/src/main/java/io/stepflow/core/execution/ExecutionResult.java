package io.stepflow.core.execution;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/// Outcome of one workflow run.
///
/// @param runId run identifier, not null
/// @param status terminal status, not null
/// @param outputs published outputs, never null
/// @param duration wall-clock run time, not null
/// @param error final failure message, null unless the run failed or was cancelled
/// @param variables snapshot of the run's variables at completion, never null
public record ExecutionResult(
        String runId,
        ExecutionStatus status,
        Map<String, Object> outputs,
        Duration duration,
        String error,
        Map<String, Object> variables) {

    public ExecutionResult {
        Objects.requireNonNull(runId, "runId must not be null");
        Objects.requireNonNull(status, "status must not be null");
        Objects.requireNonNull(duration, "duration must not be null");
        outputs = copy(outputs);
        variables = copy(variables);
    }

    public boolean isSuccess() {
        return status == ExecutionStatus.COMPLETED;
    }

    private static Map<String, Object> copy(Map<String, Object> map) {
        return map != null ? Collections.unmodifiableMap(new LinkedHashMap<>(map)) : Map.of();
    }
}
