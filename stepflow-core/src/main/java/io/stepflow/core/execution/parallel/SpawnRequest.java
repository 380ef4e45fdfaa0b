package io.stepflow.core.execution.parallel;

import java.util.List;
import java.util.Objects;

/// Input of {@link ParallelExecutor#spawn}.
///
/// @param tasks tasks to run, not null; an empty list is rejected by the executor
/// @param waitPolicy when to stop waiting, defaults to {@link WaitPolicy#ALL}
/// @param timeoutMs overall timeout in ms, null for none
/// @param onError failure policy, defaults to {@link FailurePolicy#CONTINUE}
/// @param concurrency maximum tasks in flight, null for all at once
/// @param taskTimeoutMs timeout of each individual task in ms, null for none
public record SpawnRequest(
        List<ParallelTask> tasks,
        WaitPolicy waitPolicy,
        Long timeoutMs,
        FailurePolicy onError,
        Integer concurrency,
        Long taskTimeoutMs) {

    public SpawnRequest {
        Objects.requireNonNull(tasks, "tasks must not be null");
        tasks = List.copyOf(tasks);
        waitPolicy = waitPolicy != null ? waitPolicy : WaitPolicy.ALL;
        onError = onError != null ? onError : FailurePolicy.CONTINUE;
    }

    public static SpawnRequest of(List<ParallelTask> tasks, WaitPolicy waitPolicy) {
        return new SpawnRequest(tasks, waitPolicy, null, null, null, null);
    }
}
