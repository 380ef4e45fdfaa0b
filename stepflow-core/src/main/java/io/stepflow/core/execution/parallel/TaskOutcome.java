package io.stepflow.core.execution.parallel;

import java.time.Instant;
import java.util.Objects;

/// Settled result of a single {@link ParallelTask}.
///
/// Exactly one outcome is ever recorded per task.
public sealed interface TaskOutcome {

    String taskId();

    Instant startedAt();

    Instant completedAt();

    default boolean isSuccess() {
        return this instanceof Success;
    }

    /// @param taskId id of the task, not null
    /// @param value value the task returned, may be null
    /// @param startedAt when the task was launched, null if it never started
    /// @param completedAt when the outcome was recorded, not null
    record Success(String taskId, Object value, Instant startedAt, Instant completedAt)
            implements TaskOutcome {
        public Success {
            Objects.requireNonNull(taskId, "taskId must not be null");
            Objects.requireNonNull(completedAt, "completedAt must not be null");
        }
    }

    /// @param taskId id of the task, not null
    /// @param error failure message, not null
    /// @param cause underlying exception, may be null
    /// @param startedAt when the task was launched, null if it never started
    /// @param completedAt when the outcome was recorded, not null
    record Failure(
            String taskId, String error, Throwable cause, Instant startedAt, Instant completedAt)
            implements TaskOutcome {
        public Failure {
            Objects.requireNonNull(taskId, "taskId must not be null");
            Objects.requireNonNull(error, "error must not be null");
            Objects.requireNonNull(completedAt, "completedAt must not be null");
        }
    }
}
