package io.stepflow.core.execution.parallel;

import io.stepflow.core.execution.ExecutionContext;

/// Runs one task inside its own scope.
@FunctionalInterface
public interface TaskRunner {

    /// @param task the task, not null
    /// @param scope forked context with the task's bindings applied, not null
    /// @return the task's value, may be null
    /// @throws Exception any failure, recorded as the task's {@link TaskOutcome.Failure}
    Object run(ParallelTask task, ExecutionContext scope) throws Exception;
}
