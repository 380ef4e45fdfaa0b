package io.stepflow.core.execution.step;

import io.stepflow.core.workflow.step.WorkflowStep;
import java.util.Optional;

/// Registry for step executors, keyed by step class.
///
/// ### Example usage
/// {@snippet :
/// StepExecutor<IfStep> executor = registry.getExecutorOrThrow(IfStep.class);
/// registry.register(new MyCustomActionStepExecutor());
/// }
public interface StepExecutorRegistry {

    /// Gets the executor for a step type.
    ///
    /// @param stepType the step class
    /// @param <T> the step type
    /// @return the executor, empty if none is registered
    <T extends WorkflowStep> Optional<StepExecutor<T>> getExecutor(Class<T> stepType);

    /// Gets the executor for a step type, throwing if none is registered.
    ///
    /// @throws IllegalStateException if no executor is registered
    <T extends WorkflowStep> StepExecutor<T> getExecutorOrThrow(Class<T> stepType);

    /// Gets the executor for a step instance.
    ///
    /// @throws IllegalStateException if no executor is registered
    default <T extends WorkflowStep> StepExecutor<T> getExecutorFor(T step) {
        return (StepExecutor<T>) getExecutorOrThrow(step.getClass());
    }

    /// Registers or replaces the executor for {@link StepExecutor#getStepType()}.
    <T extends WorkflowStep> void register(StepExecutor<T> executor);

    boolean hasExecutor(Class<? extends WorkflowStep> stepType);
}
