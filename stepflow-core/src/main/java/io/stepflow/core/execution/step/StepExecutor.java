package io.stepflow.core.execution.step;

import io.stepflow.core.workflow.step.WorkflowStep;

/// Strategy interface for executing one kind of workflow step.
///
/// Each {@link WorkflowStep} variant has a matching executor. Executors are stateless; the
/// per-occurrence state lives in the {@link StepExecution} and services come from its
/// {@link StepRuntime}. Control-flow executors run nested step lists through
/// {@link StepRuntime#executeSteps}, so nesting composes to any depth.
///
/// ### Example implementation
/// {@snippet :
/// public class NoopStepExecutor implements StepExecutor<MyStep> {
///     public Class<MyStep> getStepType() {
///         return MyStep.class;
///     }
///
///     public Object execute(MyStep step, StepExecution execution) {
///         return null;
///     }
/// }
/// }
///
/// @param <T> the step type this executor handles
public interface StepExecutor<T extends WorkflowStep> {

    /// Returns the step type this executor handles. Used for registry lookups.
    Class<T> getStepType();

    /// Executes one occurrence of the step.
    ///
    /// The engine writes the step's checkpoints around this call; executors only report
    /// skips, retries and absorbed failures through the execution handle.
    ///
    /// @param step the step to execute, not null
    /// @param execution per-occurrence handle with scope and services, not null
    /// @return the step's result, stored under its output variable if it has one; may be null
    /// @throws Exception if the step fails
    Object execute(T step, StepExecution execution) throws Exception;
}
