package io.stepflow.core.execution.step;

import io.stepflow.core.execution.ExecutionContext;
import io.stepflow.core.execution.action.Action;
import io.stepflow.core.reliability.BackoffPolicy;
import io.stepflow.core.template.TemplateResolver;
import io.stepflow.core.workflow.step.WorkflowStep;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;

/// Engine services available to step executors.
public interface StepRuntime {

    TemplateResolver templates();

    /// Runs a classified action with already resolved inputs.
    ///
    /// @param action classified action, not null
    /// @param inputs inputs resolved against `context`, not null
    /// @param rawInputs the same inputs as written in the workflow, not null
    /// @param context scope the action runs in, not null
    /// @return the action's result, may be null
    Object invoke(
            Action action,
            Map<String, Object> inputs,
            Map<String, Object> rawInputs,
            ExecutionContext context);

    /// Resolves, classifies and runs an action outside of any step.
    Object dispatch(String actionName, Map<String, Object> rawInputs, ExecutionContext context);

    /// Executes steps in order within `context`, each with its own checkpoints.
    ///
    /// @return the result of the last executed step, may be null
    /// @throws Exception the first failure, after its checkpoint was written
    Object executeSteps(List<WorkflowStep> steps, ExecutionContext context) throws Exception;

    /// Iteration cap of `while` steps that declare none.
    int defaultMaxIterations();

    /// Delays between step-level retries.
    BackoffPolicy retryBackoff();

    /// Executor for steps with a timeout; the engine thread waits on it.
    ExecutorService stepExecutor();

    Clock clock();
}
