package io.stepflow.core.execution;

import io.stepflow.core.checkpoint.Checkpoint;
import io.stepflow.core.workflow.Workflow;
import io.stepflow.core.workflow.step.WorkflowStep;

/// Listener for workflow run lifecycle events.
///
/// All methods have default no-op implementations, so listeners override only the events they
/// care about.
///
/// ### Callback Lifecycle
/// ```
/// onRunStart(workflow, context)
///   onCheckpoint(pending)           checkpoint written before the step runs
///   onStepStart(step, context)
///   ... nested steps repeat the same sequence ...
///   onCheckpoint(finalized)         completed, failed or skipped
///   onStepComplete(step, finalized)
/// onRunComplete(result)
/// ```
///
/// @implNote Callbacks arrive on the thread driving the run. Steps invoked inside parallel
/// tasks do not produce step callbacks.
///
/// @see WorkflowEngine#execute(Workflow, java.util.Map, ExecutionListener)
public interface ExecutionListener {

    /// Called once the run's inputs are validated and before the first step.
    ///
    /// @param workflow workflow being executed, not null
    /// @param context run context, not null
    default void onRunStart(Workflow workflow, ExecutionContext context) {}

    /// Called when a step occurrence starts.
    ///
    /// @param step the step about to run, not null
    /// @param context scope the step runs in, not null
    default void onStepStart(WorkflowStep step, ExecutionContext context) {}

    /// Called when a step occurrence finished, successfully or not.
    ///
    /// @param step the step that ran, not null
    /// @param checkpoint the finalized checkpoint, not null
    default void onStepComplete(WorkflowStep step, Checkpoint checkpoint) {}

    /// Called after every checkpoint write.
    ///
    /// @param checkpoint the stored checkpoint, not null
    default void onCheckpoint(Checkpoint checkpoint) {}

    /// Called once the run reached a terminal status.
    ///
    /// @param result run result, not null
    default void onRunComplete(ExecutionResult result) {}

    /// No-op listener instance that ignores all events.
    ExecutionListener NOOP = new ExecutionListener() {};
}
