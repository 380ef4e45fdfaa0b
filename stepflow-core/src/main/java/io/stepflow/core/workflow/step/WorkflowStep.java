package io.stepflow.core.workflow.step;

import java.util.List;

/// A node in a workflow's step tree.
///
/// ### Step Types
/// - {@link ActionStep} - invoke a built-in operation or an external tool
/// - {@link IfStep} - conditional branch
/// - {@link ForEachStep} - iterate a collection in a scoped copy of the variables
/// - {@link WhileStep} - bounded loop in the run's own scope
/// - {@link SwitchStep} - multi-way branch on a value's string form
/// - {@link TryStep} - error handling with catch and finally blocks
/// - {@link ParallelStep} - `spawn` or `map` fan-out
///
/// @implNote All implementations are immutable records.
public sealed interface WorkflowStep
        permits ActionStep, IfStep, ForEachStep, WhileStep, SwitchStep, TryStep, ParallelStep {

    /// Returns the step id, unique within its workflow.
    String id();

    /// Returns the discriminator used for executor lookup.
    StepType type();

    /// Returns the name recorded in checkpoints. Defaults to the id.
    default String displayName() {
        return id();
    }

    /// Returns every directly nested step, in declaration order.
    default List<WorkflowStep> children() {
        return List.of();
    }

    /// Copies a nested step list, treating null as empty.
    static List<WorkflowStep> copy(List<WorkflowStep> steps) {
        return steps != null ? List.copyOf(steps) : List.of();
    }
}
