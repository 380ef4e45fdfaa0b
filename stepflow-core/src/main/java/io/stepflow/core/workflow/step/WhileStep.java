package io.stepflow.core.workflow.step;

import java.util.List;
import java.util.Objects;

/// Repeats `steps` while `condition` is truthy, in the run's own variable scope.
///
/// Exceeding `maxIterations` aborts the run; a null limit means the engine default.
public record WhileStep(
        String id, String condition, List<WorkflowStep> steps, Integer maxIterations)
        implements WorkflowStep {

    public WhileStep {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(condition, "condition must not be null");
        steps = WorkflowStep.copy(steps);
        if (maxIterations != null && maxIterations <= 0) {
            throw new IllegalArgumentException("maxIterations must be positive");
        }
    }

    @Override
    public StepType type() {
        return StepType.WHILE;
    }

    @Override
    public List<WorkflowStep> children() {
        return steps;
    }
}
