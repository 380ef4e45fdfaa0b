package io.stepflow.core.workflow.step;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/// Runs `thenSteps` when `condition` is truthy, `elseSteps` otherwise.
public record IfStep(
        String id, String condition, List<WorkflowStep> thenSteps, List<WorkflowStep> elseSteps)
        implements WorkflowStep {

    public IfStep {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(condition, "condition must not be null");
        thenSteps = WorkflowStep.copy(thenSteps);
        elseSteps = WorkflowStep.copy(elseSteps);
    }

    @Override
    public StepType type() {
        return StepType.IF;
    }

    @Override
    public List<WorkflowStep> children() {
        List<WorkflowStep> all = new ArrayList<>(thenSteps);
        all.addAll(elseSteps);
        return all;
    }
}
