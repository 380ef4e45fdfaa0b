package io.stepflow.core.workflow.step;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/// Runs `trySteps`; on failure binds `error` and runs `catchSteps`. `finallySteps` always run.
public record TryStep(
        String id,
        List<WorkflowStep> trySteps,
        List<WorkflowStep> catchSteps,
        List<WorkflowStep> finallySteps)
        implements WorkflowStep {

    public TryStep {
        Objects.requireNonNull(id, "id must not be null");
        trySteps = WorkflowStep.copy(trySteps);
        catchSteps = WorkflowStep.copy(catchSteps);
        finallySteps = WorkflowStep.copy(finallySteps);
    }

    @Override
    public StepType type() {
        return StepType.TRY;
    }

    @Override
    public List<WorkflowStep> children() {
        List<WorkflowStep> all = new ArrayList<>(trySteps);
        all.addAll(catchSteps);
        all.addAll(finallySteps);
        return all;
    }
}
