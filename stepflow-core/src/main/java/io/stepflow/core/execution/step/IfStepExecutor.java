package io.stepflow.core.execution.step;

import io.stepflow.core.util.Values;
import io.stepflow.core.workflow.step.IfStep;
import java.util.Map;

/// Executes `if` steps. Both branches run in the enclosing scope.
public class IfStepExecutor implements StepExecutor<IfStep> {

    @Override
    public Class<IfStep> getStepType() {
        return IfStep.class;
    }

    @Override
    public Object execute(IfStep step, StepExecution execution) throws Exception {
        StepRuntime runtime = execution.getRuntime();
        Object value =
                runtime.templates()
                        .evaluate(step.condition(), execution.getContext().getVariables());
        boolean branch = Values.isTruthy(value);
        execution.recordInputs(Map.of("condition", branch));
        return runtime.executeSteps(
                branch ? step.thenSteps() : step.elseSteps(), execution.getContext());
    }
}
