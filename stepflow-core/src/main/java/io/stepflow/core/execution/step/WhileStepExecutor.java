package io.stepflow.core.execution.step;

import io.stepflow.core.exception.WorkflowFatalException;
import io.stepflow.core.execution.ExecutionContext;
import io.stepflow.core.util.Values;
import io.stepflow.core.workflow.step.WhileStep;
import java.util.Map;

/// Executes `while` steps.
///
/// The body runs in the enclosing scope so it can update the variables its condition reads.
/// Needing more iterations than the cap is fatal to the run.
public class WhileStepExecutor implements StepExecutor<WhileStep> {

    @Override
    public Class<WhileStep> getStepType() {
        return WhileStep.class;
    }

    @Override
    public Object execute(WhileStep step, StepExecution execution) throws Exception {
        StepRuntime runtime = execution.getRuntime();
        ExecutionContext context = execution.getContext();
        int maxIterations =
                step.maxIterations() != null
                        ? step.maxIterations()
                        : runtime.defaultMaxIterations();

        int iterations = 0;
        Object last = null;
        while (Values.isTruthy(
                runtime.templates().evaluate(step.condition(), context.getVariables()))) {
            if (iterations >= maxIterations) {
                throw new WorkflowFatalException(
                        "while '"
                                + step.id()
                                + "' exceeded maxIterations ("
                                + maxIterations
                                + ")");
            }
            context.checkCancelled();
            last = runtime.executeSteps(step.steps(), context);
            iterations++;
        }
        execution.recordInputs(Map.of("iterations", iterations));
        return last;
    }
}
