package io.stepflow.core.execution.step;

import io.stepflow.core.execution.ExecutionContext;
import io.stepflow.core.execution.action.Action;
import io.stepflow.core.util.Values;
import io.stepflow.core.workflow.step.ParallelStep;
import java.util.Map;

/// Executes `parallel` steps by running the matching `parallel.spawn` or `parallel.map`
/// operation with the step's spec as its inputs.
public class ParallelStepExecutor implements StepExecutor<ParallelStep> {

    @Override
    public Class<ParallelStep> getStepType() {
        return ParallelStep.class;
    }

    @Override
    public Object execute(ParallelStep step, StepExecution execution) {
        StepRuntime runtime = execution.getRuntime();
        ExecutionContext context = execution.getContext();
        Action action = new Action.ParallelOperation(step.mode().wireName());
        Map<String, Object> inputs =
                Values.asMap(runtime.templates().resolve(step.spec(), context.getVariables()));
        Map<String, Object> resolved = inputs != null ? inputs : Map.of();
        execution.recordInputs(resolved);
        return runtime.invoke(action, resolved, step.spec(), context);
    }
}
