package io.stepflow.core.execution.step;

import io.stepflow.core.exception.ValidationException;
import io.stepflow.core.execution.ExecutionContext;
import io.stepflow.core.util.Values;
import io.stepflow.core.workflow.step.ForEachStep;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/// Executes `for_each` steps.
///
/// Every iteration runs in a fresh fork of the enclosing scope with the item and index bound.
/// Writes made inside the body, including to variables the parent already has, stay in the
/// iteration's fork. When the step declares an output variable it receives the list of each
/// iteration's last step result.
public class ForEachStepExecutor implements StepExecutor<ForEachStep> {

    private static final Logger logger = Logger.getLogger(ForEachStepExecutor.class.getName());

    @Override
    public Class<ForEachStep> getStepType() {
        return ForEachStep.class;
    }

    @Override
    public Object execute(ForEachStep step, StepExecution execution) throws Exception {
        StepRuntime runtime = execution.getRuntime();
        ExecutionContext context = execution.getContext();
        Object collection = runtime.templates().evaluate(step.items(), context.getVariables());
        if (collection == null) {
            execution.recordInputs(Map.of("count", 0));
            return new ArrayList<>();
        }
        List<Object> items = Values.asList(collection);
        if (items == null) {
            throw new ValidationException(
                    "for_each '"
                            + step.id()
                            + "': '"
                            + step.items()
                            + "' must resolve to an array, got "
                            + collection.getClass().getSimpleName());
        }
        execution.recordInputs(Map.of("count", items.size()));
        logger.fine("Iterating " + items.size() + " items in step '" + step.id() + "'");

        List<Object> results = new ArrayList<>(items.size());
        for (int i = 0; i < items.size(); i++) {
            context.checkCancelled();
            Map<String, Object> bindings = new LinkedHashMap<>();
            bindings.put(step.itemVariable(), items.get(i));
            bindings.put(step.indexVariable(), i);
            results.add(runtime.executeSteps(step.steps(), context.fork(bindings)));
        }
        return results;
    }
}
