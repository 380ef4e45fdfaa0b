package io.stepflow.core.execution.step;

import io.stepflow.core.util.Values;
import io.stepflow.core.workflow.step.SwitchStep;
import io.stepflow.core.workflow.step.WorkflowStep;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/// Executes `switch` steps. The expression is evaluated once and its string form is compared
/// with the case keys; no match and no default runs nothing.
public class SwitchStepExecutor implements StepExecutor<SwitchStep> {

    @Override
    public Class<SwitchStep> getStepType() {
        return SwitchStep.class;
    }

    @Override
    public Object execute(SwitchStep step, StepExecution execution) throws Exception {
        StepRuntime runtime = execution.getRuntime();
        Object value =
                runtime.templates()
                        .evaluate(step.expression(), execution.getContext().getVariables());
        String key = Values.stringify(value);
        List<WorkflowStep> branch = step.cases().get(key);
        String matched = key;
        if (branch == null) {
            branch = step.defaultSteps();
            matched = "default";
        }
        Map<String, Object> recorded = new LinkedHashMap<>();
        recorded.put("value", value);
        recorded.put("case", matched);
        execution.recordInputs(recorded);
        return runtime.executeSteps(branch, execution.getContext());
    }
}
