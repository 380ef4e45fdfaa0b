package io.stepflow.core.workflow.step;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/// Evaluates `expression` once and runs the case whose key equals the value's string form, or
/// `defaultSteps` when none matches.
public record SwitchStep(
        String id,
        String expression,
        Map<String, List<WorkflowStep>> cases,
        List<WorkflowStep> defaultSteps)
        implements WorkflowStep {

    public SwitchStep {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(expression, "expression must not be null");
        Map<String, List<WorkflowStep>> copied = new LinkedHashMap<>();
        if (cases != null) {
            cases.forEach((key, steps) -> copied.put(key, WorkflowStep.copy(steps)));
        }
        cases = Collections.unmodifiableMap(copied);
        defaultSteps = WorkflowStep.copy(defaultSteps);
    }

    @Override
    public StepType type() {
        return StepType.SWITCH;
    }

    @Override
    public List<WorkflowStep> children() {
        List<WorkflowStep> all = new ArrayList<>();
        cases.values().forEach(all::addAll);
        all.addAll(defaultSteps);
        return all;
    }
}
