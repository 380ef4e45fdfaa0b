package io.stepflow.core.workflow.step;

import java.util.List;
import java.util.Objects;

/// Runs `steps` once per element of the collection `items` evaluates to.
///
/// Each iteration runs in a copy of the variables with the element bound to `itemVariable` and
/// its position to `indexVariable`. Nothing written inside an iteration leaks out; when
/// `outputVariable` is set it receives the list of each iteration's last step result.
///
/// @param id step id, not null
/// @param items expression yielding a list, not null
/// @param itemVariable element binding name, default `item`
/// @param indexVariable index binding name, default `itemIndex`
/// @param steps loop body, never null
/// @param outputVariable variable receiving per-iteration results, may be null
public record ForEachStep(
        String id,
        String items,
        String itemVariable,
        String indexVariable,
        List<WorkflowStep> steps,
        String outputVariable)
        implements WorkflowStep {

    public static final String DEFAULT_ITEM_VARIABLE = "item";
    public static final String DEFAULT_INDEX_VARIABLE = "itemIndex";

    public ForEachStep {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(items, "items must not be null");
        itemVariable = itemVariable != null ? itemVariable : DEFAULT_ITEM_VARIABLE;
        indexVariable = indexVariable != null ? indexVariable : DEFAULT_INDEX_VARIABLE;
        steps = WorkflowStep.copy(steps);
    }

    public static ForEachStep of(String id, String items, List<WorkflowStep> steps) {
        return new ForEachStep(id, items, null, null, steps, null);
    }

    @Override
    public StepType type() {
        return StepType.FOR_EACH;
    }

    @Override
    public List<WorkflowStep> children() {
        return steps;
    }
}
