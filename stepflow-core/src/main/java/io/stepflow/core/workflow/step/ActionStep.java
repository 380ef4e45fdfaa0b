package io.stepflow.core.workflow.step;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/// Invokes one action: a `core.*`, `workflow.*`, `parallel.*` or `event.*` built-in, or
/// `<tool>.<method>` on an external tool.
///
/// @param id step id, not null
/// @param name display name for checkpoints, may be null
/// @param action action name, not null
/// @param inputs unevaluated template inputs, never null
/// @param outputVariable variable receiving the result, may be null
/// @param conditions expressions that must all be truthy for the step to run, never null
/// @param errorPolicy retry and continue-on-error settings, never null
/// @param timeoutMs step deadline in milliseconds, may be null
public record ActionStep(
        String id,
        String name,
        String action,
        Map<String, Object> inputs,
        String outputVariable,
        List<String> conditions,
        StepErrorPolicy errorPolicy,
        Long timeoutMs)
        implements WorkflowStep {

    public ActionStep {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(action, "action must not be null");
        inputs =
                inputs != null
                        ? Collections.unmodifiableMap(new LinkedHashMap<>(inputs))
                        : Map.of();
        conditions = conditions != null ? List.copyOf(conditions) : List.of();
        errorPolicy = errorPolicy != null ? errorPolicy : StepErrorPolicy.NONE;
    }

    /// Creates a step with only an action and inputs.
    public static ActionStep of(String id, String action, Map<String, Object> inputs) {
        return new ActionStep(id, null, action, inputs, null, null, null, null);
    }

    /// Creates a step whose result is stored in `outputVariable`.
    public static ActionStep of(
            String id, String action, Map<String, Object> inputs, String outputVariable) {
        return new ActionStep(id, null, action, inputs, outputVariable, null, null, null);
    }

    public static Builder builder(String id, String action) {
        return new Builder(id, action);
    }

    @Override
    public StepType type() {
        return StepType.ACTION;
    }

    @Override
    public String displayName() {
        return name != null ? name : id;
    }

    public static final class Builder {
        private final String id;
        private final String action;
        private String name;
        private Map<String, Object> inputs = Map.of();
        private String outputVariable;
        private List<String> conditions = List.of();
        private StepErrorPolicy errorPolicy = StepErrorPolicy.NONE;
        private Long timeoutMs;

        private Builder(String id, String action) {
            this.id = id;
            this.action = action;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder inputs(Map<String, Object> inputs) {
            this.inputs = inputs;
            return this;
        }

        public Builder outputVariable(String outputVariable) {
            this.outputVariable = outputVariable;
            return this;
        }

        public Builder conditions(List<String> conditions) {
            this.conditions = conditions;
            return this;
        }

        public Builder errorPolicy(StepErrorPolicy errorPolicy) {
            this.errorPolicy = errorPolicy;
            return this;
        }

        public Builder timeoutMs(Long timeoutMs) {
            this.timeoutMs = timeoutMs;
            return this;
        }

        public ActionStep build() {
            return new ActionStep(
                    id, name, action, inputs, outputVariable, conditions, errorPolicy, timeoutMs);
        }
    }
}
