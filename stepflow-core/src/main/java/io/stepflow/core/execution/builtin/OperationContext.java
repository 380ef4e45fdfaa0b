package io.stepflow.core.execution.builtin;

import io.stepflow.core.execution.ExecutionContext;
import io.stepflow.core.template.TemplateResolver;
import java.util.Map;
import java.util.Objects;

/// Everything a built-in operation receives.
///
/// Most operations read only the resolved {@link #inputs()}. Operations that evaluate a
/// template once per item, such as `core.transform` and `parallel.map`, read the unresolved
/// {@link #rawInputs()} instead.
///
/// @param actionName full action name, not null
/// @param inputs inputs resolved against the current variables, not null
/// @param rawInputs inputs as written in the workflow, not null
/// @param context scope the operation runs in, not null
/// @param templates template resolver of the engine, not null
/// @param dispatcher entry point for nested action calls, not null
public record OperationContext(
        String actionName,
        Map<String, Object> inputs,
        Map<String, Object> rawInputs,
        ExecutionContext context,
        TemplateResolver templates,
        ActionDispatcher dispatcher) {

    public OperationContext {
        Objects.requireNonNull(actionName, "actionName must not be null");
        Objects.requireNonNull(inputs, "inputs must not be null");
        Objects.requireNonNull(rawInputs, "rawInputs must not be null");
        Objects.requireNonNull(context, "context must not be null");
        Objects.requireNonNull(templates, "templates must not be null");
        Objects.requireNonNull(dispatcher, "dispatcher must not be null");
    }

    public Object input(String name) {
        return inputs.get(name);
    }

    public Object input(String name, Object defaultValue) {
        Object value = inputs.get(name);
        return value != null ? value : defaultValue;
    }
}
