package io.stepflow.core.workflow;

import java.util.Objects;

/// Declared workflow input.
///
/// @param name input name, not null
/// @param type informational type name (string, number, boolean, object, array), may be null
/// @param required whether a caller must supply it when there is no default
/// @param defaultValue value applied when the caller omits the input, may be null
/// @param description human-readable description, may be null
public record WorkflowInput(
        String name, String type, boolean required, Object defaultValue, String description) {

    public WorkflowInput {
        Objects.requireNonNull(name, "name must not be null");
    }

    public static WorkflowInput required(String name, String type) {
        return new WorkflowInput(name, type, true, null, null);
    }

    public static WorkflowInput optional(String name, String type, Object defaultValue) {
        return new WorkflowInput(name, type, false, defaultValue, null);
    }
}
