package io.stepflow.core.execution.parallel;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/// One unit of work of a fan-out.
///
/// @param id task id, unique within its request, not null
/// @param action action name to run, not null
/// @param inputs unresolved inputs, resolved against the task's own scope, not null
/// @param bindings extra variables bound in the task's scope, not null
public record ParallelTask(
        String id, String action, Map<String, Object> inputs, Map<String, Object> bindings) {

    public ParallelTask {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(action, "action must not be null");
        inputs =
                inputs != null
                        ? Collections.unmodifiableMap(new LinkedHashMap<>(inputs))
                        : Map.of();
        bindings =
                bindings != null
                        ? Collections.unmodifiableMap(new LinkedHashMap<>(bindings))
                        : Map.of();
    }

    public ParallelTask(String id, String action, Map<String, Object> inputs) {
        this(id, action, inputs, Map.of());
    }
}
