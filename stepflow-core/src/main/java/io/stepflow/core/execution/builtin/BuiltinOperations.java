package io.stepflow.core.execution.builtin;

import io.stepflow.core.event.EventSourceManager;
import io.stepflow.core.execution.parallel.ParallelExecutor;
import io.stepflow.core.execution.parallel.ParallelOperations;
import java.time.Clock;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/// Registry of built-in operations keyed by full action name, for example `core.set`.
///
/// ### Usage
/// {@snippet :
/// BuiltinOperations builtins = BuiltinOperations.standard(clock, events, parallel, 5);
/// builtins.register("core.uuid", op -> UUID.randomUUID().toString());
/// }
public final class BuiltinOperations {

    /// Marker key of a result whose value the engine merges into the run's outputs.
    public static final String WORKFLOW_OUTPUTS_KEY = "__workflow_outputs__";

    private final Map<String, BuiltinOperation> operations = new ConcurrentHashMap<>();

    public BuiltinOperations() {}

    /// Creates a registry with every standard operation registered.
    ///
    /// @param clock clock for time-based operations, not null
    /// @param events event-source manager for `event.*`, not null
    /// @param parallel fan-out executor for `parallel.*`, not null
    /// @param defaultMapConcurrency concurrency of `parallel.map` when the step sets none
    /// @return populated registry, never null
    public static BuiltinOperations standard(
            Clock clock,
            EventSourceManager events,
            ParallelExecutor parallel,
            int defaultMapConcurrency) {
        BuiltinOperations builtins = new BuiltinOperations();
        CoreOperations.registerAll(builtins, clock);
        CodecOperations.registerAll(builtins, clock);
        WorkflowOperations.registerAll(builtins, clock);
        EventOperations.registerAll(builtins, events);
        ParallelOperations.registerAll(builtins, parallel, defaultMapConcurrency);
        return builtins;
    }

    /// Registers or replaces an operation.
    ///
    /// @param actionName full action name, not null
    /// @param operation implementation, not null
    /// @return this registry
    public BuiltinOperations register(String actionName, BuiltinOperation operation) {
        Objects.requireNonNull(actionName, "actionName must not be null");
        Objects.requireNonNull(operation, "operation must not be null");
        operations.put(actionName, operation);
        return this;
    }

    public Optional<BuiltinOperation> get(String actionName) {
        return Optional.ofNullable(operations.get(actionName));
    }

    public boolean contains(String actionName) {
        return operations.containsKey(actionName);
    }

    public Set<String> names() {
        return new TreeSet<>(operations.keySet());
    }
}
