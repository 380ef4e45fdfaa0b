package io.stepflow.core.execution.parallel;

import io.stepflow.core.exception.ValidationException;
import io.stepflow.core.execution.builtin.BuiltinOperations;
import io.stepflow.core.execution.builtin.OperationContext;
import io.stepflow.core.util.Durations;
import io.stepflow.core.util.Values;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/// The `parallel.spawn` and `parallel.map` operations.
///
/// Task descriptors are read from the unresolved inputs, so each task's inputs are resolved
/// later inside the task's own scope where `task`, `item` and `itemIndex` are bound. Two
/// descriptor forms are accepted:
/// - `{id, action, inputs}` runs any action
/// - `{id, provider, model, prompt}` is shorthand for `<provider>.chat` with
///   `{model, messages: [{role: user, content: prompt}]}`
public final class ParallelOperations {

    private ParallelOperations() {}

    /// Registers both operations.
    ///
    /// @param registry target registry, not null
    /// @param parallel executor doing the fan-out, not null
    /// @param defaultMapConcurrency concurrency of `map` when none is given
    public static void registerAll(
            BuiltinOperations registry, ParallelExecutor parallel, int defaultMapConcurrency) {
        registry.register("parallel.spawn", op -> spawn(op, parallel));
        registry.register("parallel.map", op -> map(op, parallel, defaultMapConcurrency));
    }

    static Object spawn(OperationContext op, ParallelExecutor parallel) {
        List<ParallelTask> tasks = parseTasks(op);
        SpawnRequest request =
                new SpawnRequest(
                        tasks,
                        WaitPolicy.fromValue(op.input("wait")),
                        optionalMillis(op.input("timeout")),
                        FailurePolicy.fromValue(op.input("onError"), FailurePolicy.CONTINUE),
                        op.input("concurrency") != null
                                ? Values.toInt(op.input("concurrency"), 0)
                                : null,
                        optionalMillis(op.input("taskTimeout")));
        return parallel.spawn(request, op.context(), runner(op)).toMap();
    }

    static Object map(OperationContext op, ParallelExecutor parallel, int defaultConcurrency) {
        List<Object> items = Values.asList(op.input("items"));
        if (items == null) {
            throw new ValidationException(op.actionName() + ": items must be an array");
        }
        Map<String, Object> template = Values.asMap(op.rawInputs().get("agent"));
        if (template == null) {
            template = Values.asMap(op.rawInputs().get("task"));
        }
        if (template == null) {
            template = op.rawInputs();
        }
        ParallelTask prototype = describe(op, template, "item");
        int concurrency = Values.toInt(op.input("concurrency"), defaultConcurrency);
        MapRequest request =
                new MapRequest(
                        items,
                        prototype.action(),
                        prototype.inputs(),
                        Math.max(1, concurrency),
                        optionalMillis(op.input("timeout")),
                        FailurePolicy.fromValue(op.input("onError"), FailurePolicy.FAIL));
        return parallel.map(request, op.context(), runner(op));
    }

    private static TaskRunner runner(OperationContext op) {
        return (task, scope) -> op.dispatcher().dispatch(task.action(), task.inputs(), scope);
    }

    private static List<ParallelTask> parseTasks(OperationContext op) {
        Object raw = op.rawInputs().get("tasks");
        String key = "tasks";
        if (raw == null) {
            raw = op.rawInputs().get("agents");
            key = "agents";
        }
        List<Object> descriptors = Values.asList(raw);
        if (descriptors == null) {
            // a templated list such as "{{ review_tasks }}"
            descriptors = Values.asList(op.input(key));
        }
        if (descriptors == null) {
            throw new ValidationException(
                    op.actionName() + " requires at least one agent in 'tasks' or 'agents'");
        }
        List<ParallelTask> tasks = new ArrayList<>(descriptors.size());
        for (int i = 0; i < descriptors.size(); i++) {
            Map<String, Object> descriptor = Values.asMap(descriptors.get(i));
            if (descriptor == null) {
                throw new ValidationException(
                        op.actionName() + ": task descriptor " + i + " must be an object");
            }
            tasks.add(describe(op, descriptor, "task-" + (i + 1)));
        }
        return tasks;
    }

    private static ParallelTask describe(
            OperationContext op, Map<String, Object> descriptor, String defaultId) {
        String id = defaultId;
        if (descriptor.get("id") != null) {
            id =
                    op.templates()
                            .resolveString(
                                    Values.stringify(descriptor.get("id")),
                                    op.context().getVariables());
        }
        Map<String, Object> bindings = Values.asMap(descriptor.get("bindings"));

        Object action = descriptor.get("action");
        if (action != null) {
            Map<String, Object> inputs = Values.asMap(descriptor.get("inputs"));
            return new ParallelTask(id, Values.stringify(action), inputs, bindings);
        }
        Object provider = descriptor.get("provider");
        if (provider != null) {
            Map<String, Object> message = new LinkedHashMap<>();
            message.put("role", "user");
            message.put("content", descriptor.get("prompt"));
            Map<String, Object> inputs = new LinkedHashMap<>();
            if (descriptor.get("model") != null) {
                inputs.put("model", descriptor.get("model"));
            }
            inputs.put("messages", List.of(message));
            return new ParallelTask(id, Values.stringify(provider) + ".chat", inputs, bindings);
        }
        throw new ValidationException(
                op.actionName() + ": task '" + id + "' needs an 'action' or a 'provider'");
    }

    private static Long optionalMillis(Object value) {
        return value != null ? Durations.parseMillis(value) : null;
    }
}
