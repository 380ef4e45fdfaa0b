package io.stepflow.core.execution.builtin;

import io.stepflow.core.event.Event;
import io.stepflow.core.event.EventFilter;
import io.stepflow.core.event.EventSourceManager;
import io.stepflow.core.event.EventSourceStats;
import io.stepflow.core.exception.ValidationException;
import io.stepflow.core.util.Durations;
import io.stepflow.core.util.Values;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/// The `event.*` operations, thin adapters over {@link EventSourceManager}.
final class EventOperations {

    private EventOperations() {}

    static void registerAll(BuiltinOperations registry, EventSourceManager events) {
        registry.register("event.connect", op -> connect(op, events));
        registry.register("event.wait", op -> waitFor(op, events));
        registry.register(
                "event.disconnect",
                op -> {
                    String id = required(op, "id");
                    events.disconnect(id);
                    return Map.of("disconnected", id);
                });
        registry.register(
                "event.send",
                op -> {
                    String id = required(op, "id");
                    events.send(id, op.input("data"));
                    return Map.of("sent", true, "source", id);
                });
        registry.register(
                "event.status",
                op -> {
                    List<Object> sources =
                            events.status().stream()
                                    .map(stats -> (Object) stats.toMap())
                                    .toList();
                    return Map.of("sources", sources);
                });
    }

    private static Object connect(OperationContext op, EventSourceManager events) {
        Map<String, Object> options = new LinkedHashMap<>();
        Map<String, Object> given = Values.asMap(op.input("options"));
        if (given != null) {
            options.putAll(given);
        }
        if (op.input("filter") != null) {
            options.put("filter", op.input("filter"));
        }
        EventSourceStats stats =
                events.connect(required(op, "kind"), required(op, "id"), options);
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("id", stats.id());
        result.put("kind", stats.kind());
        result.put("status", stats.status().wireName());
        result.put(
                "connectedAt",
                stats.connectedAt() != null ? stats.connectedAt().toString() : null);
        return result;
    }

    private static Object waitFor(OperationContext op, EventSourceManager events) {
        Object source = op.input("source");
        Object type = op.input("type");
        EventFilter filter =
                new EventFilter(
                        source != null ? Values.stringify(source) : null,
                        type != null ? Values.stringify(type) : null);
        Event event = events.waitForEvent(filter, Durations.parseMillis(op.input("timeout"), 0));
        return event.toMap();
    }

    private static String required(OperationContext op, String name) {
        Object value = op.input(name);
        if (value == null || Values.stringify(value).isBlank()) {
            throw new ValidationException(op.actionName() + ": " + name + " is required");
        }
        return Values.stringify(value);
    }
}
