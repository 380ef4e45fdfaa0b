package io.stepflow.core.event;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/// An event emitted by a connected event source.
///
/// @param source id of the emitting source, not null
/// @param type event type, for example `tick` or `message`, not null
/// @param data event payload, never null
/// @param timestamp emission time, not null
public record Event(String source, String type, Map<String, Object> data, Instant timestamp) {

    public Event {
        Objects.requireNonNull(source, "source must not be null");
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(timestamp, "timestamp must not be null");
        data = data != null ? Collections.unmodifiableMap(new LinkedHashMap<>(data)) : Map.of();
    }

    /// Returns the event as a plain map, the shape steps receive from `event.wait`.
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("source", source);
        map.put("type", type);
        map.put("data", data);
        map.put("timestamp", timestamp.toString());
        return map;
    }
}
