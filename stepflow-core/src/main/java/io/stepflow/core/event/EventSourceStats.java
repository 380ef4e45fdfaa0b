package io.stepflow.core.event;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/// Point-in-time statistics of one event source.
///
/// @param id source id, not null
/// @param kind source kind, not null
/// @param status connection status, not null
/// @param eventsReceived events emitted since creation
/// @param lastEventAt time of the last event, may be null
/// @param connectedAt time of the last successful connect, may be null
public record EventSourceStats(
        String id,
        String kind,
        EventSourceStatus status,
        long eventsReceived,
        Instant lastEventAt,
        Instant connectedAt) {

    public EventSourceStats {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(status, "status must not be null");
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("id", id);
        map.put("kind", kind);
        map.put("status", status.wireName());
        map.put("eventsReceived", eventsReceived);
        map.put("lastEventAt", lastEventAt != null ? lastEventAt.toString() : null);
        map.put("connectedAt", connectedAt != null ? connectedAt.toString() : null);
        return map;
    }
}
