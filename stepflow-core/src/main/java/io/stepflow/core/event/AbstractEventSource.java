package io.stepflow.core.event;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Consumer;

/// Base class tracking status and statistics and applying the optional type filter.
///
/// Subclasses call {@link #emitEvent} to publish. Events whose type is not in the configured
/// filter are dropped before they are counted.
public abstract class AbstractEventSource implements EventSource {

    private final String id;
    private final String kind;
    private final Set<String> typeFilter;
    protected final Clock clock;

    private volatile Consumer<Event> sink = event -> {};
    protected volatile EventSourceStatus status = EventSourceStatus.DISCONNECTED;
    private volatile Instant connectedAt;
    private volatile Instant lastEventAt;
    private long eventsReceived;

    protected AbstractEventSource(String id, String kind, List<String> typeFilter, Clock clock) {
        this.id = Objects.requireNonNull(id, "id must not be null");
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
        this.typeFilter = typeFilter != null ? Set.copyOf(typeFilter) : null;
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public String kind() {
        return kind;
    }

    @Override
    public void setSink(Consumer<Event> sink) {
        this.sink = Objects.requireNonNull(sink, "sink must not be null");
    }

    @Override
    public synchronized EventSourceStats stats() {
        return new EventSourceStats(id, kind, status, eventsReceived, lastEventAt, connectedAt);
    }

    protected void markConnected() {
        connectedAt = clock.instant();
        status = EventSourceStatus.CONNECTED;
    }

    protected void markStopped() {
        connectedAt = null;
        status = EventSourceStatus.STOPPED;
    }

    protected void emitEvent(String type, Map<String, Object> data) {
        if (typeFilter != null && !typeFilter.contains(type)) {
            return;
        }
        Event event;
        synchronized (this) {
            eventsReceived++;
            lastEventAt = clock.instant();
            event = new Event(id, type, data, lastEventAt);
        }
        sink.accept(event);
    }
}
