package io.stepflow.core.event;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

/// In-process source: events are pushed programmatically through {@link #emit}.
///
/// Data passed to {@link #send} is recorded in an outbox that callers can drain, which makes
/// the source usable as a loopback channel in tests and embedded setups.
public final class ManualEventSource extends AbstractEventSource {

    public static final String KIND = "manual";

    private final List<Object> outbox = new CopyOnWriteArrayList<>();

    public ManualEventSource(String id, List<String> typeFilter, Clock clock) {
        super(id, KIND, typeFilter, clock);
    }

    @Override
    public void connect() {
        markConnected();
    }

    @Override
    public void stop() {
        markStopped();
    }

    /// Publishes an event from this source.
    ///
    /// @param type event type, not null
    /// @param data payload, may be null
    public void emit(String type, Map<String, Object> data) {
        emitEvent(type, data);
    }

    @Override
    public boolean supportsSending() {
        return true;
    }

    @Override
    public void send(Object data) {
        outbox.add(data);
    }

    /// Returns everything sent through this source, oldest first.
    public List<Object> sent() {
        return List.copyOf(outbox);
    }
}
