package io.stepflow.core.event;

import java.util.function.Consumer;

/// A long-lived connection that pushes {@link Event}s to a sink.
///
/// ### Contracts
/// - {@link #connect} is called once by the manager after {@link #setSink}
/// - {@link #stop} is idempotent and releases every timer or connection the source holds
/// - sources may emit from any thread
///
/// @see EventSourceManager
public interface EventSource {

    String id();

    String kind();

    /// Sets the consumer that receives every emitted event.
    void setSink(Consumer<Event> sink);

    void connect();

    void stop();

    EventSourceStats stats();

    /// Returns whether {@link #send} is supported.
    default boolean supportsSending() {
        return false;
    }

    /// Sends data outward through the source.
    ///
    /// @param data payload, string or map
    /// @throws UnsupportedOperationException if the source cannot send
    default void send(Object data) {
        throw new UnsupportedOperationException(
                "Event source '" + id() + "' does not support sending");
    }
}
