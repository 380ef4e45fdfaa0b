package io.stepflow.core.event;

/// Selects which events satisfy an `event.wait`. Null fields match anything.
///
/// @param source required source id, may be null
/// @param type required event type, may be null
public record EventFilter(String source, String type) {

    public static final EventFilter ANY = new EventFilter(null, null);

    public boolean matches(Event event) {
        return (source == null || source.equals(event.source()))
                && (type == null || type.equals(event.type()));
    }
}
