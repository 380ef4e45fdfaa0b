package io.stepflow.core.event;

import java.util.Locale;

public enum EventSourceStatus {
    DISCONNECTED,
    CONNECTING,
    CONNECTED,
    ERROR,
    STOPPED;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
