package io.stepflow.core.reliability;

import java.util.Locale;

/// Circuit breaker states. Transitions run `CLOSED -> OPEN -> HALF_OPEN -> {CLOSED | OPEN}`.
public enum CircuitState {
    /// Requests pass; failures are tracked in a sliding window.
    CLOSED,
    /// Every request is rejected until the reset timeout elapses.
    OPEN,
    /// One probe request at a time decides whether the circuit closes again.
    HALF_OPEN;

    /// Returns the lowercase form used in stats and logs (`closed`, `open`, `half_open`).
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
