package io.stepflow.core.exception;

import java.io.Serial;
import java.time.Duration;

/// Raised by the circuit breaker when a service's circuit is open.
///
/// The exception is retryable and carries the remaining cool-down as its retry hint, but the
/// reliability wrapper never spends a retry attempt on it: it propagates immediately and is not
/// recorded as a new failure.
public class CircuitOpenException extends StepflowException {

    @Serial private static final long serialVersionUID = 3902847715108250781L;

    private final String service;

    public CircuitOpenException(String service, Duration retryAfter) {
        super(
                "Circuit breaker is open for "
                        + service
                        + ": too many recent failures. Retry after "
                        + Math.max(1, (retryAfter.toMillis() + 999) / 1000)
                        + "s",
                null,
                true,
                retryAfter);
        this.service = service;
    }

    public String getService() {
        return service;
    }
}
