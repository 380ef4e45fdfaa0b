package io.stepflow.core.exception;

import java.io.Serial;
import java.time.Duration;

/// Raised when a service's token bucket has no permit and the limiter rejects instead of
/// queueing, or when the waiter queue is full. Retryable.
public class RateLimitException extends StepflowException {

    @Serial private static final long serialVersionUID = -1318872513263770428L;

    private final String service;

    public RateLimitException(String service, String message, Duration retryAfter) {
        super(message, null, true, retryAfter);
        this.service = service;
    }

    public String getService() {
        return service;
    }
}
