package io.stepflow.core.reliability;

/// What a rate limiter does when a service's bucket is empty.
public enum RateLimitStrategy {
    /// Park the caller FIFO until a token is refilled.
    QUEUE,
    /// Fail immediately with a retryable {@link io.stepflow.core.exception.RateLimitException}.
    REJECT
}
