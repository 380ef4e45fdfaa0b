package io.stepflow.core.reliability;

import java.util.Objects;

/// Token-bucket limit for one service: `maxRequests` per `windowMs`, refilled continuously.
///
/// @param maxRequests bucket capacity and requests allowed per window, positive
/// @param windowMs window length in milliseconds, positive
/// @param strategy behaviour on an empty bucket, not null
/// @param maxQueueSize waiters allowed under {@link RateLimitStrategy#QUEUE}, non-negative
public record RateLimitConfig(
        int maxRequests, long windowMs, RateLimitStrategy strategy, int maxQueueSize) {

    public static final int DEFAULT_MAX_QUEUE_SIZE = 100;

    public RateLimitConfig {
        if (maxRequests <= 0) {
            throw new IllegalArgumentException(
                    "maxRequests must be positive (current: " + maxRequests + ")");
        }
        if (windowMs <= 0) {
            throw new IllegalArgumentException(
                    "windowMs must be positive (current: " + windowMs + ")");
        }
        Objects.requireNonNull(strategy, "strategy must not be null");
        if (maxQueueSize < 0) {
            throw new IllegalArgumentException(
                    "maxQueueSize must not be negative (current: " + maxQueueSize + ")");
        }
    }

    /// Creates a queueing limit with the default queue size.
    public static RateLimitConfig of(int maxRequests, long windowMs) {
        return new RateLimitConfig(
                maxRequests, windowMs, RateLimitStrategy.QUEUE, DEFAULT_MAX_QUEUE_SIZE);
    }

    public RateLimitConfig withStrategy(RateLimitStrategy newStrategy) {
        return new RateLimitConfig(maxRequests, windowMs, newStrategy, maxQueueSize);
    }

    /// Returns the refill rate in tokens per millisecond.
    public double refillRatePerMs() {
        return (double) maxRequests / windowMs;
    }
}
