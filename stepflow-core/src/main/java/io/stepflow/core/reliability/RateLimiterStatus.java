package io.stepflow.core.reliability;

/// Snapshot of a service's token bucket.
///
/// @param available whole tokens currently available
/// @param max bucket capacity
/// @param queued callers waiting for a token
/// @param refillRatePerSecond tokens added per second
public record RateLimiterStatus(int available, int max, int queued, double refillRatePerSecond) {}
