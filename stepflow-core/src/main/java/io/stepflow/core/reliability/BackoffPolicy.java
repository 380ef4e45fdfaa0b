package io.stepflow.core.reliability;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.ThreadLocalRandom;

/// Exponential backoff with symmetric jitter.
///
/// The delay before retry `attempt` (zero-based) is `initialDelayMs * 2^attempt`, capped at
/// `maxDelayMs`, then scaled by a random factor in `[1 - jitter, 1 + jitter]`. A server
/// supplied `retryAfter` hint replaces the computed delay and is capped the same way.
public class BackoffPolicy {

    public static final double DEFAULT_JITTER = 0.25;

    private final long initialDelayMs;
    private final long maxDelayMs;
    private final double jitterFactor;

    public BackoffPolicy(long initialDelayMs, long maxDelayMs) {
        this(initialDelayMs, maxDelayMs, DEFAULT_JITTER);
    }

    public BackoffPolicy(long initialDelayMs, long maxDelayMs, double jitterFactor) {
        if (initialDelayMs < 0) {
            throw new IllegalArgumentException(
                    "initialDelayMs must not be negative (current: " + initialDelayMs + ")");
        }
        if (maxDelayMs < initialDelayMs) {
            throw new IllegalArgumentException(
                    "maxDelayMs must be >= initialDelayMs (initial: "
                            + initialDelayMs
                            + ", max: "
                            + maxDelayMs
                            + ")");
        }
        if (jitterFactor < 0.0 || jitterFactor > 1.0) {
            throw new IllegalArgumentException(
                    "jitterFactor must be between 0.0 and 1.0 (current: " + jitterFactor + ")");
        }
        this.initialDelayMs = initialDelayMs;
        this.maxDelayMs = maxDelayMs;
        this.jitterFactor = jitterFactor;
    }

    /// Computes the wait before the given retry.
    ///
    /// @param attempt zero-based index of the attempt that just failed
    /// @param retryAfter server or breaker hint, not null (may be empty)
    /// @return delay in milliseconds, within `[0, maxDelayMs]`
    public long delayMillis(int attempt, Optional<Duration> retryAfter) {
        if (retryAfter.isPresent()) {
            return Math.min(Math.max(0, retryAfter.get().toMillis()), maxDelayMs);
        }
        int shift = Math.min(Math.max(attempt, 0), 30);
        long exponential = Math.min(initialDelayMs * (1L << shift), maxDelayMs);
        double jitter = 1 + jitterFactor * (2 * ThreadLocalRandom.current().nextDouble() - 1);
        return Math.min(Math.round(exponential * jitter), maxDelayMs);
    }

    public long getInitialDelayMs() {
        return initialDelayMs;
    }

    public long getMaxDelayMs() {
        return maxDelayMs;
    }
}
