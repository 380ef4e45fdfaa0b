package io.stepflow.core.reliability;

/// Thresholds for a service's circuit breaker.
///
/// @param failureThreshold failures within `failureWindowMs` that open a closed circuit, positive
/// @param resetTimeoutMs time an open circuit waits before admitting a probe, positive
/// @param successThreshold consecutive half-open successes that close the circuit, positive
/// @param failureWindowMs length of the sliding failure window, positive
public record CircuitBreakerConfig(
        int failureThreshold, long resetTimeoutMs, int successThreshold, long failureWindowMs) {

    public static final int DEFAULT_FAILURE_THRESHOLD = 5;
    public static final long DEFAULT_RESET_TIMEOUT_MS = 30_000;
    public static final int DEFAULT_SUCCESS_THRESHOLD = 2;
    public static final long DEFAULT_FAILURE_WINDOW_MS = 60_000;

    public CircuitBreakerConfig {
        if (failureThreshold <= 0) {
            throw new IllegalArgumentException(
                    "failureThreshold must be positive (current: " + failureThreshold + ")");
        }
        if (resetTimeoutMs <= 0) {
            throw new IllegalArgumentException(
                    "resetTimeoutMs must be positive (current: " + resetTimeoutMs + ")");
        }
        if (successThreshold <= 0) {
            throw new IllegalArgumentException(
                    "successThreshold must be positive (current: " + successThreshold + ")");
        }
        if (failureWindowMs <= 0) {
            throw new IllegalArgumentException(
                    "failureWindowMs must be positive (current: " + failureWindowMs + ")");
        }
    }

    public static CircuitBreakerConfig defaults() {
        return new CircuitBreakerConfig(
                DEFAULT_FAILURE_THRESHOLD,
                DEFAULT_RESET_TIMEOUT_MS,
                DEFAULT_SUCCESS_THRESHOLD,
                DEFAULT_FAILURE_WINDOW_MS);
    }
}
