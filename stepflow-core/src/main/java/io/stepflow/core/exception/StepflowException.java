package io.stepflow.core.exception;

import java.io.Serial;
import java.time.Duration;
import java.util.Optional;

/// Root of the runtime's unchecked exception hierarchy.
///
/// Every failure the engine, the parallel executor or the reliability wrapper produces is a
/// subtype of this class. Two properties drive recovery decisions:
/// - {@link #isRetryable()} tells the reliability wrapper and step-level retry loops whether
///   another attempt may succeed
/// - {@link #retryAfter()} carries a server or breaker supplied hint for the next attempt
///
/// ### Permitted Subtypes
/// - {@link ValidationException} - bad input, never retried
/// - {@link OperationTimeoutException} - a call or wait exceeded its deadline
/// - {@link CircuitOpenException} - the service's circuit breaker rejected the call
/// - {@link RateLimitException} - the service's token bucket rejected the call
/// - {@link ToolInvocationException} - an external tool failed
/// - {@link WorkflowFatalException} - the run must abort
/// - {@link WorkflowCancelledException} - the run was cancelled
/// - {@link TemplateException} - an expression failed to parse or evaluate
/// - {@link ParallelExecutionException} - a fan-out failed under the `fail` policy
/// - {@link SecretNotFoundException} - a secret reference could not be resolved
public class StepflowException extends RuntimeException {

    @Serial private static final long serialVersionUID = 2617331830496012512L;

    private final boolean retryable;
    private final Duration retryAfter;

    public StepflowException(String message, boolean retryable) {
        this(message, null, retryable, null);
    }

    public StepflowException(String message, Throwable cause, boolean retryable) {
        this(message, cause, retryable, null);
    }

    protected StepflowException(
            String message, Throwable cause, boolean retryable, Duration retryAfter) {
        super(message, cause);
        this.retryable = retryable;
        this.retryAfter = retryAfter;
    }

    /// Returns whether another attempt of the failed operation may succeed.
    ///
    /// @return true if the failure is transient
    public boolean isRetryable() {
        return retryable;
    }

    /// Returns the suggested wait before the next attempt, if the failure carries one.
    ///
    /// @return retry hint, never null (may be empty)
    public Optional<Duration> retryAfter() {
        return Optional.ofNullable(retryAfter);
    }
}
