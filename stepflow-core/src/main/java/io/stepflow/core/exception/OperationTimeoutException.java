package io.stepflow.core.exception;

import java.io.Serial;

/// Signals that a guarded call, parallel task or event wait exceeded its deadline.
///
/// Retryable: the reliability wrapper treats a timeout as a transient failure.
public class OperationTimeoutException extends StepflowException {

    @Serial private static final long serialVersionUID = 6166035916542733702L;

    private final long timeoutMillis;

    public OperationTimeoutException(String message, long timeoutMillis) {
        super(message, true);
        this.timeoutMillis = timeoutMillis;
    }

    /// Returns the deadline that was exceeded.
    ///
    /// @return timeout in milliseconds
    public long getTimeoutMillis() {
        return timeoutMillis;
    }
}
