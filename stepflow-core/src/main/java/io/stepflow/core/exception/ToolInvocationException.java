package io.stepflow.core.exception;

import java.io.Serial;

/// Wraps a failure raised by an external tool client.
///
/// Retryable unless the tool marks it permanent. An optional HTTP-style status code lets the
/// reliability wrapper decide retries from its `retryOn` list instead of the flag.
public class ToolInvocationException extends StepflowException {

    @Serial private static final long serialVersionUID = 8461370045917334522L;

    private final String service;
    private final String action;
    private final Integer statusCode;

    public ToolInvocationException(
            String service, String action, String message, Throwable cause, boolean retryable) {
        this(service, action, message, cause, retryable, null);
    }

    public ToolInvocationException(
            String service,
            String action,
            String message,
            Throwable cause,
            boolean retryable,
            Integer statusCode) {
        super(message, cause, retryable);
        this.service = service;
        this.action = action;
        this.statusCode = statusCode;
    }

    /// Creates a non-retryable failure.
    ///
    /// @param service tool or service name, may be null
    /// @param action invoked action path, may be null
    /// @param message failure description, not null
    /// @return new exception, never null
    public static ToolInvocationException permanent(
            String service, String action, String message) {
        return new ToolInvocationException(service, action, message, null, false);
    }

    public String getService() {
        return service;
    }

    public String getAction() {
        return action;
    }

    /// Returns the status code reported by the tool, if any.
    ///
    /// @return status code, or null when the tool reported none
    public Integer getStatusCode() {
        return statusCode;
    }
}
