package io.stepflow.core.exception;

import java.io.Serial;

/// Signals invalid input: a schema violation, a malformed duration, a missing
/// parameter or an unknown operation. Never retried.
public class ValidationException extends StepflowException {

    @Serial private static final long serialVersionUID = -4571265620981437721L;

    public ValidationException(String message) {
        super(message, false);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause, false);
    }
}
