package io.stepflow.core.exception;

import java.io.Serial;

/// Raised when a `${secret:provider://path#key}` reference cannot be resolved.
public class SecretNotFoundException extends StepflowException {

    @Serial private static final long serialVersionUID = 4420710943551187276L;

    public SecretNotFoundException(String message) {
        super(message, false);
    }

    public SecretNotFoundException(String message, Throwable cause) {
        super(message, cause, false);
    }
}
