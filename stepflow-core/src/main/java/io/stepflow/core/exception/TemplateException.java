package io.stepflow.core.exception;

import java.io.Serial;

/// Raised when a template expression cannot be parsed or evaluated.
///
/// A template failure fails the step that owns the expression, never the engine.
public class TemplateException extends StepflowException {

    @Serial private static final long serialVersionUID = 5032748119664402875L;

    public TemplateException(String message) {
        super(message, false);
    }

    public TemplateException(String message, Throwable cause) {
        super(message, cause, false);
    }
}
