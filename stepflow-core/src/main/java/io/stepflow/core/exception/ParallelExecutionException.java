package io.stepflow.core.exception;

import java.io.Serial;

/// Raised when a parallel `spawn` or `map` runs under the `fail` error policy and a task fails.
public class ParallelExecutionException extends StepflowException {

    @Serial private static final long serialVersionUID = -2968131406622095113L;

    public ParallelExecutionException(String message, Throwable cause) {
        super(message, cause, false);
    }
}
