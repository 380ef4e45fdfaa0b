package io.stepflow.core.exception;

import java.io.Serial;

/// Aborts the run: a `while` loop exceeded its iteration bound, a required workflow input is
/// missing, or an invariant of the run itself was violated.
///
/// Never retried and never absorbed by `try`/`catch` steps.
public class WorkflowFatalException extends StepflowException {

    @Serial private static final long serialVersionUID = -7753590286411264810L;

    public WorkflowFatalException(String message) {
        super(message, false);
    }
}
