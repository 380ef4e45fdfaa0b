package io.stepflow.core.exception;

import java.io.Serial;

/// Signals that the run was cancelled, either by an explicit request or by thread interruption.
public class WorkflowCancelledException extends StepflowException {

    @Serial private static final long serialVersionUID = 1873460291732940585L;

    public WorkflowCancelledException(String message) {
        super(message, false);
    }

    public WorkflowCancelledException(String message, Throwable cause) {
        super(message, cause, false);
    }
}
