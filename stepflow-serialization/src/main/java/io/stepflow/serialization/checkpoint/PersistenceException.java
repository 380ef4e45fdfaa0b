package io.stepflow.serialization.checkpoint;

import io.stepflow.core.exception.StepflowException;
import java.io.Serial;

/// Unchecked exception for checkpoint file failures.
///
/// Wraps {@link java.io.IOException} so failures propagate through the
/// {@link io.stepflow.core.checkpoint.CheckpointStore} interface, which declares no checked
/// exceptions. Never retryable.
///
/// @see JsonFileCheckpointStore
public class PersistenceException extends StepflowException {

    @Serial private static final long serialVersionUID = -1520694130338121478L;

    public PersistenceException(String message, Throwable cause) {
        super(message, cause, false);
    }
}
