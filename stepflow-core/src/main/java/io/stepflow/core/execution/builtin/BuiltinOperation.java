package io.stepflow.core.execution.builtin;

/// A built-in `core.*`, `workflow.*`, `parallel.*` or `event.*` operation.
///
/// Implementations are stateless apart from the services they were built with, and signal bad
/// input with {@link io.stepflow.core.exception.ValidationException}.
@FunctionalInterface
public interface BuiltinOperation {

    /// Runs the operation.
    ///
    /// @param operation inputs and scope of the call, not null
    /// @return the operation's result, may be null
    Object execute(OperationContext operation);
}
