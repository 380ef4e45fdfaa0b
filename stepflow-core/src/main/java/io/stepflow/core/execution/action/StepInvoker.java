package io.stepflow.core.execution.action;

import io.stepflow.core.execution.ExecutionContext;
import java.util.Map;

/// Invokes tool calls, the actions outside the built-in namespaces.
///
/// The engine hands every {@link Action.ToolCall} to the invoker with inputs already resolved.
/// Implementations decide how the tool client is found and how the call is guarded.
///
/// @see DefaultStepInvoker for the registry-backed, reliability-wrapped implementation
@FunctionalInterface
public interface StepInvoker {

    /// @param call classified tool call, not null
    /// @param inputs resolved inputs, not null
    /// @param context scope of the calling step, not null
    /// @return the tool's result, may be null
    /// @throws io.stepflow.core.exception.StepflowException if the call fails
    Object invoke(Action.ToolCall call, Map<String, Object> inputs, ExecutionContext context);
}
