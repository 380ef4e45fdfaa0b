package io.stepflow.core.execution.builtin;

import io.stepflow.core.execution.ExecutionContext;
import java.util.Map;

/// Resolves and runs one action outside of any step, the path parallel tasks take.
public interface ActionDispatcher {

    /// Resolves `rawInputs` against the context's variables, classifies `actionName` and runs
    /// it.
    ///
    /// @param actionName action to run, not null
    /// @param rawInputs unresolved inputs, not null
    /// @param context scope to resolve against and run in, not null
    /// @return the action's result, may be null
    Object dispatch(String actionName, Map<String, Object> rawInputs, ExecutionContext context);
}
