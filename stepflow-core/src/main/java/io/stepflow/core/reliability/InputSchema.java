package io.stepflow.core.reliability;

import java.util.List;

/// Validates the input of a guarded call before any I/O happens.
@FunctionalInterface
public interface InputSchema {

    /// Checks the input.
    ///
    /// @param input call input, may be null
    /// @return violations formatted as `path: message`, never null (empty when valid)
    List<String> validate(Object input);
}
