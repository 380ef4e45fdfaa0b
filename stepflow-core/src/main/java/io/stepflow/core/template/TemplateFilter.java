package io.stepflow.core.template;

import java.util.List;

/// A named transformation applied with `value | name(arg, ...)`.
@FunctionalInterface
public interface TemplateFilter {

    /// @param input the piped value, may be null
    /// @param arguments evaluated arguments, never null (may be empty)
    /// @return the filtered value, may be null
    Object apply(Object input, List<Object> arguments);
}
