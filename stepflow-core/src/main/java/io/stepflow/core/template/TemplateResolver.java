package io.stepflow.core.template;

import io.stepflow.core.util.Values;
import java.util.Map;

/// Resolves `{{ expression }}` placeholders in step inputs against run variables.
///
/// Implementations must be deterministic and side-effect free, and must not execute host code.
public interface TemplateResolver {

    /// Resolves every template in a value.
    ///
    /// Strings are resolved, maps and lists are resolved recursively, all other values are
    /// returned unchanged.
    ///
    /// @param value value possibly containing templates, may be null
    /// @param variables variable bindings, not null
    /// @return resolved value, may be null
    /// @throws io.stepflow.core.exception.TemplateException on syntax or evaluation errors
    Object resolve(Object value, Map<String, Object> variables);

    /// Evaluates a bare expression (with or without `{{ }}` delimiters) to a typed value.
    ///
    /// @param expression expression text, not null
    /// @param variables variable bindings, not null
    /// @return the value, may be null
    /// @throws io.stepflow.core.exception.TemplateException on syntax or evaluation errors
    Object evaluate(String expression, Map<String, Object> variables);

    /// Resolves a template and renders the result as text.
    default String resolveString(String template, Map<String, Object> variables) {
        return Values.stringify(resolve(template, variables));
    }
}
