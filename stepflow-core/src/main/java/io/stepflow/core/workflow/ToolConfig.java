package io.stepflow.core.workflow;

import java.util.Map;

/// Workflow-level binding of a tool alias to a registered tool.
///
/// @param tool name of the registered {@link io.stepflow.core.tool.ToolDefinition}; null means
///     the alias itself
/// @param config entries merged over the tool definition's config, may hold secret references
public record ToolConfig(String tool, Map<String, Object> config) {

    public ToolConfig {
        config = config != null ? Map.copyOf(config) : Map.of();
    }
}
