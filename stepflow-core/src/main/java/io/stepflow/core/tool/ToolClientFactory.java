package io.stepflow.core.tool;

import java.util.Map;

/// Builds a {@link ToolClient} from a tool's configuration, after secret references in it have
/// been resolved.
@FunctionalInterface
public interface ToolClientFactory {

    /// @param config resolved configuration, not null
    /// @return the client, never null
    /// @throws Exception if the client cannot be created
    ToolClient create(Map<String, Object> config) throws Exception;
}
