package io.stepflow.core.tool;

import java.util.Map;

/// A loaded, configured client for one external tool.
///
/// The step invoker calls {@link #invoke} with the method path that follows the tool name in
/// the action (`slack.chat.postMessage` invokes `chat.postMessage` on the `slack` client).
/// Clients may throw anything; the reliability wrapper classifies the failure.
@FunctionalInterface
public interface ToolClient {

    /// @param method dotted method path, not null
    /// @param inputs resolved step inputs, not null
    /// @return call result, usually a map, may be null
    /// @throws Exception on any failure of the underlying call
    Object invoke(String method, Map<String, Object> inputs) throws Exception;
}
