package io.stepflow.core.tool;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/// Registry of external tools and their loaded clients.
///
/// ### Usage
/// {@snippet :
/// ToolRegistry registry = new DefaultToolRegistry(secretResolver);
/// registry.register(ToolDefinition.of("echo", (method, inputs) -> inputs));
///
/// ToolClient client = registry.load("echo");
/// }
///
/// @implNote Implementations should be thread-safe: parallel tasks load clients concurrently.
/// @see ToolDefinition for tool descriptors
public interface ToolRegistry {

    /// Registers a tool definition, replacing one with the same name and evicting its cached
    /// clients.
    ///
    /// @apiNote **Side effects**: Modifies internal tool registry
    ///
    /// @param tool the tool definition to register, not null
    /// @throws NullPointerException if tool is null
    void register(ToolDefinition tool);

    /// Retrieves a tool by name.
    ///
    /// @param name the tool identifier to look up, not null
    /// @return the tool definition if found, empty otherwise
    Optional<ToolDefinition> get(String name);

    /// Returns all registered tools.
    ///
    /// @return unmodifiable list of all tools, never null (may be empty)
    List<ToolDefinition> all();

    /// Loads (or returns the cached) client for a tool using its own config.
    ///
    /// @param name tool identifier, not null
    /// @return the client, never null
    /// @throws io.stepflow.core.exception.ToolInvocationException if the tool is unknown or its
    ///     client cannot be created
    /// @throws io.stepflow.core.exception.SecretNotFoundException if a secret reference in the
    ///     config cannot be resolved
    default ToolClient load(String name) {
        return load(name, Map.of());
    }

    /// Loads (or returns the cached) client for a tool, with workflow-level config merged over
    /// the definition's config.
    ///
    /// @param name tool identifier, not null
    /// @param configOverrides config entries that replace the definition's, not null
    /// @return the client, never null
    ToolClient load(String name, Map<String, Object> configOverrides);

    /// Returns whether a tool with the given name is registered.
    default boolean contains(String name) {
        return get(name).isPresent();
    }

    /// Removes a tool by name.
    ///
    /// @return true if the tool was removed, false if not found
    default boolean remove(String name) {
        return false;
    }
}
