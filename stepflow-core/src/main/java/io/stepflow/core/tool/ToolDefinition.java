package io.stepflow.core.tool;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/// Describes an external tool: how to build its client and what its operations accept.
///
/// ### Contracts
/// - **Precondition**: `name` must not be null or blank
/// - **Postcondition**: All fields immutable after construction
///
/// ### Usage
/// {@snippet :
/// ToolDefinition github = ToolDefinition.builder("github", GitHubClient::new)
///         .description("GitHub REST API")
///         .config(Map.of("token", "${secret:env://GITHUB_TOKEN}"))
///         .operation("issues.create", List.of(
///                 ParameterDef.required("owner", "string", "Repository owner"),
///                 ParameterDef.required("repo", "string", "Repository name"),
///                 ParameterDef.required("title", "string", "Issue title")))
///         .build();
/// }
///
/// @param name unique tool identifier, the first segment of action names, not null
/// @param description human-readable description, not null
/// @param config client configuration, may hold secret references, not null
/// @param operations method path to accepted parameters, used for input validation, not null
/// @param clientFactory builds the client from resolved config, not null
/// @see ToolRegistry for tool registration
public record ToolDefinition(
        String name,
        String description,
        Map<String, Object> config,
        Map<String, List<ParameterDef>> operations,
        ToolClientFactory clientFactory) {

    /// Compact constructor with validation.
    public ToolDefinition {
        Objects.requireNonNull(name, "name must not be null");
        if (name.isBlank()) {
            throw new IllegalArgumentException("name must not be blank");
        }
        Objects.requireNonNull(description, "description must not be null");
        Objects.requireNonNull(clientFactory, "clientFactory must not be null");
        config = config != null ? Map.copyOf(config) : Map.of();
        operations = operations != null ? Map.copyOf(operations) : Map.of();
    }

    /// Creates a tool definition with no config and no declared operations.
    ///
    /// @param name unique tool identifier, not null
    /// @param clientFactory client factory, not null
    /// @return new tool definition, never null
    public static ToolDefinition simple(String name, ToolClientFactory clientFactory) {
        return new ToolDefinition(name, name, Map.of(), Map.of(), clientFactory);
    }

    /// Creates a tool definition around an already-built client.
    public static ToolDefinition of(String name, ToolClient client) {
        Objects.requireNonNull(client, "client must not be null");
        return simple(name, config -> client);
    }

    public static Builder builder(String name, ToolClientFactory clientFactory) {
        return new Builder(name, clientFactory);
    }

    /// Returns the required parameter names of an operation.
    ///
    /// @param method method path, not null
    /// @return required parameter names, never null
    public List<String> requiredParameterNames(String method) {
        return operations.getOrDefault(method, List.of()).stream()
                .filter(ParameterDef::required)
                .map(ParameterDef::name)
                .toList();
    }

    /// Describes an operation parameter.
    ///
    /// @param name parameter identifier, not null
    /// @param type parameter type (string, number, integer, boolean, object, array), not null
    /// @param description human-readable description, not null
    /// @param required whether the parameter must be provided
    /// @param defaultValue default value if not provided, may be null
    public record ParameterDef(
            String name, String type, String description, boolean required, Object defaultValue) {

        /// Compact constructor with validation.
        public ParameterDef {
            Objects.requireNonNull(name, "name must not be null");
            Objects.requireNonNull(type, "type must not be null");
            Objects.requireNonNull(description, "description must not be null");
        }

        /// Creates a required parameter definition.
        public static ParameterDef required(String name, String type, String description) {
            return new ParameterDef(name, type, description, true, null);
        }

        /// Creates an optional parameter definition.
        public static ParameterDef optional(
                String name, String type, String description, Object defaultValue) {
            return new ParameterDef(name, type, description, false, defaultValue);
        }
    }

    public static final class Builder {
        private final String name;
        private final ToolClientFactory clientFactory;
        private String description;
        private Map<String, Object> config = Map.of();
        private final Map<String, List<ParameterDef>> operations = new LinkedHashMap<>();

        private Builder(String name, ToolClientFactory clientFactory) {
            this.name = name;
            this.clientFactory = clientFactory;
            this.description = name;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder config(Map<String, Object> config) {
            this.config = config;
            return this;
        }

        public Builder operation(String method, List<ParameterDef> parameters) {
            this.operations.put(method, List.copyOf(parameters));
            return this;
        }

        public ToolDefinition build() {
            return new ToolDefinition(name, description, config, operations, clientFactory);
        }
    }
}
