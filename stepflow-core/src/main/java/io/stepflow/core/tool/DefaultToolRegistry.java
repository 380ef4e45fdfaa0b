package io.stepflow.core.tool;

import io.stepflow.core.exception.StepflowException;
import io.stepflow.core.exception.ToolInvocationException;
import io.stepflow.core.tool.secret.SecretResolver;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Logger;

/// Default thread-safe implementation of {@link ToolRegistry}.
///
/// Loading a client resolves every `${secret:...}` reference in the merged config through the
/// {@link SecretResolver}, hands the result to the tool's {@link ToolClientFactory}, and caches
/// the client per tool and config override set.
///
/// @implNote Thread-safe. All operations use ConcurrentHashMap; a client is created at most
/// once per cache key.
public final class DefaultToolRegistry implements ToolRegistry {

    private static final Logger logger = Logger.getLogger(DefaultToolRegistry.class.getName());

    private final Map<String, ToolDefinition> tools = new ConcurrentHashMap<>();
    private final Map<ClientKey, ToolClient> clients = new ConcurrentHashMap<>();
    private final SecretResolver secretResolver;

    /// @param secretResolver resolves secret references in tool config, not null
    public DefaultToolRegistry(SecretResolver secretResolver) {
        this.secretResolver =
                Objects.requireNonNull(secretResolver, "secretResolver must not be null");
    }

    @Override
    public void register(ToolDefinition tool) {
        Objects.requireNonNull(tool, "tool must not be null");
        tools.put(tool.name(), tool);
        clients.keySet().removeIf(key -> key.tool().equals(tool.name()));
    }

    @Override
    public Optional<ToolDefinition> get(String name) {
        Objects.requireNonNull(name, "name must not be null");
        return Optional.ofNullable(tools.get(name));
    }

    @Override
    public List<ToolDefinition> all() {
        return List.copyOf(tools.values());
    }

    @Override
    public ToolClient load(String name, Map<String, Object> configOverrides) {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(configOverrides, "configOverrides must not be null");
        ToolDefinition tool = tools.get(name);
        if (tool == null) {
            throw ToolInvocationException.permanent(name, null, "Unknown tool: " + name);
        }
        return clients.computeIfAbsent(
                new ClientKey(name, Map.copyOf(configOverrides)), key -> create(tool, key));
    }

    @Override
    public boolean contains(String name) {
        Objects.requireNonNull(name, "name must not be null");
        return tools.containsKey(name);
    }

    @Override
    public boolean remove(String name) {
        Objects.requireNonNull(name, "name must not be null");
        clients.keySet().removeIf(key -> key.tool().equals(name));
        return tools.remove(name) != null;
    }

    private ToolClient create(ToolDefinition tool, ClientKey key) {
        Map<String, Object> merged = new LinkedHashMap<>(tool.config());
        merged.putAll(key.overrides());
        Map<String, Object> resolved =
                (Map<String, Object>) secretResolver.resolveReferences(merged);
        try {
            ToolClient client = tool.clientFactory().create(resolved);
            if (client == null) {
                throw ToolInvocationException.permanent(
                        tool.name(), null, "Client factory for " + tool.name() + " returned null");
            }
            logger.info("Loaded tool client: " + tool.name());
            return client;
        } catch (StepflowException e) {
            throw e;
        } catch (Exception e) {
            throw new ToolInvocationException(
                    tool.name(),
                    null,
                    "Failed to create client for " + tool.name() + ": " + e.getMessage(),
                    e,
                    false);
        }
    }

    private record ClientKey(String tool, Map<String, Object> overrides) {}
}
