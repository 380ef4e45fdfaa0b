package io.stepflow.core.tool.secret;

import io.stepflow.core.exception.SecretNotFoundException;
import io.stepflow.core.exception.ValidationException;
import io.stepflow.core.util.JsonUtil;
import java.util.Objects;
import java.util.function.Function;
import java.util.logging.Logger;

/// Reads secrets from environment variables.
///
/// The variable name is the path, or `<prefix>_<path>` when a prefix is set. Values that parse
/// as JSON are returned parsed so `#key` extraction can reach into them; anything else is
/// returned as the raw string.
public final class EnvironmentSecretProvider implements SecretProvider {

    private static final Logger logger =
            Logger.getLogger(EnvironmentSecretProvider.class.getName());

    private final String prefix;
    private final Function<String, String> lookup;

    public EnvironmentSecretProvider() {
        this("", System::getenv);
    }

    /// @param prefix variable name prefix, may be empty
    /// @param lookup variable lookup, usually `System::getenv`, not null
    public EnvironmentSecretProvider(String prefix, Function<String, String> lookup) {
        this.prefix = prefix == null ? "" : prefix;
        this.lookup = Objects.requireNonNull(lookup, "lookup must not be null");
    }

    @Override
    public Object getSecret(String path) {
        String variable = variableName(path);
        String value = lookup.apply(variable);
        if (value == null) {
            throw new SecretNotFoundException("Environment variable not found: " + variable);
        }
        String trimmed = value.trim();
        if (trimmed.startsWith("{") || trimmed.startsWith("[")) {
            try {
                return JsonUtil.parse(trimmed);
            } catch (ValidationException e) {
                logger.fine("Secret " + variable + " is not JSON, using raw value");
            }
        }
        return value;
    }

    @Override
    public boolean exists(String path) {
        return lookup.apply(variableName(path)) != null;
    }

    private String variableName(String path) {
        Objects.requireNonNull(path, "path must not be null");
        return prefix.isEmpty() ? path : prefix + "_" + path;
    }
}
