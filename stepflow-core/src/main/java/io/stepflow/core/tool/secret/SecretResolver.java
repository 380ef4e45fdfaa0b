package io.stepflow.core.tool.secret;

import io.stepflow.core.exception.SecretNotFoundException;
import io.stepflow.core.util.Values;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/// Resolves `${secret:<provider>://<path>[#<key>]}` references against registered providers.
///
/// - `<provider>` selects a {@link SecretProvider} by scheme (`env` is registered by the
///   factory)
/// - `#<key>` extracts a dotted key from a JSON-object secret
/// - resolved values are cached per reference for the configured TTL
///
/// ### Usage
/// {@snippet :
/// SecretResolver secrets = new SecretResolver(Duration.ofMinutes(5));
/// secrets.registerProvider("env", new EnvironmentSecretProvider());
///
/// // SLACK='{"bot":{"token":"xoxb-1"}}'
/// secrets.getSecret("${secret:env://SLACK#bot.token}");   // "xoxb-1"
/// secrets.resolveReferences(Map.of("token", "Bearer ${secret:env://API_TOKEN}"));
/// }
///
/// @implNote Thread-safe. Two threads missing the cache at once may both fetch.
public class SecretResolver {

    private static final Pattern EMBEDDED = Pattern.compile("\\$\\{secret:[^}]+}");
    private static final Pattern REFERENCE = Pattern.compile("^([^:]+)://([^#]+)(#(.+))?$");

    private final Map<String, SecretProvider> providers = new ConcurrentHashMap<>();
    private final Map<String, CachedSecret> cache = new ConcurrentHashMap<>();
    private final Duration ttl;
    private final Clock clock;

    public SecretResolver(Duration ttl) {
        this(ttl, Clock.systemUTC());
    }

    public SecretResolver(Duration ttl, Clock clock) {
        this.ttl = Objects.requireNonNull(ttl, "ttl must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    public void registerProvider(String scheme, SecretProvider provider) {
        Objects.requireNonNull(scheme, "scheme must not be null");
        Objects.requireNonNull(provider, "provider must not be null");
        providers.put(scheme, provider);
    }

    /// Returns whether a string contains at least one secret reference.
    public static boolean containsReference(String value) {
        return value != null && EMBEDDED.matcher(value).find();
    }

    /// Resolves a single reference, with or without the `${secret:` wrapper.
    ///
    /// @param reference secret reference, not null
    /// @return secret value rendered as a string
    /// @throws SecretNotFoundException if the reference is malformed, the provider is not
    ///     configured, or the secret or key does not exist
    public String getSecret(String reference) {
        Objects.requireNonNull(reference, "reference must not be null");
        CachedSecret cached = cache.get(reference);
        long now = clock.millis();
        if (cached != null) {
            if (cached.expiresAt() > now) {
                return cached.value();
            }
            cache.remove(reference, cached);
        }
        String value = fetch(reference);
        cache.put(reference, new CachedSecret(value, now + ttl.toMillis()));
        return value;
    }

    /// Replaces every embedded reference in a value. Maps and lists are walked recursively;
    /// other values are returned unchanged.
    ///
    /// @param value value possibly holding references, may be null
    /// @return value with references replaced, may be null
    public Object resolveReferences(Object value) {
        if (value instanceof String text) {
            return resolveString(text);
        }
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> resolved = new LinkedHashMap<>();
            map.forEach((k, v) -> resolved.put(String.valueOf(k), resolveReferences(v)));
            return resolved;
        }
        if (value instanceof Collection<?> collection) {
            List<Object> resolved = new ArrayList<>();
            collection.forEach(element -> resolved.add(resolveReferences(element)));
            return resolved;
        }
        return value;
    }

    public void clearCache() {
        cache.clear();
    }

    private String resolveString(String text) {
        Matcher matcher = EMBEDDED.matcher(text);
        StringBuilder result = new StringBuilder();
        while (matcher.find()) {
            matcher.appendReplacement(result, Matcher.quoteReplacement(getSecret(matcher.group())));
        }
        matcher.appendTail(result);
        return result.toString();
    }

    private String fetch(String reference) {
        String cleaned = reference.trim();
        if (cleaned.startsWith("${") && cleaned.endsWith("}")) {
            cleaned = cleaned.substring(2, cleaned.length() - 1);
        }
        if (cleaned.startsWith("secret:")) {
            cleaned = cleaned.substring("secret:".length());
        }
        Matcher matcher = REFERENCE.matcher(cleaned);
        if (!matcher.matches()) {
            throw new SecretNotFoundException("Invalid secret reference format: " + reference);
        }
        String scheme = matcher.group(1);
        SecretProvider provider = providers.get(scheme);
        if (provider == null) {
            throw new SecretNotFoundException("Provider '" + scheme + "' not configured");
        }
        Object secret;
        try {
            secret = provider.getSecret(matcher.group(2));
        } catch (SecretNotFoundException e) {
            throw new SecretNotFoundException(
                    "Secret not found: " + reference + " - " + e.getMessage(), e);
        }
        String key = matcher.group(4);
        if (key != null && secret instanceof Map<?, ?>) {
            secret = extractKey(secret, key);
        }
        return Values.stringify(secret);
    }

    private static Object extractKey(Object value, String key) {
        Object current = value;
        for (String part : key.split("\\.")) {
            if (current instanceof Map<?, ?> map && map.containsKey(part)) {
                current = map.get(part);
            } else {
                throw new SecretNotFoundException("Key '" + key + "' not found in secret");
            }
        }
        return current;
    }

    private record CachedSecret(String value, long expiresAt) {}
}
