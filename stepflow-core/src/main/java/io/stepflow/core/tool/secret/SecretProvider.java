package io.stepflow.core.tool.secret;

/// Backend that stores secrets, addressed by `<scheme>://<path>` references.
public interface SecretProvider {

    /// Fetches a secret.
    ///
    /// @param path provider-specific path, not null
    /// @return the secret value: a string, or a map when the stored value is a JSON object
    /// @throws io.stepflow.core.exception.SecretNotFoundException if the secret does not exist
    Object getSecret(String path);

    /// Returns whether the secret exists without fetching it.
    default boolean exists(String path) {
        return false;
    }
}
