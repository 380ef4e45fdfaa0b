package io.stepflow.core;

import io.stepflow.core.execution.parallel.MapRequest;
import io.stepflow.core.reliability.CircuitBreakerConfig;
import io.stepflow.core.reliability.RateLimitConfig;
import io.stepflow.core.reliability.RateLimitStrategy;
import io.stepflow.core.reliability.ReliabilityOptions;
import io.stepflow.core.util.Durations;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Properties;

/// Configuration options for a Stepflow runtime environment.
///
/// Controls thread pool sizing, loop and fan-out limits, the reliability defaults applied to
/// every tool call, and secret caching. Use the {@link Builder} for fluent configuration,
/// {@link #fromProperties(Properties)} to read a properties file, or the setters directly.
///
/// ### Default Values
/// - `threadPoolSize`: `10`
/// - `defaultMaxIterations`: `1000`
/// - `defaultMapConcurrency`: `5`
/// - `reliability`: {@link ReliabilityOptions#defaults()}
/// - `circuitBreaker`: {@link CircuitBreakerConfig#defaults()}
/// - `preloadKnownRateLimits`: `true`
/// - `secretCacheTtl`: 300 seconds
///
/// ### Property keys
/// | Key | Example |
/// |-----|---------|
/// | `stepflow.threadPoolSize` | `16` |
/// | `stepflow.maxIterations` | `500` |
/// | `stepflow.map.concurrency` | `8` |
/// | `stepflow.reliability.timeout` | `10s` |
/// | `stepflow.reliability.maxRetries` | `2` |
/// | `stepflow.reliability.initialRetryDelay` | `500ms` |
/// | `stepflow.reliability.maxRetryDelay` | `20s` |
/// | `stepflow.circuitBreaker.failureThreshold` | `3` |
/// | `stepflow.circuitBreaker.resetTimeout` | `1m` |
/// | `stepflow.circuitBreaker.successThreshold` | `1` |
/// | `stepflow.circuitBreaker.failureWindow` | `2m` |
/// | `stepflow.rateLimit.<service>` | `100/1m`, `5/1s reject` |
/// | `stepflow.rateLimit.preloadKnown` | `false` |
/// | `stepflow.secrets.cacheTtl` | `5m` |
///
/// @implNote **Not thread-safe**. This is a mutable configuration object intended to be
/// configured before passing to {@link StepflowFactory}. Do not modify after environment
/// creation.
///
/// @see StepflowFactory#createEnvironment(StepflowConfig)
/// @see Builder
public class StepflowConfig {

    static final String PREFIX = "stepflow.";

    private int threadPoolSize = 10;
    private int defaultMaxIterations = 1000;
    private int defaultMapConcurrency = MapRequest.DEFAULT_CONCURRENCY;
    private ReliabilityOptions reliability = ReliabilityOptions.defaults();
    private CircuitBreakerConfig circuitBreaker = CircuitBreakerConfig.defaults();
    private final Map<String, RateLimitConfig> rateLimitOverrides = new LinkedHashMap<>();
    private boolean preloadKnownRateLimits = true;
    private Duration secretCacheTtl = Duration.ofSeconds(300);

    /// Creates a configuration with default values.
    public StepflowConfig() {}

    /// Reads a configuration from `stepflow.*` properties.
    ///
    /// Keys that are absent keep their defaults; unrelated keys are ignored.
    ///
    /// @param properties source properties, not null
    /// @return a new configuration, never null
    /// @throws io.stepflow.core.exception.ValidationException if a duration is malformed
    /// @throws IllegalArgumentException if a number or a rate limit is malformed
    public static StepflowConfig fromProperties(Properties properties) {
        Objects.requireNonNull(properties, "properties must not be null");
        StepflowConfig config = new StepflowConfig();

        String value = properties.getProperty(PREFIX + "threadPoolSize");
        if (value != null) {
            config.setThreadPoolSize(parseInt("threadPoolSize", value));
        }
        value = properties.getProperty(PREFIX + "maxIterations");
        if (value != null) {
            config.setDefaultMaxIterations(parseInt("maxIterations", value));
        }
        value = properties.getProperty(PREFIX + "map.concurrency");
        if (value != null) {
            config.setDefaultMapConcurrency(parseInt("map.concurrency", value));
        }

        ReliabilityOptions.Builder reliability = config.reliability.toBuilder();
        value = properties.getProperty(PREFIX + "reliability.timeout");
        if (value != null) {
            reliability.timeoutMs(Durations.parseMillis(value.trim()));
        }
        value = properties.getProperty(PREFIX + "reliability.maxRetries");
        if (value != null) {
            reliability.maxRetries(parseInt("reliability.maxRetries", value));
        }
        value = properties.getProperty(PREFIX + "reliability.initialRetryDelay");
        if (value != null) {
            reliability.initialRetryDelayMs(Durations.parseMillis(value.trim()));
        }
        value = properties.getProperty(PREFIX + "reliability.maxRetryDelay");
        if (value != null) {
            reliability.maxRetryDelayMs(Durations.parseMillis(value.trim()));
        }
        config.setReliability(reliability.build());

        CircuitBreakerConfig breaker = config.circuitBreaker;
        int failureThreshold = breaker.failureThreshold();
        long resetTimeoutMs = breaker.resetTimeoutMs();
        int successThreshold = breaker.successThreshold();
        long failureWindowMs = breaker.failureWindowMs();
        value = properties.getProperty(PREFIX + "circuitBreaker.failureThreshold");
        if (value != null) {
            failureThreshold = parseInt("circuitBreaker.failureThreshold", value);
        }
        value = properties.getProperty(PREFIX + "circuitBreaker.resetTimeout");
        if (value != null) {
            resetTimeoutMs = Durations.parseMillis(value.trim());
        }
        value = properties.getProperty(PREFIX + "circuitBreaker.successThreshold");
        if (value != null) {
            successThreshold = parseInt("circuitBreaker.successThreshold", value);
        }
        value = properties.getProperty(PREFIX + "circuitBreaker.failureWindow");
        if (value != null) {
            failureWindowMs = Durations.parseMillis(value.trim());
        }
        config.setCircuitBreaker(
                new CircuitBreakerConfig(
                        failureThreshold, resetTimeoutMs, successThreshold, failureWindowMs));

        String rateLimitPrefix = PREFIX + "rateLimit.";
        for (String key : properties.stringPropertyNames()) {
            if (!key.startsWith(rateLimitPrefix)) {
                continue;
            }
            String service = key.substring(rateLimitPrefix.length());
            if (service.equals("preloadKnown")) {
                config.setPreloadKnownRateLimits(
                        Boolean.parseBoolean(properties.getProperty(key).trim()));
            } else if (!service.isEmpty()) {
                config.rateLimitOverrides.put(
                        service, parseRateLimit(key, properties.getProperty(key)));
            }
        }

        value = properties.getProperty(PREFIX + "secrets.cacheTtl");
        if (value != null) {
            config.setSecretCacheTtl(Duration.ofMillis(Durations.parseMillis(value.trim())));
        }
        return config;
    }

    /// Parses `<maxRequests>/<window>[ queue|reject]`, for example `100/1m` or `5/1s reject`.
    static RateLimitConfig parseRateLimit(String key, String value) {
        String[] parts = value.trim().split("\\s+");
        String[] rate = parts[0].split("/");
        if (rate.length != 2) {
            throw new IllegalArgumentException(
                    key + " must look like <requests>/<window>, got '" + value + "'");
        }
        RateLimitConfig limit =
                RateLimitConfig.of(
                        parseInt(key.substring(PREFIX.length()), rate[0]),
                        Durations.parseMillis(rate[1]));
        if (parts.length > 1) {
            limit =
                    limit.withStrategy(
                            RateLimitStrategy.valueOf(parts[1].toUpperCase(Locale.ROOT)));
        }
        return limit;
    }

    private static int parseInt(String key, String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(
                    PREFIX + key + " must be an integer, got '" + value + "'", e);
        }
    }

    /// Returns the size of the pool running parallel tasks and guarded calls.
    ///
    /// @return the fixed thread pool size
    public int getThreadPoolSize() {
        return threadPoolSize;
    }

    /// Sets the size of the pool running parallel tasks and guarded calls.
    ///
    /// ### Contracts
    /// - **Precondition**: `threadPoolSize` should be positive
    ///
    /// @param threadPoolSize the number of threads in the fixed pool, must be positive
    public void setThreadPoolSize(int threadPoolSize) {
        this.threadPoolSize = threadPoolSize;
    }

    /// Returns the iteration cap of `while` steps that set none.
    public int getDefaultMaxIterations() {
        return defaultMaxIterations;
    }

    public void setDefaultMaxIterations(int defaultMaxIterations) {
        this.defaultMaxIterations = defaultMaxIterations;
    }

    /// Returns the concurrency of `parallel.map` when the step sets none.
    public int getDefaultMapConcurrency() {
        return defaultMapConcurrency;
    }

    public void setDefaultMapConcurrency(int defaultMapConcurrency) {
        this.defaultMapConcurrency = defaultMapConcurrency;
    }

    /// Returns the reliability settings applied to every tool call.
    ///
    /// @return reliability defaults, never null
    public ReliabilityOptions getReliability() {
        return reliability;
    }

    public void setReliability(ReliabilityOptions reliability) {
        this.reliability = Objects.requireNonNull(reliability, "reliability must not be null");
    }

    public CircuitBreakerConfig getCircuitBreaker() {
        return circuitBreaker;
    }

    public void setCircuitBreaker(CircuitBreakerConfig circuitBreaker) {
        this.circuitBreaker =
                Objects.requireNonNull(circuitBreaker, "circuitBreaker must not be null");
    }

    /// Returns per-service rate limits that replace or extend the known ones.
    ///
    /// @return mutable map of service name to limit, never null
    public Map<String, RateLimitConfig> getRateLimitOverrides() {
        return rateLimitOverrides;
    }

    /// Returns whether published limits of common services are configured at startup.
    public boolean isPreloadKnownRateLimits() {
        return preloadKnownRateLimits;
    }

    public void setPreloadKnownRateLimits(boolean preloadKnownRateLimits) {
        this.preloadKnownRateLimits = preloadKnownRateLimits;
    }

    /// Returns how long a resolved secret stays cached.
    ///
    /// @return cache TTL, never null
    public Duration getSecretCacheTtl() {
        return secretCacheTtl;
    }

    public void setSecretCacheTtl(Duration secretCacheTtl) {
        this.secretCacheTtl =
                Objects.requireNonNull(secretCacheTtl, "secretCacheTtl must not be null");
    }

    /// Creates a new builder for fluent configuration construction.
    ///
    /// @return a new builder instance, never null
    public static Builder builder() {
        return new Builder();
    }

    /// Fluent builder for constructing {@link StepflowConfig} instances.
    ///
    /// @implNote The builder mutates a single config instance and returns it on
    /// {@link #build()}. The returned config can still be modified via setters after building.
    public static class Builder {
        private final StepflowConfig config = new StepflowConfig();

        /// Sets the thread pool size.
        ///
        /// @param threadPoolSize the number of threads, must be positive
        /// @return this builder for chaining, never null
        public Builder threadPoolSize(int threadPoolSize) {
            config.threadPoolSize = threadPoolSize;
            return this;
        }

        public Builder defaultMaxIterations(int defaultMaxIterations) {
            config.defaultMaxIterations = defaultMaxIterations;
            return this;
        }

        public Builder defaultMapConcurrency(int defaultMapConcurrency) {
            config.defaultMapConcurrency = defaultMapConcurrency;
            return this;
        }

        public Builder reliability(ReliabilityOptions reliability) {
            config.setReliability(reliability);
            return this;
        }

        public Builder circuitBreaker(CircuitBreakerConfig circuitBreaker) {
            config.setCircuitBreaker(circuitBreaker);
            return this;
        }

        /// Adds or replaces the rate limit of one service.
        ///
        /// @param service service name, not null
        /// @param limit limit to apply, not null
        /// @return this builder for chaining, never null
        public Builder rateLimit(String service, RateLimitConfig limit) {
            Objects.requireNonNull(service, "service must not be null");
            Objects.requireNonNull(limit, "limit must not be null");
            config.rateLimitOverrides.put(service, limit);
            return this;
        }

        public Builder preloadKnownRateLimits(boolean preloadKnownRateLimits) {
            config.preloadKnownRateLimits = preloadKnownRateLimits;
            return this;
        }

        public Builder secretCacheTtl(Duration secretCacheTtl) {
            config.setSecretCacheTtl(secretCacheTtl);
            return this;
        }

        /// Builds and returns the configured {@link StepflowConfig} instance.
        ///
        /// @return the configured instance, never null
        public StepflowConfig build() {
            return config;
        }
    }
}
