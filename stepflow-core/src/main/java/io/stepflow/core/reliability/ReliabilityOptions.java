package io.stepflow.core.reliability;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/// Settings for one wrapped client or one guarded call.
///
/// Defaults: timeout 30 s, 3 retries, 1 s initial delay doubling up to 30 s, circuit breaker
/// and rate limiter enabled, retry on status 429, 500, 502, 503 and 504.
///
/// {@snippet :
/// ReliabilityOptions options = ReliabilityOptions.builder()
///         .timeoutMs(5_000)
///         .maxRetries(1)
///         .inputSchema("github.issues.create", InputSchemas.REFERENCE.get("github.issues.create"))
///         .build();
/// }
public final class ReliabilityOptions {

    public static final long DEFAULT_TIMEOUT_MS = 30_000;
    public static final int DEFAULT_MAX_RETRIES = 3;
    public static final long DEFAULT_INITIAL_RETRY_DELAY_MS = 1_000;
    public static final long DEFAULT_MAX_RETRY_DELAY_MS = 30_000;
    public static final Set<Integer> DEFAULT_RETRY_ON = Set.of(429, 500, 502, 503, 504);

    private final long timeoutMs;
    private final int maxRetries;
    private final long initialRetryDelayMs;
    private final long maxRetryDelayMs;
    private final boolean circuitBreaker;
    private final boolean rateLimiter;
    private final Set<Integer> retryOn;
    private final Map<String, InputSchema> inputSchemas;

    private ReliabilityOptions(Builder builder) {
        if (builder.timeoutMs <= 0) {
            throw new IllegalArgumentException("timeoutMs must be positive");
        }
        if (builder.maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must not be negative");
        }
        this.timeoutMs = builder.timeoutMs;
        this.maxRetries = builder.maxRetries;
        this.initialRetryDelayMs = builder.initialRetryDelayMs;
        this.maxRetryDelayMs = builder.maxRetryDelayMs;
        this.circuitBreaker = builder.circuitBreaker;
        this.rateLimiter = builder.rateLimiter;
        this.retryOn = Set.copyOf(builder.retryOn);
        this.inputSchemas = Map.copyOf(builder.inputSchemas);
    }

    public static ReliabilityOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .timeoutMs(timeoutMs)
                .maxRetries(maxRetries)
                .initialRetryDelayMs(initialRetryDelayMs)
                .maxRetryDelayMs(maxRetryDelayMs)
                .circuitBreaker(circuitBreaker)
                .rateLimiter(rateLimiter)
                .retryOn(retryOn)
                .inputSchemas(inputSchemas);
    }

    public long getTimeoutMs() {
        return timeoutMs;
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    public long getInitialRetryDelayMs() {
        return initialRetryDelayMs;
    }

    public long getMaxRetryDelayMs() {
        return maxRetryDelayMs;
    }

    public boolean isCircuitBreaker() {
        return circuitBreaker;
    }

    public boolean isRateLimiter() {
        return rateLimiter;
    }

    public Set<Integer> getRetryOn() {
        return retryOn;
    }

    public Map<String, InputSchema> getInputSchemas() {
        return inputSchemas;
    }

    public BackoffPolicy backoffPolicy() {
        return new BackoffPolicy(
                initialRetryDelayMs, Math.max(initialRetryDelayMs, maxRetryDelayMs));
    }

    public static final class Builder {
        private long timeoutMs = DEFAULT_TIMEOUT_MS;
        private int maxRetries = DEFAULT_MAX_RETRIES;
        private long initialRetryDelayMs = DEFAULT_INITIAL_RETRY_DELAY_MS;
        private long maxRetryDelayMs = DEFAULT_MAX_RETRY_DELAY_MS;
        private boolean circuitBreaker = true;
        private boolean rateLimiter = true;
        private Set<Integer> retryOn = DEFAULT_RETRY_ON;
        private final Map<String, InputSchema> inputSchemas = new HashMap<>();

        private Builder() {}

        public Builder timeoutMs(long timeoutMs) {
            this.timeoutMs = timeoutMs;
            return this;
        }

        public Builder maxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
            return this;
        }

        public Builder initialRetryDelayMs(long initialRetryDelayMs) {
            this.initialRetryDelayMs = initialRetryDelayMs;
            return this;
        }

        public Builder maxRetryDelayMs(long maxRetryDelayMs) {
            this.maxRetryDelayMs = maxRetryDelayMs;
            return this;
        }

        public Builder circuitBreaker(boolean circuitBreaker) {
            this.circuitBreaker = circuitBreaker;
            return this;
        }

        public Builder rateLimiter(boolean rateLimiter) {
            this.rateLimiter = rateLimiter;
            return this;
        }

        public Builder retryOn(Set<Integer> retryOn) {
            this.retryOn = Objects.requireNonNull(retryOn, "retryOn must not be null");
            return this;
        }

        public Builder inputSchema(String actionPath, InputSchema schema) {
            Objects.requireNonNull(actionPath, "actionPath must not be null");
            Objects.requireNonNull(schema, "schema must not be null");
            this.inputSchemas.put(actionPath, schema);
            return this;
        }

        public Builder inputSchemas(Map<String, InputSchema> schemas) {
            Objects.requireNonNull(schemas, "schemas must not be null");
            this.inputSchemas.putAll(schemas);
            return this;
        }

        public ReliabilityOptions build() {
            return new ReliabilityOptions(this);
        }
    }
}
