package io.stepflow.core.reliability;

/// Per-call overrides of {@link ReliabilityOptions}. Null fields keep the wrapper's setting.
///
/// @param timeoutMs call timeout, may be null
/// @param maxRetries retry budget, may be null
/// @param skipValidation whether to bypass the input schema
public record CallOptions(Long timeoutMs, Integer maxRetries, boolean skipValidation) {

    public static final CallOptions NONE = new CallOptions(null, null, false);

    public ReliabilityOptions applyTo(ReliabilityOptions options) {
        ReliabilityOptions.Builder builder = options.toBuilder();
        if (timeoutMs != null) {
            builder.timeoutMs(timeoutMs);
        }
        if (maxRetries != null) {
            builder.maxRetries(maxRetries);
        }
        return builder.build();
    }
}
