package io.stepflow.core.workflow.step;

/// Step-level failure handling.
///
/// @param maxRetries additional attempts after a retryable failure, non-negative
/// @param continueOnError store `{error, step}` as the step result instead of failing
public record StepErrorPolicy(int maxRetries, boolean continueOnError) {

    public static final StepErrorPolicy NONE = new StepErrorPolicy(0, false);

    public StepErrorPolicy {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must not be negative");
        }
    }
}
