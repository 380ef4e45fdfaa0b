package io.stepflow.core.execution.parallel;

import io.stepflow.core.exception.ValidationException;
import java.util.Locale;

/// What a fan-out does when one of its tasks fails.
public enum FailurePolicy {
    /// Fail the whole call on the first task failure.
    FAIL,
    /// Record the failure and keep going.
    CONTINUE;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /// Parses a failure policy.
    ///
    /// @param value wire name, may be null
    /// @param defaultPolicy policy used when the value is null
    /// @throws ValidationException if the value is not a known policy
    public static FailurePolicy fromValue(Object value, FailurePolicy defaultPolicy) {
        if (value == null) {
            return defaultPolicy;
        }
        try {
            return valueOf(value.toString().trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Unknown onError policy: " + value, e);
        }
    }
}
