package io.stepflow.core.execution.parallel;

import io.stepflow.core.exception.ValidationException;
import java.util.Locale;

/// When a `spawn` call stops waiting for its tasks.
public enum WaitPolicy {
    /// Every task settled.
    ALL,
    /// The first task succeeded, or every task failed.
    ANY,
    /// More than half of the tasks settled.
    MAJORITY;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /// Returns whether enough tasks settled for this policy.
    ///
    /// @param total number of tasks
    /// @param settled tasks settled so far
    /// @param succeeded tasks settled successfully so far
    boolean isSatisfied(int total, int settled, int succeeded) {
        return switch (this) {
            case ALL -> settled >= total;
            case ANY -> succeeded > 0 || settled >= total;
            case MAJORITY -> settled > total / 2;
        };
    }

    /// Parses a wait policy, defaulting to {@link #ALL} when absent.
    ///
    /// @throws ValidationException if the value is not a known policy
    public static WaitPolicy fromValue(Object value) {
        if (value == null) {
            return ALL;
        }
        String name = value.toString().trim().toUpperCase(Locale.ROOT);
        try {
            return valueOf(name);
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Unknown wait policy: " + value, e);
        }
    }
}
