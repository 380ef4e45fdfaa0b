package io.stepflow.core.workflow;

import java.util.Locale;

/// What the engine does when a top-level step fails and nothing handles the error.
public enum ErrorHandling {
    /// Halt the run with status `failed`.
    STOP,
    /// Record the error in `last_error` and proceed to the next top-level step.
    CONTINUE;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static ErrorHandling fromWireName(String value) {
        return value == null ? STOP : valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
