package io.stepflow.core.workflow.step;

import java.util.Arrays;
import java.util.Locale;

/// Discriminator of the {@link WorkflowStep} hierarchy, used by executor dispatch and
/// serialization.
public enum StepType {
    ACTION,
    IF,
    FOR_EACH,
    WHILE,
    SWITCH,
    TRY,
    PARALLEL;

    /// Returns the serialized form (`action`, `for_each`, ...).
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /// Parses a serialized step type.
    ///
    /// @param value wire name, not null
    /// @return the step type, never null
    /// @throws IllegalArgumentException if the name is unknown
    public static StepType fromWireName(String value) {
        return Arrays.stream(values())
                .filter(type -> type.wireName().equals(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown step type: " + value));
    }
}
