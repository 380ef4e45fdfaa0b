package io.stepflow.core.checkpoint;

import java.util.Locale;

/// Lifecycle of one step occurrence.
public enum CheckpointStatus {
    PENDING,
    COMPLETED,
    FAILED,
    SKIPPED;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
