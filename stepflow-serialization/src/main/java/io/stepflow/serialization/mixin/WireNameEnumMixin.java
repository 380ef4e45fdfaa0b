package io.stepflow.serialization.mixin;

import com.fasterxml.jackson.annotation.JsonValue;

/// Jackson mixin for enums that expose a lowercase `wireName()`.
///
/// Applied to `ErrorHandling`, `ExecutionStatus` and `CheckpointStatus`. Jackson writes the
/// wire name and, because `@JsonValue` also drives enum deserialization, reads it back.
public abstract class WireNameEnumMixin {

    @JsonValue
    public abstract String wireName();
}
