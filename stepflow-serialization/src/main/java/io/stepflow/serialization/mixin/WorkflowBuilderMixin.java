package io.stepflow.serialization.mixin;

import com.fasterxml.jackson.databind.annotation.JsonPOJOBuilder;

/// Jackson mixin for `Workflow.Builder` that configures POJO builder deserialization.
///
/// Sets `withPrefix = ""` so Jackson maps JSON field names directly to builder setter names.
///
/// @see WorkflowMixin
@JsonPOJOBuilder(withPrefix = "")
public abstract class WorkflowBuilderMixin {}
