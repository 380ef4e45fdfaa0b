package io.stepflow.serialization.mixin;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import io.stepflow.core.workflow.Workflow;

/// Jackson mixin that binds `Workflow` deserialization to its builder.
///
/// Applied to `Workflow.class` via `StepflowJacksonModule.setupModule()`. Instructs Jackson to
/// use `Workflow.Builder` when deserializing, so the builder's validation (required id, unique
/// step ids) runs on every restored workflow.
///
/// @apiNote The companion mixin {@link WorkflowBuilderMixin} must also be registered so Jackson
/// knows how to invoke the builder's setters and `build()` method.
///
/// @see WorkflowBuilderMixin
/// @see io.stepflow.serialization.StepflowJacksonModule
@JsonDeserialize(builder = Workflow.Builder.class)
public abstract class WorkflowMixin {}
