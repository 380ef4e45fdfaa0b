package io.stepflow.serialization;

import com.fasterxml.jackson.databind.module.SimpleModule;
import io.stepflow.core.checkpoint.CheckpointStatus;
import io.stepflow.core.execution.ExecutionStatus;
import io.stepflow.core.workflow.ErrorHandling;
import io.stepflow.core.workflow.Workflow;
import io.stepflow.core.workflow.step.WorkflowStep;
import io.stepflow.serialization.mixin.WireNameEnumMixin;
import io.stepflow.serialization.mixin.WorkflowBuilderMixin;
import io.stepflow.serialization.mixin.WorkflowMixin;
import java.io.Serial;

/// Jackson `SimpleModule` that registers all Stepflow serialization configuration in one place.
///
/// Covers three registration strategies:
///
/// **Custom serializer/deserializer pair** for the sealed step hierarchy. The `"type"`
/// discriminator drives subtype selection:
/// - `WorkflowStep` - {@link WorkflowStepSerializer} / {@link WorkflowStepDeserializer}
///
/// **Mixin/builder pair** for the immutable workflow definition:
/// - `Workflow` + `Workflow.Builder`
///
/// **Wire-name enum mixin** so statuses are written in lowercase:
/// - `ErrorHandling`, `ExecutionStatus`, `CheckpointStatus`
///
/// Records (`WorkflowInput`, `ToolConfig`, `Checkpoint`, `ExecutionRecord`) need no
/// registration; Jackson binds them through their canonical constructors.
///
/// @implNote All registrations are explicit, with no classpath scanning.
/// @see WorkflowSerializer for the convenience factory API
public class StepflowJacksonModule extends SimpleModule {

    @Serial private static final long serialVersionUID = 4412907561822137730L;

    /// Constructs the module and registers the step serializer/deserializer pair.
    ///
    /// Mixin registrations are deferred to {@link #setupModule} where the `SetupContext` is
    /// available.
    public StepflowJacksonModule() {
        super("StepflowJacksonModule");

        addSerializer(WorkflowStep.class, new WorkflowStepSerializer());
        addDeserializer(WorkflowStep.class, new WorkflowStepDeserializer());
    }

    /// Applies mixin annotations to builder-pattern domain types and wire-name enums.
    ///
    /// @param context the setup context provided by Jackson, not null
    @Override
    public void setupModule(SetupContext context) {
        super.setupModule(context);

        context.setMixInAnnotations(Workflow.class, WorkflowMixin.class);
        context.setMixInAnnotations(Workflow.Builder.class, WorkflowBuilderMixin.class);

        context.setMixInAnnotations(ErrorHandling.class, WireNameEnumMixin.class);
        context.setMixInAnnotations(ExecutionStatus.class, WireNameEnumMixin.class);
        context.setMixInAnnotations(CheckpointStatus.class, WireNameEnumMixin.class);
    }
}
