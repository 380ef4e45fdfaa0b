package io.stepflow.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.stepflow.core.workflow.step.ActionStep;
import io.stepflow.core.workflow.step.ForEachStep;
import io.stepflow.core.workflow.step.IfStep;
import io.stepflow.core.workflow.step.ParallelStep;
import io.stepflow.core.workflow.step.StepErrorPolicy;
import io.stepflow.core.workflow.step.SwitchStep;
import io.stepflow.core.workflow.step.TryStep;
import io.stepflow.core.workflow.step.WhileStep;
import io.stepflow.core.workflow.step.WorkflowStep;
import java.io.IOException;
import java.io.Serial;
import java.util.List;
import java.util.Map;

/// Serializes all `WorkflowStep` subtypes to JSON with a `"type"` discriminator field.
///
/// Every serialized object begins with `"id"` and `"type"`, followed by subtype-specific
/// fields. Optional fields are omitted when null or empty.
///
/// ```
/// type       Additional fields
/// -----------+------------------------------------------------------------------
/// action     | name, action, inputs, outputVariable, conditions, errorPolicy,
///            | timeoutMs
/// if         | condition, then, else
/// for_each   | items, itemVariable, indexVariable, steps, outputVariable
/// while      | condition, steps, maxIterations
/// switch     | expression, cases, default
/// try        | try, catch, finally
/// parallel   | mode, spec, outputVariable
/// ```
///
/// @implNote Package-private. Registered by {@link StepflowJacksonModule}.
/// @see WorkflowStepDeserializer for the inverse operation
class WorkflowStepSerializer extends StdSerializer<WorkflowStep> {

    @Serial private static final long serialVersionUID = -3390785046122574519L;

    WorkflowStepSerializer() {
        super(WorkflowStep.class);
    }

    /// Writes a step to JSON, dispatching on its {@link io.stepflow.core.workflow.step.StepType}.
    ///
    /// @param step the step to serialize, not null
    /// @param gen the JSON generator, not null
    /// @param provider the serializer provider, not null
    /// @throws IOException if a write error occurs
    @Override
    public void serialize(WorkflowStep step, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        gen.writeStartObject();
        gen.writeStringField("id", step.id());
        gen.writeStringField("type", step.type().wireName());

        switch (step.type()) {
            case ACTION -> writeAction((ActionStep) step, gen, provider);
            case IF -> writeIf((IfStep) step, gen, provider);
            case FOR_EACH -> writeForEach((ForEachStep) step, gen, provider);
            case WHILE -> writeWhile((WhileStep) step, gen, provider);
            case SWITCH -> writeSwitch((SwitchStep) step, gen, provider);
            case TRY -> writeTry((TryStep) step, gen, provider);
            case PARALLEL -> writeParallel((ParallelStep) step, gen, provider);
        }

        gen.writeEndObject();
    }

    private void writeAction(ActionStep s, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        writeIfNotNull(gen, "name", s.name());
        gen.writeStringField("action", s.action());
        if (!s.inputs().isEmpty()) {
            provider.defaultSerializeField("inputs", s.inputs(), gen);
        }
        writeIfNotNull(gen, "outputVariable", s.outputVariable());
        if (!s.conditions().isEmpty()) {
            provider.defaultSerializeField("conditions", s.conditions(), gen);
        }
        StepErrorPolicy policy = s.errorPolicy();
        if (!StepErrorPolicy.NONE.equals(policy)) {
            gen.writeObjectFieldStart("errorPolicy");
            gen.writeNumberField("maxRetries", policy.maxRetries());
            gen.writeBooleanField("continueOnError", policy.continueOnError());
            gen.writeEndObject();
        }
        if (s.timeoutMs() != null) {
            gen.writeNumberField("timeoutMs", s.timeoutMs());
        }
    }

    private void writeIf(IfStep s, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        gen.writeStringField("condition", s.condition());
        writeSteps(gen, provider, "then", s.thenSteps());
        writeSteps(gen, provider, "else", s.elseSteps());
    }

    private void writeForEach(ForEachStep s, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        gen.writeStringField("items", s.items());
        gen.writeStringField("itemVariable", s.itemVariable());
        gen.writeStringField("indexVariable", s.indexVariable());
        provider.defaultSerializeField("steps", s.steps(), gen);
        writeIfNotNull(gen, "outputVariable", s.outputVariable());
    }

    private void writeWhile(WhileStep s, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        gen.writeStringField("condition", s.condition());
        provider.defaultSerializeField("steps", s.steps(), gen);
        if (s.maxIterations() != null) {
            gen.writeNumberField("maxIterations", s.maxIterations());
        }
    }

    private void writeSwitch(SwitchStep s, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        gen.writeStringField("expression", s.expression());
        gen.writeObjectFieldStart("cases");
        for (Map.Entry<String, List<WorkflowStep>> entry : s.cases().entrySet()) {
            provider.defaultSerializeField(entry.getKey(), entry.getValue(), gen);
        }
        gen.writeEndObject();
        writeSteps(gen, provider, "default", s.defaultSteps());
    }

    private void writeTry(TryStep s, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        provider.defaultSerializeField("try", s.trySteps(), gen);
        writeSteps(gen, provider, "catch", s.catchSteps());
        writeSteps(gen, provider, "finally", s.finallySteps());
    }

    private void writeParallel(ParallelStep s, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        gen.writeStringField("mode", s.mode().wireName());
        provider.defaultSerializeField("spec", s.spec(), gen);
        writeIfNotNull(gen, "outputVariable", s.outputVariable());
    }

    private void writeSteps(
            JsonGenerator gen, SerializerProvider provider, String field, List<WorkflowStep> steps)
            throws IOException {
        if (!steps.isEmpty()) {
            provider.defaultSerializeField(field, steps, gen);
        }
    }

    private void writeIfNotNull(JsonGenerator gen, String field, String value)
            throws IOException {
        if (value != null) {
            gen.writeStringField(field, value);
        }
    }
}
