package io.stepflow.serialization;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import io.stepflow.core.util.Durations;
import io.stepflow.core.workflow.step.ActionStep;
import io.stepflow.core.workflow.step.ForEachStep;
import io.stepflow.core.workflow.step.IfStep;
import io.stepflow.core.workflow.step.ParallelStep;
import io.stepflow.core.workflow.step.StepErrorPolicy;
import io.stepflow.core.workflow.step.StepType;
import io.stepflow.core.workflow.step.SwitchStep;
import io.stepflow.core.workflow.step.TryStep;
import io.stepflow.core.workflow.step.WhileStep;
import io.stepflow.core.workflow.step.WorkflowStep;
import java.io.IOException;
import java.io.Serial;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/// Deserializes JSON to the appropriate `WorkflowStep` subtype using the `"type"` discriminator.
///
/// Nested step lists recurse through the same deserializer. Step inputs, conditions and
/// parallel specs stay unevaluated; they are plain JSON values converted with `convertValue`.
///
/// Accepted aliases:
/// - `timeout` (number or duration string such as `"30s"`) for `timeoutMs`
/// - `continueOnError` at step level for `errorPolicy.continueOnError`
///
/// @implNote Package-private. Registered by {@link StepflowJacksonModule}.
/// @see WorkflowStepSerializer for the inverse operation
class WorkflowStepDeserializer extends StdDeserializer<WorkflowStep> {

    @Serial private static final long serialVersionUID = 7052218467715325840L;

    private static final TypeReference<List<WorkflowStep>> STEP_LIST = new TypeReference<>() {};
    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {};
    private static final TypeReference<Map<String, Object>> OBJECT_MAP = new TypeReference<>() {};

    WorkflowStepDeserializer() {
        super(WorkflowStep.class);
    }

    /// Reads `"id"` and `"type"` and dispatches to the subtype reader.
    ///
    /// @param p the JSON parser positioned at the start of the step object, not null
    /// @param ctxt the deserialization context, not null
    /// @return the constructed step, never null
    /// @throws IOException if `"id"` or `"type"` is absent or the type is unknown
    @Override
    public WorkflowStep deserialize(JsonParser p, DeserializationContext ctxt)
            throws IOException {
        ObjectMapper mapper = (ObjectMapper) p.getCodec();
        JsonNode root = mapper.readTree(p);

        String id = requiredText(root, "id", "step");
        String typeName = requiredText(root, "type", "step '" + id + "'");
        StepType type;
        try {
            type = StepType.fromWireName(typeName);
        } catch (IllegalArgumentException e) {
            throw new IOException(
                    "Unknown step type '" + typeName + "' for step '" + id + "'", e);
        }

        return switch (type) {
            case ACTION -> readAction(mapper, root, id);
            case IF ->
                    new IfStep(
                            id,
                            requiredText(root, "condition", "if step '" + id + "'"),
                            readSteps(mapper, root, "then"),
                            readSteps(mapper, root, "else"));
            case FOR_EACH ->
                    new ForEachStep(
                            id,
                            requiredText(root, "items", "for_each step '" + id + "'"),
                            textOrNull(root, "itemVariable"),
                            textOrNull(root, "indexVariable"),
                            readSteps(mapper, root, "steps"),
                            textOrNull(root, "outputVariable"));
            case WHILE ->
                    new WhileStep(
                            id,
                            requiredText(root, "condition", "while step '" + id + "'"),
                            readSteps(mapper, root, "steps"),
                            root.hasNonNull("maxIterations")
                                    ? root.get("maxIterations").asInt()
                                    : null);
            case SWITCH -> readSwitch(mapper, root, id);
            case TRY ->
                    new TryStep(
                            id,
                            readSteps(mapper, root, "try"),
                            readSteps(mapper, root, "catch"),
                            readSteps(mapper, root, "finally"));
            case PARALLEL ->
                    new ParallelStep(
                            id,
                            ParallelStep.Mode.fromWireName(
                                    requiredText(root, "mode", "parallel step '" + id + "'")),
                            readValue(mapper, root, "spec", OBJECT_MAP),
                            textOrNull(root, "outputVariable"));
        };
    }

    private ActionStep readAction(ObjectMapper mapper, JsonNode root, String id)
            throws IOException {
        int maxRetries = 0;
        boolean continueOnError = root.path("continueOnError").asBoolean(false);
        if (root.hasNonNull("errorPolicy")) {
            JsonNode policy = root.get("errorPolicy");
            maxRetries = policy.path("maxRetries").asInt(0);
            continueOnError = policy.path("continueOnError").asBoolean(continueOnError);
        }

        Long timeoutMs = null;
        JsonNode timeout =
                root.hasNonNull("timeoutMs") ? root.get("timeoutMs") : root.get("timeout");
        if (timeout != null && !timeout.isNull()) {
            timeoutMs =
                    Durations.parseMillis(timeout.isNumber() ? timeout.asLong() : timeout.asText());
        }

        return ActionStep.builder(id, requiredText(root, "action", "action step '" + id + "'"))
                .name(textOrNull(root, "name"))
                .inputs(readValue(mapper, root, "inputs", OBJECT_MAP))
                .outputVariable(textOrNull(root, "outputVariable"))
                .conditions(readValue(mapper, root, "conditions", STRING_LIST))
                .errorPolicy(new StepErrorPolicy(maxRetries, continueOnError))
                .timeoutMs(timeoutMs)
                .build();
    }

    private SwitchStep readSwitch(ObjectMapper mapper, JsonNode root, String id)
            throws IOException {
        Map<String, List<WorkflowStep>> cases = new LinkedHashMap<>();
        JsonNode casesNode = root.get("cases");
        if (casesNode != null && casesNode.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> fields = casesNode.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> entry = fields.next();
                cases.put(entry.getKey(), mapper.convertValue(entry.getValue(), STEP_LIST));
            }
        }
        return new SwitchStep(
                id,
                requiredText(root, "expression", "switch step '" + id + "'"),
                cases,
                readSteps(mapper, root, "default"));
    }

    /// Nested lists go through `convertValue` so the nested parser keeps this mapper as codec.
    private List<WorkflowStep> readSteps(ObjectMapper mapper, JsonNode root, String field) {
        return root.hasNonNull(field) ? mapper.convertValue(root.get(field), STEP_LIST) : List.of();
    }

    private <T> T readValue(
            ObjectMapper mapper, JsonNode root, String field, TypeReference<T> type) {
        return root.hasNonNull(field) ? mapper.convertValue(root.get(field), type) : null;
    }

    private static String requiredText(JsonNode root, String field, String owner)
            throws IOException {
        if (!root.hasNonNull(field)) {
            throw new IOException("Missing '" + field + "' in " + owner);
        }
        return root.get(field).asText();
    }

    private static String textOrNull(JsonNode root, String field) {
        return root.hasNonNull(field) ? root.get(field).asText() : null;
    }
}
