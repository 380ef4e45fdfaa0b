package io.stepflow.serialization;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.stepflow.core.workflow.Workflow;

/// JSON entry points for workflow definitions, and the mapper the file checkpoint store writes
/// run records with.
///
/// The wire format carries a `"type"` discriminator on every step, lowercase enum names
/// (`"for_each"`, `"continue"`) and no null fields. Unknown properties are ignored when reading
/// so definitions written by newer versions still load.
///
/// {@snippet :
/// Workflow workflow = WorkflowSerializer.fromJson(Files.readString(definition));
/// engine.execute(workflow, Map.of("repo", "acme/api"));
/// }
///
/// @implNote Thread-safe. `toJson` and `fromJson` share one mapper that is never reconfigured
/// after construction; {@link #createMapper()} returns a fresh one for callers that tweak it.
///
/// @see StepflowJacksonModule for the step (de)serializers and enum mixins
public final class WorkflowSerializer {

    private static final ObjectMapper MAPPER = createMapper();

    private WorkflowSerializer() {}

    /// @param workflow definition to write, not null
    /// @return indented JSON, never null
    /// @throws IllegalArgumentException if a step input cannot be written as JSON
    public static String toJson(Workflow workflow) {
        try {
            return MAPPER.writeValueAsString(workflow);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(
                    "Failed to serialize workflow: " + e.getMessage(), e);
        }
    }

    /// Reads a definition and runs the builder's validation, including the duplicate step id
    /// check across nested steps.
    ///
    /// @param json definition text, not null
    /// @return the workflow, never null
    /// @throws IllegalArgumentException on malformed JSON, an unknown step type, a missing
    ///     required field or a failed builder validation; the message names the offending step
    public static Workflow fromJson(String json) {
        try {
            return MAPPER.readValue(json, Workflow.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(
                    "Failed to deserialize workflow: " + e.getMessage(), e);
        }
    }

    /// Builds a mapper with {@link StepflowJacksonModule}, ISO-8601 `Instant`s, `NON_NULL`
    /// inclusion and indented output.
    ///
    /// @return new mapper, never null
    public static ObjectMapper createMapper() {
        return new ObjectMapper()
                .registerModule(new StepflowJacksonModule())
                .registerModule(new JavaTimeModule())
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .setSerializationInclusion(JsonInclude.Include.NON_NULL)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }
}
