package io.stepflow.core.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import io.stepflow.core.exception.ValidationException;
import java.util.Map;

/// JSON and YAML conversion for workflow data values.
///
/// Values are mapped to plain Java structures: objects to `LinkedHashMap`, arrays to
/// `ArrayList`, numbers to `Integer`/`Long`/`Double`. Shared mappers are configured once and
/// are safe for concurrent use.
public final class JsonUtil {

    private static final ObjectMapper JSON =
            new ObjectMapper().disable(SerializationFeature.FAIL_ON_EMPTY_BEANS);
    private static final ObjectMapper PRETTY =
            JSON.copy().enable(SerializationFeature.INDENT_OUTPUT);
    private static final ObjectMapper YAML = new ObjectMapper(new YAMLFactory());
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private JsonUtil() {}

    /// Parses JSON text into plain Java values.
    ///
    /// @param json JSON text, not null
    /// @return parsed value, may be null for the literal `null`
    /// @throws ValidationException if the text is not valid JSON
    public static Object parse(String json) {
        try {
            return JSON.readValue(json, Object.class);
        } catch (JsonProcessingException e) {
            throw new ValidationException("Invalid JSON: " + e.getOriginalMessage(), e);
        }
    }

    /// Parses YAML text into plain Java values.
    ///
    /// @param yaml YAML text, not null
    /// @return parsed value, may be null
    /// @throws ValidationException if the text is not valid YAML
    public static Object parseYaml(String yaml) {
        try {
            return YAML.readValue(yaml, Object.class);
        } catch (JsonProcessingException e) {
            throw new ValidationException("Invalid YAML: " + e.getOriginalMessage(), e);
        }
    }

    /// Serializes a value to compact JSON.
    ///
    /// @param value any JSON-shaped value, may be null
    /// @return JSON text, never null
    public static String toJson(Object value) {
        return write(JSON, value);
    }

    /// Serializes a value to indented JSON.
    public static String toPrettyJson(Object value) {
        return write(PRETTY, value);
    }

    /// Converts an arbitrary object (for example a record) to a string-keyed map.
    public static Map<String, Object> toMap(Object value) {
        return JSON.convertValue(value, MAP_TYPE);
    }

    private static String write(ObjectMapper mapper, Object value) {
        try {
            return mapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new ValidationException(
                    "Value is not JSON-serializable: " + e.getOriginalMessage(), e);
        }
    }
}
