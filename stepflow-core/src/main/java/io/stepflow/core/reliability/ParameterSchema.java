package io.stepflow.core.reliability;

import io.stepflow.core.tool.ToolDefinition.ParameterDef;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/// {@link InputSchema} derived from a tool's parameter definitions.
///
/// Checks that the input is an object, that every required parameter is present (blank strings
/// count as missing) and that every present parameter matches its declared JSON type. Unknown
/// keys pass through. Types not in the JSON vocabulary (`any`, custom names) are not checked.
public final class ParameterSchema implements InputSchema {

    private final List<ParameterDef> parameters;

    public ParameterSchema(List<ParameterDef> parameters) {
        this.parameters =
                List.copyOf(Objects.requireNonNull(parameters, "parameters must not be null"));
    }

    public static ParameterSchema of(ParameterDef... parameters) {
        return new ParameterSchema(List.of(parameters));
    }

    @Override
    public List<String> validate(Object input) {
        if (!(input instanceof Map<?, ?> map)) {
            return List.of("(root): expected object but got " + jsonType(input));
        }
        List<String> errors = new ArrayList<>();
        for (ParameterDef parameter : parameters) {
            Object value = map.get(parameter.name());
            if (value == null || (value instanceof String s && s.isBlank())) {
                if (parameter.required()) {
                    errors.add(parameter.name() + ": " + parameter.name() + " is required");
                }
                continue;
            }
            String expected = parameter.type().toLowerCase(Locale.ROOT);
            if (!matches(expected, value)) {
                errors.add(
                        parameter.name()
                                + ": expected "
                                + expected
                                + " but got "
                                + jsonType(value));
            }
        }
        return errors;
    }

    private static boolean matches(String expected, Object value) {
        return switch (expected) {
            case "string" -> value instanceof CharSequence;
            case "number" -> value instanceof Number;
            case "integer" -> value instanceof Integer
                    || value instanceof Long
                    || (value instanceof Number n && n.doubleValue() == Math.rint(n.doubleValue()));
            case "boolean" -> value instanceof Boolean;
            case "object" -> value instanceof Map<?, ?>;
            case "array" -> value instanceof Collection<?> || value instanceof Object[];
            default -> true;
        };
    }

    static String jsonType(Object value) {
        if (value == null) {
            return "null";
        }
        if (value instanceof CharSequence) {
            return "string";
        }
        if (value instanceof Number) {
            return "number";
        }
        if (value instanceof Boolean) {
            return "boolean";
        }
        if (value instanceof Map<?, ?>) {
            return "object";
        }
        if (value instanceof Collection<?> || value instanceof Object[]) {
            return "array";
        }
        return value.getClass().getSimpleName();
    }
}
