package io.stepflow.core.util;

import java.math.BigDecimal;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/// Loose-typing helpers shared by the expression evaluator and the built-in operations.
///
/// Workflow data arrives as plain JSON-shaped values (`Map`, `List`, `String`, `Number`,
/// `Boolean`, null). These helpers define one set of coercion rules for all of them:
/// - truthiness: null, `false`, zero, NaN, the empty string and empty collections are false
/// - numbers: strings are parsed, booleans map to 1 and 0
/// - strings: integral doubles print without a fraction, maps and lists print as JSON
public final class Values {

    private Values() {}

    public static boolean isTruthy(Object value) {
        if (value == null) {
            return false;
        }
        if (value instanceof Boolean b) {
            return b;
        }
        if (value instanceof Number n) {
            double d = n.doubleValue();
            return d != 0 && !Double.isNaN(d);
        }
        if (value instanceof CharSequence s) {
            return !s.isEmpty();
        }
        if (value instanceof Collection<?> c) {
            return !c.isEmpty();
        }
        if (value instanceof Map<?, ?> m) {
            return !m.isEmpty();
        }
        return true;
    }

    /// Coerces a value to a double.
    ///
    /// @param value any value, may be null
    /// @return the numeric value, or null when the value has no numeric reading
    public static Double toNumber(Object value) {
        if (value instanceof Number n) {
            return n.doubleValue();
        }
        if (value instanceof Boolean b) {
            return b ? 1d : 0d;
        }
        if (value instanceof CharSequence s) {
            String text = s.toString().trim();
            if (text.isEmpty()) {
                return null;
            }
            try {
                return Double.parseDouble(text);
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    /// Coerces a value to a double, returning NaN when it has no numeric reading.
    public static double toDouble(Object value) {
        Double number = toNumber(value);
        return number == null ? Double.NaN : number;
    }

    /// Coerces a value to an int, falling back when it has no numeric reading.
    public static int toInt(Object value, int fallback) {
        Double number = toNumber(value);
        return number == null || number.isNaN() ? fallback : number.intValue();
    }

    /// Narrows a double to a `Long` when it is integral, so `2 + 3` stays `5` and not `5.0`.
    ///
    /// @param value computed number
    /// @return `Long` for integral finite values, otherwise the `Double`
    public static Number normalize(double value) {
        if (!Double.isInfinite(value)
                && !Double.isNaN(value)
                && value == Math.rint(value)
                && Math.abs(value) < 9.007199254740992E15) {
            return (long) value;
        }
        return value;
    }

    public static boolean isNumeric(Object value) {
        return value instanceof Number;
    }

    /// Renders a value as text for string interpolation.
    ///
    /// @param value any value, may be null
    /// @return display string, empty for null
    public static String stringify(Object value) {
        if (value == null) {
            return "";
        }
        if (value instanceof String s) {
            return s;
        }
        if (value instanceof Double || value instanceof Float) {
            double d = ((Number) value).doubleValue();
            Number normalized = normalize(d);
            if (normalized instanceof Long l) {
                return Long.toString(l);
            }
            return BigDecimal.valueOf(d).stripTrailingZeros().toPlainString();
        }
        if (value instanceof Map<?, ?>
                || value instanceof Collection<?>
                || value.getClass().isArray()) {
            return JsonUtil.toJson(value);
        }
        return value.toString();
    }

    /// Equality that treats numbers by value regardless of boxing type.
    public static boolean looseEquals(Object a, Object b) {
        if (a instanceof Number x && b instanceof Number y) {
            return x.doubleValue() == y.doubleValue();
        }
        return Objects.equals(a, b);
    }

    /// Orders two values: numbers numerically, everything else by string form.
    public static int compare(Object a, Object b) {
        if (a instanceof Number x && b instanceof Number y) {
            return Double.compare(x.doubleValue(), y.doubleValue());
        }
        if (a == null && b == null) {
            return 0;
        }
        if (a == null) {
            return -1;
        }
        if (b == null) {
            return 1;
        }
        return stringify(a).compareTo(stringify(b));
    }

    /// Returns the value as a list, or null when it is not list-shaped.
    public static List<Object> asList(Object value) {
        if (value instanceof List<?> list) {
            return (List<Object>) list;
        }
        if (value instanceof Collection<?> c) {
            return List.copyOf((Collection<Object>) c);
        }
        if (value instanceof Object[] array) {
            return List.of(array);
        }
        return null;
    }

    /// Returns the value as a string-keyed map, or null when it is not map-shaped.
    public static Map<String, Object> asMap(Object value) {
        if (value instanceof Map<?, ?> map) {
            return (Map<String, Object>) map;
        }
        return null;
    }

    /// Walks a dotted path through nested maps and lists; numeric segments index lists.
    ///
    /// @return the value at the path, or null if any segment is missing
    public static Object path(Object root, String dottedPath) {
        Object current = root;
        if (dottedPath == null || dottedPath.isEmpty()) {
            return current;
        }
        for (String key : dottedPath.split("\\.")) {
            if (current instanceof Map<?, ?> map) {
                current = map.get(key);
            } else if (current instanceof List<?> list && key.matches("\\d+")) {
                int index = Integer.parseInt(key);
                current = index < list.size() ? list.get(index) : null;
            } else {
                return null;
            }
        }
        return current;
    }
}
