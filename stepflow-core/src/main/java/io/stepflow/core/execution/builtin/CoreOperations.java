package io.stepflow.core.execution.builtin;

import io.stepflow.core.exception.ValidationException;
import io.stepflow.core.util.Dates;
import io.stepflow.core.util.JsonUtil;
import io.stepflow.core.util.Values;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.text.NumberFormat;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.Currency;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/// The pure data operations under `core.*` that reshape values: `set`, `transform`, `extract`,
/// `format`, `aggregate`, `compare`, `rename_keys`, `limit` and `sort`.
final class CoreOperations {

    private static final Pattern WORD = Pattern.compile("\\w\\S*");

    private CoreOperations() {}

    static void registerAll(BuiltinOperations registry, Clock clock) {
        registry.register("core.set", op -> new LinkedHashMap<>(op.inputs()));
        registry.register("core.transform", CoreOperations::transform);
        registry.register("core.extract", CoreOperations::extract);
        registry.register("core.format", op -> format(op, clock));
        registry.register("core.aggregate", CoreOperations::aggregate);
        registry.register("core.compare", CoreOperations::compare);
        registry.register("core.rename_keys", CoreOperations::renameKeys);
        registry.register("core.limit", CoreOperations::limit);
        registry.register("core.sort", CoreOperations::sort);
    }

    // --- transform ---

    private static Object transform(OperationContext op) {
        List<Object> items = Values.asList(op.input("input"));
        if (items == null) {
            throw new ValidationException("Transform input must be an array");
        }
        String operation = Values.stringify(op.input("operation"));
        Object expression = op.rawInputs().get("expression");
        Object condition = op.rawInputs().get("condition");
        String key = op.input("key") != null ? Values.stringify(op.input("key")) : null;
        return switch (operation) {
            case "map" -> {
                List<Object> mapped = new ArrayList<>();
                for (Object item : items) {
                    mapped.add(perItem(op, expression != null ? expression : "item", item));
                }
                yield mapped;
            }
            case "filter" -> {
                List<Object> kept = new ArrayList<>();
                for (Object item : items) {
                    Object test = perItem(op, condition != null ? condition : "item", item);
                    if (Values.isTruthy(test)) {
                        kept.add(item);
                    }
                }
                yield kept;
            }
            case "find" -> {
                for (Object item : items) {
                    Object test = perItem(op, condition != null ? condition : "item", item);
                    if (Values.isTruthy(test)) {
                        yield item;
                    }
                }
                yield null;
            }
            case "reduce" -> {
                Object accumulator = op.input("initialValue");
                Object reducer = expression != null ? expression : "accumulator";
                for (Object item : items) {
                    Map<String, Object> bindings = new LinkedHashMap<>();
                    bindings.put("item", item);
                    bindings.put("accumulator", accumulator);
                    accumulator = evaluate(op, reducer, bindings);
                }
                yield accumulator;
            }
            case "group_by" -> {
                if (key == null) {
                    throw new ValidationException("group_by operation requires \"key\" parameter");
                }
                Map<String, Object> groups = new LinkedHashMap<>();
                for (Object item : items) {
                    String group = Values.stringify(itemKey(item, key));
                    List<Object> members =
                            (List<Object>) groups.computeIfAbsent(group, g -> new ArrayList<>());
                    members.add(item);
                }
                yield groups;
            }
            case "unique" -> {
                List<Object> unique = new ArrayList<>();
                Set<Object> seen = new HashSet<>();
                for (Object item : items) {
                    Object identity = key != null ? itemKey(item, key) : item;
                    if (seen.add(identityOf(identity))) {
                        unique.add(item);
                    }
                }
                yield unique;
            }
            case "sort" -> {
                List<Object> sorted = new ArrayList<>(items);
                Comparator<Object> order =
                        (a, b) ->
                                Values.compare(
                                        key != null ? itemKey(a, key) : a,
                                        key != null ? itemKey(b, key) : b);
                sorted.sort(order);
                if (Values.isTruthy(op.input("reverse"))) {
                    Collections.reverse(sorted);
                }
                yield sorted;
            }
            default -> throw new ValidationException("Unknown transform operation: " + operation);
        };
    }

    private static Object perItem(OperationContext op, Object template, Object item) {
        Map<String, Object> bindings = new LinkedHashMap<>();
        bindings.put("item", item);
        return evaluate(op, template, bindings);
    }

    /// Strings without placeholders are evaluated as bare expressions, so `item.active` and
    /// `{{ item.active }}` behave the same.
    private static Object evaluate(
            OperationContext op, Object template, Map<String, Object> bindings) {
        Map<String, Object> variables = new LinkedHashMap<>(op.context().getVariables());
        variables.putAll(bindings);
        if (template instanceof String text && !text.contains("{{")) {
            return op.templates().evaluate(text, variables);
        }
        return op.templates().resolve(template, variables);
    }

    private static Object itemKey(Object item, String key) {
        String path = key.startsWith("item.") ? key.substring("item.".length()) : key;
        return Values.path(item, path);
    }

    private static Object identityOf(Object value) {
        return value instanceof Number n ? Values.normalize(n.doubleValue()) : value;
    }

    // --- extract ---

    private static Object extract(OperationContext op) {
        Object path = op.input("path");
        if (path == null) {
            throw new ValidationException("core.extract: path is required");
        }
        Object value = Values.path(op.input("input"), Values.stringify(path));
        return value != null ? value : op.input("default");
    }

    // --- format ---

    private static Object format(OperationContext op, Clock clock) {
        Object value = op.input("value");
        String type = Values.stringify(op.input("type"));
        String pattern = op.input("format") != null ? Values.stringify(op.input("format")) : null;
        Locale locale =
                op.input("locale") != null
                        ? Locale.forLanguageTag(Values.stringify(op.input("locale")))
                        : null;
        return switch (type) {
            case "date" -> {
                Instant instant = value != null ? Dates.toInstant(value) : clock.instant();
                if (instant == null) {
                    throw new ValidationException("Invalid date value");
                }
                yield pattern != null ? Dates.formatTokens(instant, pattern) : instant.toString();
            }
            case "number" -> {
                Double number = Values.toNumber(value);
                if (number == null || number.isNaN()) {
                    throw new ValidationException("Invalid number value");
                }
                if (op.input("precision") != null) {
                    int precision = Values.toInt(op.input("precision"), 0);
                    yield BigDecimal.valueOf(number)
                            .setScale(precision, RoundingMode.HALF_UP)
                            .toPlainString();
                }
                if (locale != null) {
                    yield NumberFormat.getNumberInstance(locale).format(number);
                }
                yield Values.stringify(number);
            }
            case "currency" -> {
                Double number = Values.toNumber(value);
                if (number == null || number.isNaN()) {
                    throw new ValidationException("Invalid currency value");
                }
                NumberFormat currency =
                        NumberFormat.getCurrencyInstance(locale != null ? locale : Locale.US);
                currency.setCurrency(
                        Currency.getInstance(Values.stringify(op.input("currency", "USD"))));
                yield currency.format(number);
            }
            case "string" -> formatString(Values.stringify(value), pattern);
            case "json" -> JsonUtil.toPrettyJson(value);
            default -> throw new ValidationException("Unknown format type: " + type);
        };
    }

    private static String formatString(String text, String pattern) {
        if (pattern == null) {
            return text;
        }
        return switch (pattern.toLowerCase(Locale.ROOT)) {
            case "upper", "uppercase" -> text.toUpperCase(Locale.ROOT);
            case "lower", "lowercase" -> text.toLowerCase(Locale.ROOT);
            case "title", "titlecase" -> {
                Matcher matcher = WORD.matcher(text);
                StringBuilder out = new StringBuilder();
                while (matcher.find()) {
                    String word = matcher.group();
                    matcher.appendReplacement(
                            out,
                            Matcher.quoteReplacement(
                                    word.substring(0, 1).toUpperCase(Locale.ROOT)
                                            + word.substring(1).toLowerCase(Locale.ROOT)));
                }
                matcher.appendTail(out);
                yield out.toString();
            }
            case "capitalize" ->
                    text.isEmpty()
                            ? text
                            : text.substring(0, 1).toUpperCase(Locale.ROOT) + text.substring(1);
            case "trim" -> text.trim();
            default -> text;
        };
    }

    // --- aggregate ---

    private static Object aggregate(OperationContext op) {
        List<Object> items = requireList(op, "input", "core.aggregate: input must be an array");
        String operation = Values.stringify(op.input("operation"));
        String field = op.input("field") != null ? Values.stringify(op.input("field")) : null;

        List<Object> values = new ArrayList<>();
        for (Object item : items) {
            values.add(field != null && item instanceof Map<?, ?> map ? map.get(field) : item);
        }
        List<Double> numbers = new ArrayList<>();
        for (Object value : values) {
            Double number = Values.toNumber(value);
            if (number != null && !number.isNaN()) {
                numbers.add(number);
            }
        }
        double sum = numbers.stream().mapToDouble(Double::doubleValue).sum();
        return switch (operation) {
            case "sum" -> Values.normalize(sum);
            case "avg", "average" ->
                    numbers.isEmpty() ? 0L : Values.normalize(sum / numbers.size());
            case "count" -> items.size();
            case "min" ->
                    numbers.isEmpty()
                            ? null
                            : Values.normalize(Collections.min(numbers).doubleValue());
            case "max" ->
                    numbers.isEmpty()
                            ? null
                            : Values.normalize(Collections.max(numbers).doubleValue());
            case "first" -> items.isEmpty() ? null : items.get(0);
            case "last" -> items.isEmpty() ? null : items.get(items.size() - 1);
            case "concat" -> {
                List<String> parts = new ArrayList<>();
                values.forEach(value -> parts.add(Values.stringify(value)));
                yield String.join(Values.stringify(op.input("separator", ", ")), parts);
            }
            case "unique_count" -> {
                Set<Object> distinct = new LinkedHashSet<>();
                values.forEach(value -> distinct.add(identityOf(value)));
                yield distinct.size();
            }
            default ->
                    throw new ValidationException(
                            "core.aggregate: unknown operation \"" + operation + "\"");
        };
    }

    // --- compare ---

    private static Object compare(OperationContext op) {
        List<Object> source1 = Values.asList(op.input("source1"));
        List<Object> source2 = Values.asList(op.input("source2"));
        if (source1 == null || source2 == null) {
            throw new ValidationException("core.compare: source1 and source2 must be arrays");
        }
        if (op.input("field") == null) {
            throw new ValidationException("core.compare: field is required");
        }
        String field = Values.stringify(op.input("field"));
        Set<Object> keys1 = new HashSet<>();
        source1.forEach(item -> keys1.add(fieldKey(item, field)));
        Set<Object> keys2 = new HashSet<>();
        source2.forEach(item -> keys2.add(fieldKey(item, field)));

        Map<String, Object> result = new LinkedHashMap<>();
        result.put(
                "added",
                source2.stream().filter(item -> !keys1.contains(fieldKey(item, field))).toList());
        result.put(
                "removed",
                source1.stream().filter(item -> !keys2.contains(fieldKey(item, field))).toList());
        result.put(
                "unchanged",
                source1.stream().filter(item -> keys2.contains(fieldKey(item, field))).toList());
        result.put("total_source1", source1.size());
        result.put("total_source2", source2.size());
        return result;
    }

    private static Object fieldKey(Object item, String field) {
        return identityOf(item instanceof Map<?, ?> map ? map.get(field) : item);
    }

    // --- rename_keys / limit / sort ---

    private static Object renameKeys(OperationContext op) {
        Map<String, Object> mapping = Values.asMap(op.input("mapping"));
        if (mapping == null) {
            throw new ValidationException("core.rename_keys: mapping is required");
        }
        Object input = op.input("input");
        List<Object> list = Values.asList(input);
        if (list != null) {
            List<Object> renamed = new ArrayList<>();
            for (Object item : list) {
                renamed.add(item instanceof Map<?, ?> map ? rename(map, mapping) : item);
            }
            return renamed;
        }
        if (input instanceof Map<?, ?> map) {
            return rename(map, mapping);
        }
        return input;
    }

    private static Map<String, Object> rename(Map<?, ?> source, Map<String, Object> mapping) {
        Map<String, Object> renamed = new LinkedHashMap<>();
        source.forEach(
                (key, value) -> {
                    Object target = mapping.get(String.valueOf(key));
                    String name =
                            target != null ? Values.stringify(target) : String.valueOf(key);
                    renamed.put(name, value);
                });
        return renamed;
    }

    private static Object limit(OperationContext op) {
        List<Object> items = requireList(op, "input", "core.limit: input must be an array");
        if (!Values.isNumeric(op.input("count"))) {
            throw new ValidationException("core.limit: count is required");
        }
        int count = Values.toInt(op.input("count"), 0);
        int offset = Math.max(0, Values.toInt(op.input("offset"), 0));
        int from = Math.min(offset, items.size());
        int to = Math.min(items.size(), from + Math.max(0, count));
        return new ArrayList<>(items.subList(from, to));
    }

    private static Object sort(OperationContext op) {
        List<Object> items = requireList(op, "input", "core.sort: input must be an array");
        String field = op.input("field") != null ? Values.stringify(op.input("field")) : null;
        List<Object> sorted = new ArrayList<>(items);
        sorted.sort(
                (a, b) ->
                        Values.compare(
                                field != null && a instanceof Map<?, ?> ma ? ma.get(field) : a,
                                field != null && b instanceof Map<?, ?> mb ? mb.get(field) : b));
        if ("desc".equals(Values.stringify(op.input("direction")))) {
            Collections.reverse(sorted);
        }
        return sorted;
    }

    private static List<Object> requireList(OperationContext op, String name, String message) {
        List<Object> items = Values.asList(op.input(name));
        if (items == null) {
            throw new ValidationException(message);
        }
        return items;
    }
}
