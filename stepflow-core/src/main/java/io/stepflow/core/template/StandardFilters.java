package io.stepflow.core.template;

import io.stepflow.core.exception.TemplateException;
import io.stepflow.core.exception.ValidationException;
import io.stepflow.core.util.Dates;
import io.stepflow.core.util.JsonUtil;
import io.stepflow.core.util.Values;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import java.util.stream.Collectors;

/// The built-in filter set registered by {@link TemplateFilters#standard()}.
///
/// Filters are lenient about their input: a value of the wrong shape yields an empty or neutral
/// result instead of an error, so `{{ missing | length }}` is `0` and `{{ missing | upper }}` is
/// the empty string. Dates are handled in UTC.
final class StandardFilters {

    private static final Logger logger = Logger.getLogger(StandardFilters.class.getName());
    private static final Pattern SLASH_REGEX = Pattern.compile("^/(.+)/([gimsu]*)$");
    private static final long DAY_MS = 86_400_000L;

    private StandardFilters() {}

    static void registerAll(TemplateFilters registry) {
        registerStringFilters(registry);
        registerRegexFilters(registry);
        registerObjectFilters(registry);
        registerArrayFilters(registry);
        registerDateFilters(registry);
        registerJsonFilters(registry);
        registerTypeFilters(registry);
        registerLogicFilters(registry);
        registerMathFilters(registry);
    }

    private static void registerStringFilters(TemplateFilters registry) {
        registry.register("upper", (in, args) -> text(in).toUpperCase(Locale.ROOT));
        registry.register("lower", (in, args) -> text(in).toLowerCase(Locale.ROOT));
        registry.register("trim", (in, args) -> text(in).trim());
        registry.register("capitalize", (in, args) -> capitalize(text(in)));
        registry.register(
                "title",
                (in, args) ->
                        Arrays.stream(text(in).split(" ", -1))
                                .map(StandardFilters::capitalize)
                                .collect(Collectors.joining(" ")));
        registry.register(
                "replace",
                (in, args) -> text(in).replace(text(arg(args, 0)), text(arg(args, 1))));
        registry.register(
                "split",
                (in, args) -> {
                    String delimiter = args.isEmpty() ? "," : text(args.get(0));
                    String value = text(in);
                    if (delimiter.isEmpty()) {
                        return value.codePoints()
                                .mapToObj(Character::toString)
                                .collect(Collectors.toList());
                    }
                    return new ArrayList<Object>(
                            Arrays.asList(value.split(Pattern.quote(delimiter), -1)));
                });
        registry.register(
                "slugify",
                (in, args) ->
                        text(in).toLowerCase(Locale.ROOT)
                                .replaceAll("[^a-z0-9]+", "-")
                                .replaceAll("^-|-$", ""));
        registry.register("prefix", (in, args) -> text(arg(args, 0)) + text(in));
        registry.register("suffix", (in, args) -> text(in) + text(arg(args, 0)));
        registry.register(
                "truncate",
                (in, args) -> {
                    String value = text(in);
                    int length = Values.toInt(arg(args, 0), 255);
                    String ellipsis = args.size() > 1 ? text(args.get(1)) : "...";
                    return value.length() <= length ? value : value.substring(0, length) + ellipsis;
                });
        registry.register(
                "substring",
                (in, args) -> {
                    String value = text(in);
                    int start = clamp(Values.toInt(arg(args, 0), 0), value.length());
                    int end = clamp(Values.toInt(arg(args, 1), value.length()), value.length());
                    return start <= end ? value.substring(start, end) : value.substring(end, start);
                });
        registry.register(
                "contains",
                (in, args) -> {
                    Object search = arg(args, 0);
                    if (in instanceof String value) {
                        return value.contains(text(search));
                    }
                    if (in instanceof Collection<?> collection) {
                        return collection.stream().anyMatch(v -> Values.looseEquals(v, search));
                    }
                    return false;
                });
        registry.register("string", (in, args) -> Values.stringify(in));
    }

    private static void registerRegexFilters(TemplateFilters registry) {
        registry.register(
                "match",
                (in, args) -> {
                    Matcher matcher = regex(text(arg(args, 0))).matcher(text(in));
                    if (!matcher.find()) {
                        return null;
                    }
                    if (args.size() > 1) {
                        int group = Values.toInt(args.get(1), 0);
                        return group <= matcher.groupCount() ? matcher.group(group) : null;
                    }
                    return matcher.groupCount() > 0 ? matcher.group(1) : matcher.group();
                });
        registry.register(
                "notMatch", (in, args) -> !regex(text(arg(args, 0))).matcher(text(in)).find());
        registry.register(
                "regexReplace",
                (in, args) -> {
                    String pattern = text(arg(args, 0));
                    String replacement = replacementText(text(arg(args, 1)));
                    Matcher slashed = SLASH_REGEX.matcher(pattern);
                    String flags =
                            args.size() > 2
                                    ? text(args.get(2))
                                    : slashed.matches() ? slashed.group(2) : "";
                    Matcher matcher = regex(pattern, flags).matcher(text(in));
                    return flags.contains("g")
                            ? matcher.replaceAll(replacement)
                            : matcher.replaceFirst(replacement);
                });
    }

    private static void registerObjectFilters(TemplateFilters registry) {
        registry.register("path", (in, args) -> Values.path(in, text(arg(args, 0))));
        registry.register(
                "keys",
                (in, args) -> in instanceof Map<?, ?> map ? keyList(map) : new ArrayList<>());
        registry.register(
                "values",
                (in, args) ->
                        in instanceof Map<?, ?> map
                                ? new ArrayList<Object>(map.values())
                                : new ArrayList<>());
        registry.register(
                "entries",
                (in, args) -> {
                    List<Object> entries = new ArrayList<>();
                    if (in instanceof Map<?, ?> map) {
                        map.forEach((k, v) -> entries.add(Arrays.asList(String.valueOf(k), v)));
                    }
                    return entries;
                });
        registry.register(
                "pick",
                (in, args) -> {
                    Map<String, Object> picked = new LinkedHashMap<>();
                    if (in instanceof Map<?, ?> map) {
                        for (Object key : flattenArgs(args)) {
                            String name = text(key);
                            if (map.containsKey(name)) {
                                picked.put(name, map.get(name));
                            }
                        }
                    }
                    return picked;
                });
        registry.register(
                "omit",
                (in, args) -> {
                    Map<String, Object> kept = new LinkedHashMap<>();
                    if (in instanceof Map<?, ?> map) {
                        Set<String> omitted = new HashSet<>();
                        flattenArgs(args).forEach(key -> omitted.add(text(key)));
                        map.forEach(
                                (k, v) -> {
                                    if (!omitted.contains(String.valueOf(k))) {
                                        kept.put(String.valueOf(k), v);
                                    }
                                });
                    }
                    return kept;
                });
        registry.register(
                "merge",
                (in, args) -> {
                    Map<String, Object> merged = new LinkedHashMap<>();
                    if (!(in instanceof Map<?, ?>)) {
                        return merged;
                    }
                    putAll(merged, (Map<?, ?>) in);
                    for (Object other : args) {
                        if (other instanceof Map<?, ?> map) {
                            putAll(merged, map);
                        }
                    }
                    return merged;
                });
    }

    private static void registerArrayFilters(TemplateFilters registry) {
        registry.register("length", (in, args) -> size(in));
        registry.register(
                "count",
                (in, args) -> {
                    if (in instanceof Map<?, ?> map) {
                        for (String key : List.of("length", "total", "count")) {
                            if (map.get(key) instanceof Number number) {
                                return number;
                            }
                        }
                    }
                    return size(in);
                });
        registry.register(
                "first",
                (in, args) -> {
                    if (in instanceof List<?> list) {
                        return list.isEmpty() ? null : list.get(0);
                    }
                    return in instanceof String s && !s.isEmpty() ? s.substring(0, 1) : null;
                });
        registry.register(
                "last",
                (in, args) -> {
                    if (in instanceof List<?> list) {
                        return list.isEmpty() ? null : list.get(list.size() - 1);
                    }
                    return in instanceof String s && !s.isEmpty()
                            ? s.substring(s.length() - 1)
                            : null;
                });
        registry.register(
                "join",
                (in, args) -> {
                    List<Object> list = Values.asList(in);
                    if (list == null) {
                        return text(in);
                    }
                    String separator = args.isEmpty() ? "" : text(args.get(0));
                    return list.stream()
                            .map(Values::stringify)
                            .collect(Collectors.joining(separator));
                });
        registry.register(
                "reverse",
                (in, args) -> {
                    List<Object> list = Values.asList(in);
                    if (list == null) {
                        return new StringBuilder(text(in)).reverse().toString();
                    }
                    List<Object> reversed = new ArrayList<>(list);
                    Collections.reverse(reversed);
                    return reversed;
                });
        registry.register(
                "sort",
                (in, args) -> {
                    List<Object> list = Values.asList(in);
                    if (list == null) {
                        return in;
                    }
                    boolean reverse = Values.isTruthy(arg(args, 0));
                    boolean caseSensitive = Values.isTruthy(arg(args, 1));
                    Object attribute = arg(args, 2);
                    Comparator<Object> order =
                            (a, b) -> {
                                Object x = attribute == null ? a : pluck(a, text(attribute));
                                Object y = attribute == null ? b : pluck(b, text(attribute));
                                if (!caseSensitive
                                        && x instanceof String s
                                        && y instanceof String t) {
                                    return s.compareToIgnoreCase(t);
                                }
                                return Values.compare(x, y);
                            };
                    List<Object> sorted = new ArrayList<>(list);
                    sorted.sort(reverse ? order.reversed() : order);
                    return sorted;
                });
        registry.register(
                "nth",
                (in, args) -> {
                    if (in instanceof List<?> list) {
                        int index = Values.toInt(arg(args, 0), 0);
                        return index >= 0 && index < list.size() ? list.get(index) : null;
                    }
                    return in;
                });
        registry.register(
                "sum",
                (in, args) -> {
                    List<Object> list = Values.asList(in);
                    if (list == null) {
                        return 0L;
                    }
                    double total = 0;
                    for (Object value : list) {
                        total += Values.toDouble(value);
                    }
                    return Values.normalize(total);
                });
        registry.register(
                "unique",
                (in, args) -> {
                    List<Object> list = Values.asList(in);
                    return list == null
                            ? new ArrayList<>(Arrays.asList(in))
                            : new ArrayList<Object>(new LinkedHashSet<>(list));
                });
        registry.register(
                "flatten",
                (in, args) -> {
                    List<Object> list = Values.asList(in);
                    if (list == null) {
                        return new ArrayList<>(Arrays.asList(in));
                    }
                    List<Object> flat = new ArrayList<>();
                    for (Object value : list) {
                        List<Object> nested = Values.asList(value);
                        if (nested != null) {
                            flat.addAll(nested);
                        } else {
                            flat.add(value);
                        }
                    }
                    return flat;
                });
    }

    private static void registerDateFilters(TemplateFilters registry) {
        registry.register("now", (in, args) -> System.currentTimeMillis());
        registry.register(
                "format_date",
                (in, args) -> {
                    Instant instant = in == null ? Instant.now() : Dates.toInstant(in);
                    if (instant == null) {
                        return "Invalid Date";
                    }
                    String format = args.isEmpty() ? "YYYY-MM-DD" : text(args.get(0));
                    return Dates.formatTokens(instant, format);
                });
        registry.register("add_days", (in, args) -> shiftDays(in, Values.toInt(arg(args, 0), 0)));
        registry.register(
                "subtract_days", (in, args) -> shiftDays(in, -Values.toInt(arg(args, 0), 0)));
        registry.register(
                "diff_days",
                (in, args) -> {
                    Instant first = Dates.toInstant(in);
                    Instant second = Dates.toInstant(arg(args, 0));
                    if (first == null || second == null) {
                        return 0L;
                    }
                    return Math.floorDiv(first.toEpochMilli() - second.toEpochMilli(), DAY_MS);
                });
    }

    private static void registerJsonFilters(TemplateFilters registry) {
        registry.register(
                "parse_json",
                (in, args) -> {
                    if (in == null) {
                        return null;
                    }
                    if (!(in instanceof String)) {
                        return in;
                    }
                    try {
                        return JsonUtil.parse((String) in);
                    } catch (ValidationException e) {
                        logger.fine("parse_json returned null: " + e.getMessage());
                        return null;
                    }
                });
        registry.register(
                "to_json",
                (in, args) ->
                        Values.isTruthy(arg(args, 0))
                                ? JsonUtil.toPrettyJson(in)
                                : JsonUtil.toJson(in));
    }

    private static void registerTypeFilters(TemplateFilters registry) {
        registry.register("is_array", (in, args) -> in instanceof List<?>);
        registry.register("is_object", (in, args) -> in instanceof Map<?, ?>);
        registry.register("is_string", (in, args) -> in instanceof String);
        registry.register(
                "is_number",
                (in, args) -> in instanceof Number n && !Double.isNaN(n.doubleValue()));
        registry.register(
                "is_empty",
                (in, args) -> {
                    if (in == null) {
                        return true;
                    }
                    if (in instanceof String s) {
                        return s.isEmpty();
                    }
                    if (in instanceof Collection<?> c) {
                        return c.isEmpty();
                    }
                    return in instanceof Map<?, ?> m && m.isEmpty();
                });
        registry.register("is_null", (in, args) -> in == null);
    }

    private static void registerLogicFilters(TemplateFilters registry) {
        registry.register(
                "default",
                (in, args) -> {
                    boolean falsyCounts = Values.isTruthy(arg(args, 1));
                    boolean useDefault = falsyCounts ? !Values.isTruthy(in) : in == null;
                    return useDefault ? arg(args, 0) : in;
                });
        registry.register(
                "ternary",
                (in, args) -> Values.isTruthy(in) ? arg(args, 0) : arg(args, 1));
        registry.register(
                "and",
                (in, args) -> Values.isTruthy(in) && args.stream().allMatch(Values::isTruthy));
        registry.register(
                "or",
                (in, args) -> {
                    if (Values.isTruthy(in)) {
                        return in;
                    }
                    return args.stream().filter(Values::isTruthy).findFirst().orElse(null);
                });
        registry.register("not", (in, args) -> !Values.isTruthy(in));
    }

    private static void registerMathFilters(TemplateFilters registry) {
        registry.register("abs", (in, args) -> Values.normalize(Math.abs(Values.toDouble(in))));
        registry.register(
                "int",
                (in, args) -> {
                    Double number = Values.toNumber(in);
                    return number == null || number.isNaN()
                            ? Values.toInt(arg(args, 0), 0)
                            : (long) number.doubleValue();
                });
        registry.register(
                "float",
                (in, args) -> {
                    Double number = Values.toNumber(in);
                    return number == null
                            ? Values.toDouble(args.isEmpty() ? 0 : args.get(0))
                            : number;
                });
        registry.register(
                "round",
                (in, args) -> {
                    double multiplier = Math.pow(10, Values.toInt(arg(args, 0), 0));
                    return Values.normalize(
                            Math.round(Values.toDouble(in) * multiplier) / multiplier);
                });
        registry.register(
                "floor", (in, args) -> Values.normalize(Math.floor(Values.toDouble(in))));
        registry.register("ceil", (in, args) -> Values.normalize(Math.ceil(Values.toDouble(in))));
        registry.register(
                "min",
                (in, args) ->
                        numbers(in, args).stream()
                                .min(Double::compare)
                                .map(Values::normalize)
                                .orElse(null));
        registry.register(
                "max",
                (in, args) ->
                        numbers(in, args).stream()
                                .max(Double::compare)
                                .map(Values::normalize)
                                .orElse(null));
        registry.register(
                "add",
                (in, args) ->
                        Values.normalize(Values.toDouble(in) + Values.toDouble(arg(args, 0))));
        registry.register(
                "subtract",
                (in, args) ->
                        Values.normalize(Values.toDouble(in) - Values.toDouble(arg(args, 0))));
        registry.register(
                "multiply",
                (in, args) ->
                        Values.normalize(Values.toDouble(in) * Values.toDouble(arg(args, 0))));
        registry.register(
                "divide",
                (in, args) -> {
                    double divisor = Values.toDouble(arg(args, 0));
                    if (divisor == 0) {
                        throw new TemplateException("divide: division by zero");
                    }
                    return Values.normalize(Values.toDouble(in) / divisor);
                });
    }

    private static Object arg(List<Object> args, int index) {
        return index < args.size() ? args.get(index) : null;
    }

    private static String text(Object value) {
        return Values.stringify(value);
    }

    private static String capitalize(String value) {
        if (value.isEmpty()) {
            return value;
        }
        return value.substring(0, 1).toUpperCase(Locale.ROOT)
                + value.substring(1).toLowerCase(Locale.ROOT);
    }

    private static int clamp(int index, int length) {
        return Math.max(0, Math.min(index, length));
    }

    private static Object size(Object value) {
        if (value instanceof Collection<?> c) {
            return c.size();
        }
        if (value instanceof Map<?, ?> m) {
            return m.size();
        }
        if (value instanceof String s) {
            return s.length();
        }
        return 0;
    }

    private static List<Object> keyList(Map<?, ?> map) {
        List<Object> keys = new ArrayList<>();
        map.keySet().forEach(k -> keys.add(String.valueOf(k)));
        return keys;
    }

    private static void putAll(Map<String, Object> target, Map<?, ?> source) {
        source.forEach((k, v) -> target.put(String.valueOf(k), v));
    }

    private static List<Object> flattenArgs(List<Object> args) {
        List<Object> flat = new ArrayList<>();
        for (Object arg : args) {
            List<Object> nested = Values.asList(arg);
            if (nested != null) {
                flat.addAll(nested);
            } else {
                flat.add(arg);
            }
        }
        return flat;
    }

    private static Object pluck(Object value, String attribute) {
        return value instanceof Map<?, ?> map ? map.get(attribute) : null;
    }

    private static List<Double> numbers(Object in, List<Object> args) {
        List<Object> source = Values.asList(in);
        List<Object> values = new ArrayList<>();
        if (source != null) {
            values.addAll(source);
        } else {
            values.add(in);
            values.addAll(args);
        }
        List<Double> numbers = new ArrayList<>();
        for (Object value : values) {
            numbers.add(Values.toDouble(value));
        }
        return numbers;
    }

    private static Object shiftDays(Object value, int days) {
        Instant instant = Dates.toInstant(value);
        if (instant == null) {
            return 0L;
        }
        return instant.atZone(ZoneOffset.UTC)
                .plus(days, ChronoUnit.DAYS)
                .toInstant()
                .toEpochMilli();
    }

    private static Pattern regex(String pattern) {
        Matcher slashed = SLASH_REGEX.matcher(pattern);
        return slashed.matches() ? regex(slashed.group(1), slashed.group(2)) : regex(pattern, "");
    }

    private static Pattern regex(String pattern, String flags) {
        Matcher slashed = SLASH_REGEX.matcher(pattern);
        String body = slashed.matches() ? slashed.group(1) : pattern;
        int bits = 0;
        if (flags.contains("i")) {
            bits |= Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE;
        }
        if (flags.contains("m")) {
            bits |= Pattern.MULTILINE;
        }
        if (flags.contains("s")) {
            bits |= Pattern.DOTALL;
        }
        try {
            return Pattern.compile(body, bits);
        } catch (PatternSyntaxException e) {
            throw new TemplateException("Invalid regular expression: " + pattern, e);
        }
    }

    private static String replacementText(String replacement) {
        // $& is the whole match; backslashes are literal
        return replacement.replace("\\", "\\\\").replace("$&", "$0");
    }
}
