package io.stepflow.core.template;

import io.stepflow.core.exception.TemplateException;
import io.stepflow.core.template.expression.Evaluator;
import io.stepflow.core.template.expression.Expr;
import io.stepflow.core.template.expression.Parser;
import io.stepflow.core.util.Values;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/// {@link TemplateResolver} backed by the restricted expression language in
/// {@link io.stepflow.core.template.expression}.
///
/// ### Resolution rules
/// - a string that is exactly one `{{ expr }}` (surrounding whitespace allowed) resolves to the
///   expression's typed value, so `{{ items }}` stays a list
/// - mixed text interpolates each expression's string form; maps and lists render as JSON and
///   null renders as the empty string
/// - undefined variables are null
///
/// ### Usage
/// {@snippet :
/// TemplateResolver resolver = new ExpressionTemplateResolver();
/// Map<String, Object> vars = Map.of("user", Map.of("name", "ada"), "n", 2);
///
/// resolver.resolve("{{ user.name | upper }}", vars);   // "ADA"
/// resolver.resolve("{{ n * 3 }}", vars);               // 6L
/// resolver.resolve("Hi {{ user.name }}!", vars);       // "Hi ada!"
/// }
///
/// @implNote Thread-safe. Parsed expressions are cached by source text.
public class ExpressionTemplateResolver implements TemplateResolver {

    private static final Pattern PLACEHOLDER = Pattern.compile("\\{\\{(.*?)}}", Pattern.DOTALL);
    private static final Pattern SINGLE =
            Pattern.compile("^\\s*\\{\\{((?:(?!\\{\\{|}}).)*)}}\\s*$", Pattern.DOTALL);
    private static final int MAX_CACHED_EXPRESSIONS = 2048;

    private final Evaluator evaluator;
    private final Map<String, Expr> cache = new ConcurrentHashMap<>();

    public ExpressionTemplateResolver() {
        this(TemplateFilters.standard());
    }

    public ExpressionTemplateResolver(TemplateFilters filters) {
        this.evaluator = new Evaluator(Objects.requireNonNull(filters, "filters must not be null"));
    }

    @Override
    public Object resolve(Object value, Map<String, Object> variables) {
        Objects.requireNonNull(variables, "variables must not be null");
        if (value instanceof String text) {
            return resolveText(text, variables);
        }
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> resolved = new LinkedHashMap<>();
            map.forEach((k, v) -> resolved.put(String.valueOf(k), resolve(v, variables)));
            return resolved;
        }
        if (value instanceof Collection<?> collection) {
            List<Object> resolved = new ArrayList<>(collection.size());
            for (Object element : collection) {
                resolved.add(resolve(element, variables));
            }
            return resolved;
        }
        return value;
    }

    @Override
    public Object evaluate(String expression, Map<String, Object> variables) {
        Objects.requireNonNull(expression, "expression must not be null");
        Objects.requireNonNull(variables, "variables must not be null");
        Matcher single = SINGLE.matcher(expression);
        String source = single.matches() ? single.group(1) : expression;
        return evaluator.evaluate(parse(source), variables);
    }

    private Object resolveText(String text, Map<String, Object> variables) {
        if (!text.contains("{{")) {
            return text;
        }
        Matcher single = SINGLE.matcher(text);
        if (single.matches()) {
            return evaluator.evaluate(parse(single.group(1)), variables);
        }
        Matcher matcher = PLACEHOLDER.matcher(text);
        StringBuilder result = new StringBuilder();
        while (matcher.find()) {
            Object value = evaluator.evaluate(parse(matcher.group(1)), variables);
            matcher.appendReplacement(result, Matcher.quoteReplacement(Values.stringify(value)));
        }
        matcher.appendTail(result);
        return result.toString();
    }

    private Expr parse(String source) {
        String key = source.trim();
        Expr cached = cache.get(key);
        if (cached != null) {
            return cached;
        }
        Expr parsed = Parser.parse(key);
        if (cache.size() < MAX_CACHED_EXPRESSIONS) {
            cache.put(key, parsed);
        }
        return parsed;
    }

    /// Parses an expression without evaluating it, surfacing syntax errors early.
    ///
    /// @param expression expression text, not null
    /// @throws TemplateException on syntax errors
    public void validate(String expression) {
        Matcher single = SINGLE.matcher(expression);
        parse(single.matches() ? single.group(1) : expression);
    }
}
