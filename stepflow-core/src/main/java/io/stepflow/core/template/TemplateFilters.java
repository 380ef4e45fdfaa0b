package io.stepflow.core.template;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/// Registry of filters available to template expressions.
///
/// Expressions can only call what is registered here, so the registry is the complete list of
/// operations a template may perform beyond plain arithmetic and comparison.
///
/// {@snippet :
/// TemplateFilters filters = TemplateFilters.standard();
/// filters.register("shout", (input, args) -> Values.stringify(input).toUpperCase() + "!");
/// }
public final class TemplateFilters {

    private final Map<String, TemplateFilter> filters = new ConcurrentHashMap<>();

    /// Creates an empty registry.
    public TemplateFilters() {}

    /// Creates a registry holding the standard string, regex, object, array, date, JSON,
    /// type-check, logic and math filters.
    public static TemplateFilters standard() {
        TemplateFilters registry = new TemplateFilters();
        StandardFilters.registerAll(registry);
        return registry;
    }

    public TemplateFilters register(String name, TemplateFilter filter) {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(filter, "filter must not be null");
        filters.put(name, filter);
        return this;
    }

    public Optional<TemplateFilter> get(String name) {
        return Optional.ofNullable(filters.get(name));
    }

    public Set<String> names() {
        return Set.copyOf(filters.keySet());
    }
}
