package io.stepflow.core.workflow.step;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/// Fans work out through the parallel executor.
///
/// @param id step id, not null
/// @param mode `spawn` or `map`, not null
/// @param spec the same inputs the `parallel.spawn` / `parallel.map` actions take, unevaluated
/// @param outputVariable variable receiving the result, may be null
public record ParallelStep(String id, Mode mode, Map<String, Object> spec, String outputVariable)
        implements WorkflowStep {

    public enum Mode {
        SPAWN,
        MAP;

        public String wireName() {
            return name().toLowerCase(Locale.ROOT);
        }

        public static Mode fromWireName(String value) {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        }
    }

    public ParallelStep {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(mode, "mode must not be null");
        spec = spec != null ? Collections.unmodifiableMap(new LinkedHashMap<>(spec)) : Map.of();
    }

    @Override
    public StepType type() {
        return StepType.PARALLEL;
    }
}
