package io.stepflow.core.execution.parallel;

import io.stepflow.core.util.Values;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/// Aggregated outcome of a `spawn` call.
///
/// @param successful ids of successful tasks, in task order
/// @param failed ids of failed tasks, in task order
/// @param outcomes outcome per task id, in task order
/// @param startedAt when the call started
/// @param completedAt when the wait policy settled
/// @param costs cost per task id, tasks without a reported cost count as 0
public record SpawnResult(
        List<String> successful,
        List<String> failed,
        Map<String, TaskOutcome> outcomes,
        Instant startedAt,
        Instant completedAt,
        Map<String, Double> costs) {

    public SpawnResult {
        Objects.requireNonNull(outcomes, "outcomes must not be null");
        successful = List.copyOf(successful);
        failed = List.copyOf(failed);
        outcomes = Collections.unmodifiableMap(new LinkedHashMap<>(outcomes));
        costs = Collections.unmodifiableMap(new LinkedHashMap<>(costs));
    }

    public Duration duration() {
        return Duration.between(startedAt, completedAt);
    }

    public double totalCost() {
        return costs.values().stream().mapToDouble(Double::doubleValue).sum();
    }

    /// Builds the result from settled outcomes.
    static SpawnResult from(
            List<ParallelTask> tasks,
            Map<String, TaskOutcome> settled,
            Instant startedAt,
            Instant completedAt) {
        List<String> successful = new ArrayList<>();
        List<String> failed = new ArrayList<>();
        Map<String, TaskOutcome> ordered = new LinkedHashMap<>();
        Map<String, Double> costs = new LinkedHashMap<>();
        for (ParallelTask task : tasks) {
            TaskOutcome outcome = settled.get(task.id());
            ordered.put(task.id(), outcome);
            if (outcome instanceof TaskOutcome.Success success) {
                successful.add(task.id());
                costs.put(task.id(), costOf(success.value()));
            } else {
                failed.add(task.id());
                costs.put(task.id(), 0d);
            }
        }
        return new SpawnResult(successful, failed, ordered, startedAt, completedAt, costs);
    }

    /// Renders the result as the map a `parallel.spawn` step returns.
    public Map<String, Object> toMap() {
        Map<String, Object> results = new LinkedHashMap<>();
        outcomes.forEach(
                (id, outcome) -> {
                    Map<String, Object> entry = new LinkedHashMap<>();
                    entry.put("success", outcome.isSuccess());
                    if (outcome instanceof TaskOutcome.Success success) {
                        entry.put("value", success.value());
                    } else if (outcome instanceof TaskOutcome.Failure failure) {
                        entry.put("error", failure.error());
                    }
                    results.put(id, entry);
                });

        Map<String, Object> timing = new LinkedHashMap<>();
        timing.put("started", startedAt.toString());
        timing.put("completed", completedAt.toString());
        timing.put("duration", duration().toMillis());

        Map<String, Object> costMap = new LinkedHashMap<>();
        costMap.put("total", totalCost());
        costMap.put("byAgent", new LinkedHashMap<>(costs));

        Map<String, Object> map = new LinkedHashMap<>();
        map.put("successful", successful);
        map.put("failed", failed);
        map.put("results", results);
        map.put("timing", timing);
        map.put("costs", costMap);
        return map;
    }

    private static double costOf(Object value) {
        Map<String, Object> map = Values.asMap(value);
        if (map == null) {
            return 0d;
        }
        Object cost = map.get("cost");
        if (!(cost instanceof Number)) {
            Map<String, Object> usage = Values.asMap(map.get("usage"));
            cost = usage != null ? usage.get("cost") : null;
        }
        return cost instanceof Number number ? number.doubleValue() : 0d;
    }
}
