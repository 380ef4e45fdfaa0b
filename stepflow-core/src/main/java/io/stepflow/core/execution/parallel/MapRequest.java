package io.stepflow.core.execution.parallel;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/// Input of {@link ParallelExecutor#map}.
///
/// The template is run once per item with `item` and `itemIndex` bound.
///
/// @param items items to map, not null
/// @param action action run for each item, not null
/// @param inputs unresolved inputs of that action, not null
/// @param concurrency maximum items in flight, at least 1
/// @param timeoutMs timeout of each item in ms, null for none
/// @param onError failure policy, defaults to {@link FailurePolicy#FAIL}
public record MapRequest(
        List<Object> items,
        String action,
        Map<String, Object> inputs,
        int concurrency,
        Long timeoutMs,
        FailurePolicy onError) {

    public static final int DEFAULT_CONCURRENCY = 5;

    public MapRequest {
        Objects.requireNonNull(items, "items must not be null");
        Objects.requireNonNull(action, "action must not be null");
        inputs = inputs != null ? inputs : Map.of();
        if (concurrency < 1) {
            throw new IllegalArgumentException("concurrency must be at least 1");
        }
        onError = onError != null ? onError : FailurePolicy.FAIL;
    }
}
