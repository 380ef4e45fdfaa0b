package io.stepflow.core.checkpoint;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.stream.Stream;

/// In-memory checkpoint store (default implementation).
///
/// Thread-safe, no external dependencies. Checkpoints are indexed by run id, then by step index.
///
/// @see CheckpointStore for contract
public final class InMemoryCheckpointStore implements CheckpointStore {

    private final Map<String, Map<Integer, Checkpoint>> checkpoints = new ConcurrentHashMap<>();
    private final Map<String, ExecutionRecord> executions = new ConcurrentHashMap<>();

    @Override
    public void writeCheckpoint(Checkpoint checkpoint) {
        Objects.requireNonNull(checkpoint, "checkpoint must not be null");
        checkpoints
                .computeIfAbsent(checkpoint.runId(), id -> new ConcurrentSkipListMap<>())
                .put(checkpoint.stepIndex(), checkpoint);
    }

    @Override
    public List<Checkpoint> listCheckpoints(String runId) {
        Objects.requireNonNull(runId, "runId must not be null");
        Map<Integer, Checkpoint> run = checkpoints.get(runId);
        return run == null ? List.of() : List.copyOf(run.values());
    }

    @Override
    public void saveExecution(ExecutionRecord record) {
        Objects.requireNonNull(record, "record must not be null");
        executions.put(record.runId(), record);
    }

    @Override
    public Optional<ExecutionRecord> getExecution(String runId) {
        Objects.requireNonNull(runId, "runId must not be null");
        return Optional.ofNullable(executions.get(runId));
    }

    @Override
    public List<ExecutionRecord> listExecutions(ExecutionFilter filter) {
        Objects.requireNonNull(filter, "filter must not be null");
        Stream<ExecutionRecord> matching =
                executions.values().stream()
                        .filter(filter::matches)
                        .sorted(Comparator.comparing(ExecutionRecord::startedAt).reversed());
        if (filter.limit() != null) {
            matching = matching.limit(filter.limit());
        }
        return matching.toList();
    }

    @Override
    public boolean deleteRun(String runId) {
        Objects.requireNonNull(runId, "runId must not be null");
        boolean removedRecord = executions.remove(runId) != null;
        boolean removedCheckpoints = checkpoints.remove(runId) != null;
        return removedRecord || removedCheckpoints;
    }

    /// Clears all data (useful for testing).
    public void clear() {
        checkpoints.clear();
        executions.clear();
    }
}
