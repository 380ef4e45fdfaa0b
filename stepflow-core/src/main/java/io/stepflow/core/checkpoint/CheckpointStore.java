package io.stepflow.core.checkpoint;

import java.util.List;
import java.util.Optional;

/// Persistence for step checkpoints and run records.
///
/// ### Contracts
/// - checkpoints are upserted by `(runId, stepIndex)`
/// - {@link #listCheckpoints} returns a run's checkpoints in `stepIndex` order
/// - {@link #listExecutions} returns the most recently started runs first
///
/// @implNote Implementations must be thread-safe; parallel tasks never write checkpoints but
/// several runs may write concurrently.
public interface CheckpointStore {

    /// Inserts or replaces a checkpoint.
    ///
    /// @param checkpoint checkpoint to store, not null
    void writeCheckpoint(Checkpoint checkpoint);

    /// Returns a run's checkpoints ordered by step index.
    ///
    /// @param runId run identifier, not null
    /// @return checkpoints, never null (empty for unknown runs)
    List<Checkpoint> listCheckpoints(String runId);

    /// Alias of {@link #listCheckpoints}.
    default List<Checkpoint> getCheckpoints(String runId) {
        return listCheckpoints(runId);
    }

    /// Inserts or replaces a run record.
    ///
    /// @param record record to store, not null
    void saveExecution(ExecutionRecord record);

    /// @param runId run identifier, not null
    /// @return the run record, empty for unknown runs
    Optional<ExecutionRecord> getExecution(String runId);

    /// @param filter selection criteria, not null
    /// @return matching records, newest first, never null
    List<ExecutionRecord> listExecutions(ExecutionFilter filter);

    /// Deletes a run's record and checkpoints.
    ///
    /// @param runId run identifier, not null
    /// @return true if anything was deleted
    boolean deleteRun(String runId);
}
