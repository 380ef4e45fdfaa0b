package io.stepflow.core.checkpoint;

import io.stepflow.core.execution.ExecutionStatus;

/// Criteria for {@link CheckpointStore#listExecutions}. Null fields match everything.
///
/// @param workflowId only runs of this workflow, may be null
/// @param status only runs in this status, may be null
/// @param limit maximum records returned, may be null
public record ExecutionFilter(String workflowId, ExecutionStatus status, Integer limit) {

    public static final ExecutionFilter ALL = new ExecutionFilter(null, null, null);

    public static ExecutionFilter forWorkflow(String workflowId) {
        return new ExecutionFilter(workflowId, null, null);
    }

    public boolean matches(ExecutionRecord record) {
        return (workflowId == null || workflowId.equals(record.workflowId()))
                && (status == null || status == record.status());
    }
}
