package io.stepflow.core.execution;

import io.stepflow.core.checkpoint.Checkpoint;
import io.stepflow.core.checkpoint.CheckpointStatus;
import io.stepflow.core.workflow.Workflow;
import io.stepflow.core.workflow.step.WorkflowStep;
import java.util.logging.Logger;

/// Writes run and step progress to `java.util.logging`.
///
/// Run boundaries log at INFO, step boundaries at FINE, failed steps at WARNING.
public final class LoggingExecutionListener implements ExecutionListener {

    private static final Logger logger = Logger.getLogger(LoggingExecutionListener.class.getName());

    @Override
    public void onRunStart(Workflow workflow, ExecutionContext context) {
        logger.info("Run " + context.getRunId() + " started: workflow=" + workflow.getId());
    }

    @Override
    public void onStepStart(WorkflowStep step, ExecutionContext context) {
        logger.fine(
                "Run "
                        + context.getRunId()
                        + ": step '"
                        + step.displayName()
                        + "' ("
                        + step.type().wireName()
                        + ") started");
    }

    @Override
    public void onStepComplete(WorkflowStep step, Checkpoint checkpoint) {
        if (checkpoint.status() == CheckpointStatus.FAILED) {
            logger.warning(
                    "Run "
                            + checkpoint.runId()
                            + ": step '"
                            + checkpoint.stepName()
                            + "' failed after "
                            + checkpoint.retryCount()
                            + " retries: "
                            + checkpoint.error());
        } else {
            logger.fine(
                    "Run "
                            + checkpoint.runId()
                            + ": step '"
                            + checkpoint.stepName()
                            + "' "
                            + checkpoint.status().wireName());
        }
    }

    @Override
    public void onRunComplete(ExecutionResult result) {
        logger.info(
                "Run "
                        + result.runId()
                        + " "
                        + result.status().wireName()
                        + " in "
                        + result.duration().toMillis()
                        + "ms"
                        + (result.error() != null ? ": " + result.error() : ""));
    }
}
