package io.stepflow.core.execution.step;

import io.stepflow.core.execution.ExecutionContext;
import io.stepflow.core.workflow.step.WorkflowStep;
import java.util.Map;
import java.util.Objects;

/// Handle of one step occurrence, handed to its {@link StepExecutor}.
///
/// Executors report what the checkpoint should record through it: the resolved inputs, how
/// many retries were used, and whether the step was skipped or failed with the failure
/// absorbed.
///
/// @implNote Confined to the engine thread running the step.
public final class StepExecution {

    private final WorkflowStep step;
    private final int stepIndex;
    private final ExecutionContext context;
    private final StepRuntime runtime;

    private Map<String, Object> resolvedInputs = Map.of();
    private int retryCount;
    private boolean skipped;
    private String absorbedError;

    public StepExecution(
            WorkflowStep step, int stepIndex, ExecutionContext context, StepRuntime runtime) {
        this.step = Objects.requireNonNull(step, "step must not be null");
        this.stepIndex = stepIndex;
        this.context = Objects.requireNonNull(context, "context must not be null");
        this.runtime = Objects.requireNonNull(runtime, "runtime must not be null");
    }

    public WorkflowStep getStep() {
        return step;
    }

    public int getStepIndex() {
        return stepIndex;
    }

    /// Returns the variable scope the step runs in.
    public ExecutionContext getContext() {
        return context;
    }

    public StepRuntime getRuntime() {
        return runtime;
    }

    public Map<String, Object> getResolvedInputs() {
        return resolvedInputs;
    }

    public void recordInputs(Map<String, Object> inputs) {
        this.resolvedInputs = inputs != null ? inputs : Map.of();
    }

    public int getRetryCount() {
        return retryCount;
    }

    public void recordRetries(int retries) {
        this.retryCount = retries;
    }

    /// Marks the occurrence skipped; its checkpoint is finalized as `skipped`.
    public void markSkipped() {
        this.skipped = true;
    }

    public boolean isSkipped() {
        return skipped;
    }

    /// Marks the occurrence failed without failing the run; its checkpoint is finalized as
    /// `failed` while the step still returns a result.
    public void absorbFailure(String error) {
        this.absorbedError = Objects.requireNonNull(error, "error must not be null");
    }

    public boolean isFailureAbsorbed() {
        return absorbedError != null;
    }

    public String getAbsorbedError() {
        return absorbedError;
    }
}
