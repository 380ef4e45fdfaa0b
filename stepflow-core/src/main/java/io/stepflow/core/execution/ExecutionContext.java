package io.stepflow.core.execution;

import io.stepflow.core.exception.WorkflowCancelledException;
import io.stepflow.core.workflow.Workflow;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/// Mutable state of one workflow run.
///
/// The context owns the run's variable mapping. Inputs are visible both as `inputs.<name>` and
/// directly by name. Variables are only ever added or overwritten within a run, so later steps
/// see every earlier step's output.
///
/// ### Scoped copies
/// {@link #fork()} returns a context with a copied variable map for loop bodies and parallel
/// tasks. A fork shares the run identity, the step occurrence counter, the published outputs
/// and the cancellation flag with its parent, but variable writes made through it never reach
/// the parent.
///
/// @implNote Not thread-safe for variable writes: the engine mutates variables only on the
/// thread driving the run, and parallel tasks each work on their own fork. The occurrence
/// counter, published outputs and cancellation flag are safe to share.
public final class ExecutionContext {

    private final Workflow workflow;
    private final String runId;
    private final Map<String, Object> inputs;
    private final Map<String, Object> variables;
    private final Map<String, Object> outputs;
    private final AtomicInteger stepCounter;
    private final AtomicBoolean cancelRequested;
    private final AtomicBoolean outputsPublished;
    private final AtomicReference<FailedStep> lastFailure;
    private final boolean forked;

    private volatile ExecutionStatus status = ExecutionStatus.PENDING;
    private Instant startedAt;
    private Instant completedAt;
    private String error;

    /// Creates the root context of a run.
    ///
    /// @param workflow workflow being executed, not null
    /// @param runId run identifier, not null
    /// @param inputs effective run inputs with defaults applied, not null
    public ExecutionContext(Workflow workflow, String runId, Map<String, Object> inputs) {
        this.workflow = Objects.requireNonNull(workflow, "workflow must not be null");
        this.runId = Objects.requireNonNull(runId, "runId must not be null");
        Objects.requireNonNull(inputs, "inputs must not be null");
        this.inputs = Collections.unmodifiableMap(new LinkedHashMap<>(inputs));
        this.variables = new LinkedHashMap<>(inputs);
        this.variables.put("inputs", this.inputs);
        this.outputs = Collections.synchronizedMap(new LinkedHashMap<>());
        this.stepCounter = new AtomicInteger();
        this.cancelRequested = new AtomicBoolean();
        this.outputsPublished = new AtomicBoolean();
        this.lastFailure = new AtomicReference<>();
        this.forked = false;
    }

    private ExecutionContext(ExecutionContext parent) {
        this.workflow = parent.workflow;
        this.runId = parent.runId;
        this.inputs = parent.inputs;
        this.variables = new LinkedHashMap<>(parent.variables);
        this.outputs = parent.outputs;
        this.stepCounter = parent.stepCounter;
        this.cancelRequested = parent.cancelRequested;
        this.outputsPublished = parent.outputsPublished;
        this.lastFailure = parent.lastFailure;
        this.forked = true;
        this.status = parent.status;
        this.startedAt = parent.startedAt;
    }

    /// Returns a scoped copy whose variable writes stay local.
    public ExecutionContext fork() {
        return new ExecutionContext(this);
    }

    /// Returns a scoped copy with extra bindings applied.
    ///
    /// @param bindings variables to bind in the copy, not null
    public ExecutionContext fork(Map<String, Object> bindings) {
        ExecutionContext child = fork();
        child.variables.putAll(bindings);
        return child;
    }

    public Workflow getWorkflow() {
        return workflow;
    }

    public String getWorkflowId() {
        return workflow.getId();
    }

    public String getRunId() {
        return runId;
    }

    public Map<String, Object> getInputs() {
        return inputs;
    }

    /// Returns the live variable map of this scope.
    public Map<String, Object> getVariables() {
        return variables;
    }

    public Object getVariable(String name) {
        return variables.get(name);
    }

    public void setVariable(String name, Object value) {
        Objects.requireNonNull(name, "name must not be null");
        variables.put(name, value);
    }

    public boolean isForked() {
        return forked;
    }

    /// Merges values into the run's published outputs.
    public void publishOutputs(Map<String, Object> values) {
        outputs.putAll(values);
        outputsPublished.set(true);
    }

    /// Returns whether any step published outputs explicitly.
    public boolean hasPublishedOutputs() {
        return outputsPublished.get();
    }

    public Map<String, Object> getOutputs() {
        synchronized (outputs) {
            return new LinkedHashMap<>(outputs);
        }
    }

    /// Reserves the next step occurrence index of the run.
    public int nextStepIndex() {
        return stepCounter.getAndIncrement();
    }

    /// Returns the number of step occurrences started so far.
    public int getCurrentStepIndex() {
        return stepCounter.get();
    }

    public void requestCancel() {
        cancelRequested.set(true);
    }

    public boolean isCancelRequested() {
        return cancelRequested.get();
    }

    /// Throws if cancellation was requested.
    ///
    /// @throws WorkflowCancelledException if the run was cancelled
    public void checkCancelled() {
        if (cancelRequested.get()) {
            throw new WorkflowCancelledException("Run " + runId + " was cancelled");
        }
    }

    /// Remembers which step raised a failure. The innermost step to report an exception wins;
    /// enclosing steps rethrowing the same exception do not overwrite it.
    ///
    /// @param error the failure, not null
    /// @param stepId id of the step that failed, not null
    public void recordFailure(Throwable error, String stepId) {
        lastFailure.updateAndGet(
                current ->
                        current != null && current.error() == error
                                ? current
                                : new FailedStep(error, stepId));
    }

    /// Returns the id of the step that raised the failure, if it was recorded.
    public Optional<String> failedStepOf(Throwable error) {
        FailedStep failed = lastFailure.get();
        return failed != null && failed.error() == error
                ? Optional.of(failed.stepId())
                : Optional.empty();
    }

    public ExecutionStatus getStatus() {
        return status;
    }

    void markRunning(Instant at) {
        this.status = ExecutionStatus.RUNNING;
        this.startedAt = at;
    }

    void markFinished(ExecutionStatus finalStatus, String finalError, Instant at) {
        this.status = finalStatus;
        this.error = finalError;
        this.completedAt = at;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public Instant getCompletedAt() {
        return completedAt;
    }

    public String getError() {
        return error;
    }

    private record FailedStep(Throwable error, String stepId) {}
}
