package io.stepflow.core.execution;

import io.stepflow.core.checkpoint.Checkpoint;
import io.stepflow.core.checkpoint.CheckpointStore;
import io.stepflow.core.checkpoint.ExecutionRecord;
import io.stepflow.core.checkpoint.InMemoryCheckpointStore;
import io.stepflow.core.exception.ValidationException;
import io.stepflow.core.exception.WorkflowCancelledException;
import io.stepflow.core.exception.WorkflowFatalException;
import io.stepflow.core.execution.action.Action;
import io.stepflow.core.execution.action.StepInvoker;
import io.stepflow.core.execution.builtin.BuiltinOperation;
import io.stepflow.core.execution.builtin.BuiltinOperations;
import io.stepflow.core.execution.builtin.OperationContext;
import io.stepflow.core.execution.step.DefaultStepExecutorRegistry;
import io.stepflow.core.execution.step.StepExecution;
import io.stepflow.core.execution.step.StepExecutor;
import io.stepflow.core.execution.step.StepExecutorRegistry;
import io.stepflow.core.execution.step.StepFailures;
import io.stepflow.core.execution.step.StepRuntime;
import io.stepflow.core.reliability.BackoffPolicy;
import io.stepflow.core.template.ExpressionTemplateResolver;
import io.stepflow.core.template.TemplateResolver;
import io.stepflow.core.util.Values;
import io.stepflow.core.workflow.ErrorHandling;
import io.stepflow.core.workflow.Workflow;
import io.stepflow.core.workflow.WorkflowInput;
import io.stepflow.core.workflow.step.ActionStep;
import io.stepflow.core.workflow.step.ForEachStep;
import io.stepflow.core.workflow.step.ParallelStep;
import io.stepflow.core.workflow.step.WorkflowStep;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.logging.Logger;

/// Main execution engine for Stepflow workflows.
///
/// Runs a workflow's steps in order on the calling thread, delegating each step to the
/// {@link StepExecutor} registered for its type. Actions go to a built-in operation or, for
/// tool calls, to the {@link StepInvoker}.
///
/// ### Contracts
/// - **Precondition**: every required input without a default is supplied, otherwise
///   {@link WorkflowFatalException} is thrown before any step runs
/// - **Postcondition**: returns a terminal {@link ExecutionResult}; step failures never escape
///   as exceptions
/// - **Invariant**: every step occurrence gets a `pending` checkpoint before it runs and a
///   final checkpoint after, with strictly increasing step indexes within a run
///
/// ### Outputs
/// A step result carrying {@link BuiltinOperations#WORKFLOW_OUTPUTS_KEY} is merged into the
/// run's outputs instead of a variable. When no step published outputs, the outputs are the
/// values of the output variables written by top-level steps.
///
/// ### Cancellation
/// {@link #cancel(String)} is cooperative: it is observed before the next step occurrence or
/// loop iteration starts, and a step already running finishes and is checkpointed.
///
/// @implNote Thread-safe. Any number of runs may execute concurrently on different threads;
/// each run's variables are confined to the thread executing it.
///
/// @see StepExecutorRegistry for step type dispatch
/// @see CheckpointStore for the audit trail
public class WorkflowEngine {

    private static final Logger logger = Logger.getLogger(WorkflowEngine.class.getName());

    static final String LAST_ERROR_VARIABLE = "last_error";

    private final StepExecutorRegistry stepExecutors;
    private final BuiltinOperations builtins;
    private final StepInvoker stepInvoker;
    private final TemplateResolver templateResolver;
    private final CheckpointStore checkpoints;
    private final ExecutorService stepTimeoutExecutor;
    private final BackoffPolicy retryBackoff;
    private final int defaultMaxIterations;
    private final Clock clock;
    private final Map<String, ExecutionContext> activeRuns = new ConcurrentHashMap<>();

    private WorkflowEngine(Builder builder) {
        this.stepExecutors =
                Objects.requireNonNull(builder.stepExecutors, "stepExecutors must not be null");
        this.builtins = Objects.requireNonNull(builder.builtins, "builtins must not be null");
        this.stepInvoker =
                Objects.requireNonNull(builder.stepInvoker, "stepInvoker must not be null");
        this.templateResolver =
                Objects.requireNonNull(
                        builder.templateResolver, "templateResolver must not be null");
        this.checkpoints =
                Objects.requireNonNull(builder.checkpoints, "checkpoints must not be null");
        this.stepTimeoutExecutor =
                Objects.requireNonNull(
                        builder.stepTimeoutExecutor, "stepTimeoutExecutor must not be null");
        this.retryBackoff =
                Objects.requireNonNull(builder.retryBackoff, "retryBackoff must not be null");
        this.defaultMaxIterations = builder.defaultMaxIterations;
        this.clock = Objects.requireNonNull(builder.clock, "clock must not be null");
    }

    public static Builder builder() {
        return new Builder();
    }

    /// Executes a workflow under a generated run id without a listener.
    ///
    /// @param workflow the workflow to execute, not null
    /// @param inputs caller inputs, not null
    /// @return terminal result, never null
    /// @throws WorkflowFatalException if a required input is missing
    public ExecutionResult execute(Workflow workflow, Map<String, Object> inputs) {
        return execute(workflow, inputs, ExecutionListener.NOOP);
    }

    /// Executes a workflow under a generated run id.
    ///
    /// @see #execute(Workflow, Map, String, ExecutionListener)
    public ExecutionResult execute(
            Workflow workflow, Map<String, Object> inputs, ExecutionListener listener) {
        return execute(workflow, inputs, UUID.randomUUID().toString(), listener);
    }

    /// Executes a workflow under a caller-chosen run id.
    ///
    /// @apiNote **Side effects**:
    /// - writes the run's execution record and checkpoints to the checkpoint store
    /// - invokes external tools and built-in operations with side effects
    /// - logs run start and end at INFO level
    ///
    /// @param workflow the workflow to execute, not null
    /// @param inputs caller inputs, not null
    /// @param runId run identifier, unique among active runs, not null
    /// @param listener observer of run and step events, not null
    /// @return terminal result, never null
    /// @throws WorkflowFatalException if a required input is missing
    /// @throws ValidationException if a run with the same id is active
    public ExecutionResult execute(
            Workflow workflow,
            Map<String, Object> inputs,
            String runId,
            ExecutionListener listener) {
        Objects.requireNonNull(workflow, "workflow must not be null");
        Objects.requireNonNull(inputs, "inputs must not be null");
        Objects.requireNonNull(runId, "runId must not be null");
        Objects.requireNonNull(listener, "listener must not be null");

        Map<String, Object> effectiveInputs = applyInputs(workflow, inputs);
        ExecutionContext context = new ExecutionContext(workflow, runId, effectiveInputs);
        if (activeRuns.putIfAbsent(runId, context) != null) {
            throw new ValidationException("Run '" + runId + "' is already active");
        }
        ExecutionListener events = CompositeExecutionListener.of(listener);

        Instant startedAt = clock.instant();
        context.markRunning(startedAt);
        ExecutionRecord record =
                ExecutionRecord.started(runId, workflow.getId(), effectiveInputs, startedAt);
        logger.info("Starting run " + runId + " of workflow " + workflow.getId());

        ExecutionStatus status;
        String error = null;
        try {
            checkpoints.saveExecution(record);
            events.onRunStart(workflow, context);
            new Run(events).executeTopLevel(workflow, context);
            status = ExecutionStatus.COMPLETED;
        } catch (WorkflowCancelledException e) {
            status = ExecutionStatus.CANCELLED;
            error = e.getMessage();
        } catch (Exception e) {
            status = ExecutionStatus.FAILED;
            error = StepFailures.message(e);
        } finally {
            activeRuns.remove(runId);
        }

        Instant completedAt = clock.instant();
        Map<String, Object> outputs =
                context.hasPublishedOutputs()
                        ? context.getOutputs()
                        : defaultOutputs(workflow, context);
        context.markFinished(status, error, completedAt);
        checkpoints.saveExecution(
                record.finished(
                        status, outputs, error, context.getCurrentStepIndex(), completedAt));

        ExecutionResult result =
                new ExecutionResult(
                        runId,
                        status,
                        outputs,
                        Duration.between(startedAt, completedAt),
                        error,
                        context.getVariables());
        if (status == ExecutionStatus.COMPLETED) {
            logger.info("Run " + runId + " completed in " + result.duration().toMillis() + "ms");
        } else {
            logger.warning("Run " + runId + " " + status.wireName() + ": " + error);
        }
        events.onRunComplete(result);
        return result;
    }

    /// Requests cooperative cancellation of an active run.
    ///
    /// @param runId run identifier, not null
    /// @return true if the run was active
    public boolean cancel(String runId) {
        Objects.requireNonNull(runId, "runId must not be null");
        ExecutionContext context = activeRuns.get(runId);
        if (context == null) {
            return false;
        }
        logger.info("Cancellation requested for run " + runId);
        context.requestCancel();
        return true;
    }

    /// Returns the ids of the runs currently executing.
    public Set<String> getActiveRunIds() {
        return Set.copyOf(activeRuns.keySet());
    }

    public CheckpointStore getCheckpointStore() {
        return checkpoints;
    }

    public BuiltinOperations getBuiltins() {
        return builtins;
    }

    public StepExecutorRegistry getStepExecutors() {
        return stepExecutors;
    }

    private static Map<String, Object> applyInputs(
            Workflow workflow, Map<String, Object> inputs) {
        Map<String, Object> effective = new LinkedHashMap<>(inputs);
        for (WorkflowInput declared : workflow.getInputs()) {
            if (effective.get(declared.name()) != null) {
                continue;
            }
            if (declared.defaultValue() != null) {
                effective.put(declared.name(), declared.defaultValue());
            } else if (declared.required()) {
                throw new WorkflowFatalException(
                        "Missing required input '"
                                + declared.name()
                                + "' for workflow "
                                + workflow.getId());
            }
        }
        return effective;
    }

    private static Map<String, Object> defaultOutputs(
            Workflow workflow, ExecutionContext context) {
        Map<String, Object> outputs = new LinkedHashMap<>();
        for (WorkflowStep step : workflow.getSteps()) {
            String variable = outputVariableOf(step);
            if (variable != null && context.getVariables().containsKey(variable)) {
                outputs.put(variable, context.getVariable(variable));
            }
        }
        return outputs;
    }

    private static String outputVariableOf(WorkflowStep step) {
        if (step instanceof ActionStep action) {
            return action.outputVariable();
        }
        if (step instanceof ForEachStep forEach) {
            return forEach.outputVariable();
        }
        if (step instanceof ParallelStep parallel) {
            return parallel.outputVariable();
        }
        return null;
    }

    /// Engine services of one run, handed to step executors.
    private final class Run implements StepRuntime {

        private final ExecutionListener listener;

        private Run(ExecutionListener listener) {
            this.listener = listener;
        }

        void executeTopLevel(Workflow workflow, ExecutionContext context) throws Exception {
            for (WorkflowStep step : workflow.getSteps()) {
                try {
                    executeStep(step, context);
                } catch (Exception e) {
                    if (workflow.getErrorHandling() != ErrorHandling.CONTINUE
                            || StepFailures.isUncatchable(e)) {
                        throw e;
                    }
                    String failedStep = context.failedStepOf(e).orElse(step.id());
                    context.setVariable(
                            LAST_ERROR_VARIABLE, StepFailures.toErrorMap(e, failedStep));
                    logger.warning(
                            "Step '"
                                    + failedStep
                                    + "' failed, continuing run "
                                    + context.getRunId()
                                    + ": "
                                    + StepFailures.message(e));
                }
            }
        }

        @Override
        public Object executeSteps(List<WorkflowStep> steps, ExecutionContext context)
                throws Exception {
            Object last = null;
            for (WorkflowStep step : steps) {
                last = executeStep(step, context);
            }
            return last;
        }

        private Object executeStep(WorkflowStep step, ExecutionContext context) throws Exception {
            context.checkCancelled();
            StepExecutor<WorkflowStep> executor = stepExecutors.getExecutorFor(step);
            int index = context.nextStepIndex();
            Checkpoint pending =
                    Checkpoint.pending(
                            context.getRunId(),
                            index,
                            step.id(),
                            step.displayName(),
                            Map.of(),
                            clock.instant());
            writeCheckpoint(pending);
            listener.onStepStart(step, context);

            StepExecution execution = new StepExecution(step, index, context, this);
            Object result;
            try {
                result = executor.execute(step, execution);
            } catch (Exception e) {
                context.recordFailure(e, step.id());
                Checkpoint failed =
                        pending.withInputs(execution.getResolvedInputs())
                                .failed(
                                        StepFailures.message(e),
                                        execution.getRetryCount(),
                                        clock.instant());
                writeCheckpoint(failed);
                listener.onStepComplete(step, failed);
                throw e;
            }

            Checkpoint finished = pending.withInputs(execution.getResolvedInputs());
            if (execution.isSkipped()) {
                finished = finished.skipped(clock.instant());
            } else if (execution.isFailureAbsorbed()) {
                finished =
                        finished.failed(
                                execution.getAbsorbedError(),
                                execution.getRetryCount(),
                                clock.instant());
            } else {
                finished = finished.completed(result, execution.getRetryCount(), clock.instant());
            }
            writeCheckpoint(finished);
            listener.onStepComplete(step, finished);

            if (!execution.isSkipped()) {
                storeResult(step, result, context);
            }
            return result;
        }

        private void storeResult(WorkflowStep step, Object result, ExecutionContext context) {
            Map<String, Object> map = Values.asMap(result);
            if (map != null && map.containsKey(BuiltinOperations.WORKFLOW_OUTPUTS_KEY)) {
                Map<String, Object> published = new LinkedHashMap<>(map);
                published.remove(BuiltinOperations.WORKFLOW_OUTPUTS_KEY);
                context.publishOutputs(published);
                return;
            }
            String variable = outputVariableOf(step);
            if (variable != null) {
                context.setVariable(variable, result);
            }
        }

        private void writeCheckpoint(Checkpoint checkpoint) {
            checkpoints.writeCheckpoint(checkpoint);
            listener.onCheckpoint(checkpoint);
        }

        @Override
        public Object invoke(
                Action action,
                Map<String, Object> inputs,
                Map<String, Object> rawInputs,
                ExecutionContext context) {
            if (action instanceof Action.BuiltinAction) {
                String name = action.getActionName();
                BuiltinOperation operation =
                        builtins.get(name)
                                .orElseThrow(
                                        () ->
                                                new ValidationException(
                                                        "Unknown operation: " + name));
                return operation.execute(
                        new OperationContext(
                                name,
                                inputs,
                                rawInputs,
                                context,
                                templateResolver,
                                this::dispatch));
            }
            if (action instanceof Action.ToolCall call) {
                return stepInvoker.invoke(call, inputs, context);
            }
            throw new IllegalStateException("Unsupported action: " + action);
        }

        @Override
        public Object dispatch(
                String actionName, Map<String, Object> rawInputs, ExecutionContext context) {
            Action action = Action.fromString(actionName);
            Map<String, Object> resolved =
                    Values.asMap(templateResolver.resolve(rawInputs, context.getVariables()));
            return invoke(action, resolved != null ? resolved : Map.of(), rawInputs, context);
        }

        @Override
        public TemplateResolver templates() {
            return templateResolver;
        }

        @Override
        public int defaultMaxIterations() {
            return defaultMaxIterations;
        }

        @Override
        public BackoffPolicy retryBackoff() {
            return retryBackoff;
        }

        @Override
        public ExecutorService stepExecutor() {
            return stepTimeoutExecutor;
        }

        @Override
        public Clock clock() {
            return clock;
        }
    }

    /// Builder for {@link WorkflowEngine}.
    ///
    /// Only the built-in operations, the step invoker and the step-timeout executor are
    /// required; everything else has a default.
    public static final class Builder {
        private StepExecutorRegistry stepExecutors = new DefaultStepExecutorRegistry();
        private BuiltinOperations builtins;
        private StepInvoker stepInvoker;
        private TemplateResolver templateResolver = new ExpressionTemplateResolver();
        private CheckpointStore checkpoints = new InMemoryCheckpointStore();
        private ExecutorService stepTimeoutExecutor;
        private BackoffPolicy retryBackoff = new BackoffPolicy(1_000, 30_000);
        private int defaultMaxIterations = 1_000;
        private Clock clock = Clock.systemUTC();

        private Builder() {}

        public Builder stepExecutors(StepExecutorRegistry stepExecutors) {
            this.stepExecutors = stepExecutors;
            return this;
        }

        public Builder builtins(BuiltinOperations builtins) {
            this.builtins = builtins;
            return this;
        }

        public Builder stepInvoker(StepInvoker stepInvoker) {
            this.stepInvoker = stepInvoker;
            return this;
        }

        public Builder templateResolver(TemplateResolver templateResolver) {
            this.templateResolver = templateResolver;
            return this;
        }

        public Builder checkpoints(CheckpointStore checkpoints) {
            this.checkpoints = checkpoints;
            return this;
        }

        public Builder stepTimeoutExecutor(ExecutorService stepTimeoutExecutor) {
            this.stepTimeoutExecutor = stepTimeoutExecutor;
            return this;
        }

        public Builder retryBackoff(BackoffPolicy retryBackoff) {
            this.retryBackoff = retryBackoff;
            return this;
        }

        public Builder defaultMaxIterations(int defaultMaxIterations) {
            if (defaultMaxIterations <= 0) {
                throw new IllegalArgumentException("defaultMaxIterations must be positive");
            }
            this.defaultMaxIterations = defaultMaxIterations;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public WorkflowEngine build() {
            return new WorkflowEngine(this);
        }
    }
}
