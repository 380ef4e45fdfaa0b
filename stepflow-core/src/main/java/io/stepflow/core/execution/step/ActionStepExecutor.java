package io.stepflow.core.execution.step;

import io.stepflow.core.exception.OperationTimeoutException;
import io.stepflow.core.exception.StepflowException;
import io.stepflow.core.exception.WorkflowCancelledException;
import io.stepflow.core.execution.ExecutionContext;
import io.stepflow.core.execution.action.Action;
import io.stepflow.core.util.Values;
import io.stepflow.core.workflow.step.ActionStep;
import io.stepflow.core.workflow.step.StepErrorPolicy;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.logging.Logger;

/// Executes action steps: conditions, input resolution, dispatch, step timeout, step-level
/// retries and `continueOnError`.
///
/// ### Contracts
/// - a falsy condition skips the step without resolving its inputs
/// - input resolution happens on every attempt, so a retry sees the current variables
/// - a timed-out attempt is abandoned, not interrupted
/// - cancellation and fatal errors are never retried or absorbed
public class ActionStepExecutor implements StepExecutor<ActionStep> {

    private static final Logger logger = Logger.getLogger(ActionStepExecutor.class.getName());

    @Override
    public Class<ActionStep> getStepType() {
        return ActionStep.class;
    }

    @Override
    public Object execute(ActionStep step, StepExecution execution) throws Exception {
        StepRuntime runtime = execution.getRuntime();
        ExecutionContext context = execution.getContext();

        for (String condition : step.conditions()) {
            Object value = runtime.templates().evaluate(condition, context.getVariables());
            if (!Values.isTruthy(value)) {
                logger.fine("Skipping step '" + step.id() + "': condition '" + condition + "'");
                execution.markSkipped();
                return null;
            }
        }

        StepErrorPolicy policy = step.errorPolicy();
        int attempt = 0;
        while (true) {
            try {
                Object result = attempt(step, execution);
                execution.recordRetries(attempt);
                return result;
            } catch (Exception e) {
                if (StepFailures.isUncatchable(e)) {
                    execution.recordRetries(attempt);
                    throw e;
                }
                if (attempt < policy.maxRetries() && StepFailures.isRetryable(e)) {
                    long delay = runtime.retryBackoff().delayMillis(attempt, retryAfterOf(e));
                    logger.fine(
                            "Retrying step '"
                                    + step.id()
                                    + "' after "
                                    + delay
                                    + "ms (attempt "
                                    + (attempt + 1)
                                    + " of "
                                    + policy.maxRetries()
                                    + "): "
                                    + StepFailures.message(e));
                    sleep(delay, context);
                    attempt++;
                    continue;
                }
                execution.recordRetries(attempt);
                if (policy.continueOnError()) {
                    String message = StepFailures.message(e);
                    logger.warning(
                            "Step '" + step.id() + "' failed, continuing on error: " + message);
                    execution.absorbFailure(message);
                    Map<String, Object> captured = new LinkedHashMap<>();
                    captured.put("error", message);
                    captured.put("step", step.id());
                    return captured;
                }
                throw e;
            }
        }
    }

    private Object attempt(ActionStep step, StepExecution execution) throws Exception {
        StepRuntime runtime = execution.getRuntime();
        ExecutionContext context = execution.getContext();
        Action action = Action.fromString(step.action());
        Object resolved = runtime.templates().resolve(step.inputs(), context.getVariables());
        Map<String, Object> inputs = Values.asMap(resolved);
        if (inputs == null) {
            inputs = Map.of();
        }
        execution.recordInputs(inputs);
        Map<String, Object> resolvedInputs = inputs;

        if (step.timeoutMs() == null || step.timeoutMs() <= 0) {
            return runtime.invoke(action, resolvedInputs, step.inputs(), context);
        }
        long timeoutMs = step.timeoutMs();
        CompletableFuture<Object> call =
                CompletableFuture.supplyAsync(
                        () -> runtime.invoke(action, resolvedInputs, step.inputs(), context),
                        runtime.stepExecutor());
        try {
            return call.get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            throw new OperationTimeoutException(
                    "Step '" + step.id() + "' timed out after " + timeoutMs + "ms", timeoutMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new WorkflowCancelledException("Interrupted while running step " + step.id(), e);
        } catch (ExecutionException e) {
            Throwable cause = StepFailures.unwrap(e);
            if (cause instanceof Exception exception) {
                throw exception;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw new CompletionException(cause);
        }
    }

    private static Optional<Duration> retryAfterOf(Exception e) {
        Throwable cause = StepFailures.unwrap(e);
        if (cause instanceof StepflowException stepflowException) {
            return stepflowException.retryAfter();
        }
        return Optional.empty();
    }

    private static void sleep(long delayMs, ExecutionContext context) {
        if (delayMs <= 0) {
            return;
        }
        try {
            Thread.sleep(delayMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new WorkflowCancelledException("Interrupted while waiting to retry", e);
        }
        context.checkCancelled();
    }
}
