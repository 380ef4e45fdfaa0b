package io.stepflow.core.execution.step;

import io.stepflow.core.exception.StepflowException;
import io.stepflow.core.exception.WorkflowCancelledException;
import io.stepflow.core.exception.WorkflowFatalException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/// Helpers for turning step failures into messages and error bindings.
public final class StepFailures {

    private StepFailures() {}

    /// Returns the failure's message, or its type name when it has none.
    public static String message(Throwable error) {
        Throwable cause = unwrap(error);
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }

    /// Builds the `{message, type, step}` map bound as `error` in catch blocks.
    public static Map<String, Object> toErrorMap(Throwable error, String stepId) {
        Throwable cause = unwrap(error);
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("message", message(cause));
        map.put("type", cause.getClass().getSimpleName());
        map.put("step", stepId);
        return map;
    }

    /// Returns whether the failure must end the run regardless of catch blocks and error
    /// policies.
    public static boolean isUncatchable(Throwable error) {
        Throwable cause = unwrap(error);
        return cause instanceof WorkflowCancelledException
                || cause instanceof WorkflowFatalException;
    }

    /// Returns whether a step-level retry may help.
    ///
    /// Non-retryable stepflow failures, such as validation errors or `workflow.fail`, are
    /// final. Failures from outside the stepflow hierarchy are retried.
    public static boolean isRetryable(Throwable error) {
        Throwable cause = unwrap(error);
        if (cause instanceof StepflowException stepflowException) {
            return stepflowException.isRetryable();
        }
        return true;
    }

    /// Strips completion and execution wrappers.
    public static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
