package io.stepflow.core.execution.builtin;

import io.stepflow.core.exception.StepflowException;
import io.stepflow.core.exception.WorkflowCancelledException;
import io.stepflow.core.util.Durations;
import io.stepflow.core.util.Values;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/// The run-control operations under `workflow.*`.
final class WorkflowOperations {

    private static final Logger logger = Logger.getLogger("io.stepflow.workflow");

    private WorkflowOperations() {}

    static void registerAll(BuiltinOperations registry, Clock clock) {
        registry.register("workflow.set_outputs", WorkflowOperations::setOutputs);
        registry.register("workflow.sleep", WorkflowOperations::sleep);
        registry.register("workflow.fail", WorkflowOperations::fail);
        registry.register("workflow.log", WorkflowOperations::log);
        registry.register("workflow.timestamp", op -> timestamp(op, clock));
        registry.register("workflow.noop", op -> Map.of("success", true));
    }

    /// Returns the inputs plus the outputs marker; the engine moves the marked values into the
    /// run's outputs.
    private static Object setOutputs(OperationContext op) {
        Map<String, Object> result = new LinkedHashMap<>(op.inputs());
        result.put(BuiltinOperations.WORKFLOW_OUTPUTS_KEY, new LinkedHashMap<>(op.inputs()));
        return result;
    }

    private static Object sleep(OperationContext op) {
        long millis = Durations.parseMillis(op.input("duration"), 0);
        if (millis > 0) {
            try {
                Thread.sleep(millis);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new WorkflowCancelledException("Interrupted during workflow.sleep", e);
            }
        }
        return Map.of("slept", millis);
    }

    private static Object fail(OperationContext op) {
        String message = Values.stringify(op.input("message", "Workflow failed"));
        Object code = op.input("code");
        throw new StepflowException(
                code != null ? Values.stringify(code) + ": " + message : message, false);
    }

    private static Object log(OperationContext op) {
        String level = Values.stringify(op.input("level", "info")).toLowerCase(Locale.ROOT);
        String message = Values.stringify(op.input("message"));
        Map<String, Object> metadata = Values.asMap(op.input("metadata"));
        if (metadata != null && !metadata.isEmpty()) {
            message = message + " " + Values.stringify(metadata);
        }
        logger.log(toLevel(level), "[" + op.context().getRunId() + "] " + message);
        return Map.of("logged", true);
    }

    static Level toLevel(String level) {
        return switch (level) {
            case "debug" -> Level.FINE;
            case "warning", "warn" -> Level.WARNING;
            case "error", "critical" -> Level.SEVERE;
            default -> Level.INFO;
        };
    }

    private static Object timestamp(OperationContext op, Clock clock) {
        long now = clock.millis();
        Object value =
                switch (Values.stringify(op.input("format", "iso"))) {
                    case "unix" -> now / 1000;
                    case "ms" -> now;
                    default -> clock.instant().toString();
                };
        return Map.of("timestamp", value);
    }
}
