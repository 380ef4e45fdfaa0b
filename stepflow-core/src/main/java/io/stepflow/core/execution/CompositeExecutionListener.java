package io.stepflow.core.execution;

import io.stepflow.core.checkpoint.Checkpoint;
import io.stepflow.core.workflow.Workflow;
import io.stepflow.core.workflow.step.WorkflowStep;
import java.util.List;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/// Fans every callback out to a fixed list of listeners, in order.
///
/// A listener that throws is logged and skipped; it never fails the run or starves the
/// listeners after it.
public final class CompositeExecutionListener implements ExecutionListener {

    private static final Logger logger =
            Logger.getLogger(CompositeExecutionListener.class.getName());

    private final List<ExecutionListener> listeners;

    public CompositeExecutionListener(List<ExecutionListener> listeners) {
        this.listeners = List.copyOf(listeners);
    }

    public static ExecutionListener of(ExecutionListener... listeners) {
        return new CompositeExecutionListener(List.of(listeners));
    }

    @Override
    public void onRunStart(Workflow workflow, ExecutionContext context) {
        forEach(listener -> listener.onRunStart(workflow, context));
    }

    @Override
    public void onStepStart(WorkflowStep step, ExecutionContext context) {
        forEach(listener -> listener.onStepStart(step, context));
    }

    @Override
    public void onStepComplete(WorkflowStep step, Checkpoint checkpoint) {
        forEach(listener -> listener.onStepComplete(step, checkpoint));
    }

    @Override
    public void onCheckpoint(Checkpoint checkpoint) {
        forEach(listener -> listener.onCheckpoint(checkpoint));
    }

    @Override
    public void onRunComplete(ExecutionResult result) {
        forEach(listener -> listener.onRunComplete(result));
    }

    private void forEach(Consumer<ExecutionListener> callback) {
        for (ExecutionListener listener : listeners) {
            try {
                callback.accept(listener);
            } catch (RuntimeException e) {
                logger.log(
                        Level.WARNING,
                        "Execution listener " + listener.getClass().getName() + " failed",
                        e);
            }
        }
    }
}
