package io.stepflow.core.execution.step;

import io.stepflow.core.execution.ExecutionContext;
import io.stepflow.core.workflow.step.TryStep;
import java.util.logging.Logger;

/// Executes `try` steps.
///
/// A failure in the try block binds `error` as `{message, type, step}` and runs the catch
/// block; a failure in the catch block propagates. The finally block always runs and sees the
/// error binding. Cancellation and fatal errors skip the catch block but still run finally.
public class TryStepExecutor implements StepExecutor<TryStep> {

    private static final Logger logger = Logger.getLogger(TryStepExecutor.class.getName());

    @Override
    public Class<TryStep> getStepType() {
        return TryStep.class;
    }

    @Override
    public Object execute(TryStep step, StepExecution execution) throws Exception {
        StepRuntime runtime = execution.getRuntime();
        ExecutionContext context = execution.getContext();
        try {
            return runtime.executeSteps(step.trySteps(), context);
        } catch (Exception e) {
            if (StepFailures.isUncatchable(e)) {
                throw e;
            }
            logger.fine(
                    "Caught failure in try '" + step.id() + "': " + StepFailures.message(e));
            String failedStep = context.failedStepOf(e).orElse(step.id());
            context.setVariable("error", StepFailures.toErrorMap(e, failedStep));
            return runtime.executeSteps(step.catchSteps(), context);
        } finally {
            if (!step.finallySteps().isEmpty()) {
                runtime.executeSteps(step.finallySteps(), context);
            }
        }
    }
}
