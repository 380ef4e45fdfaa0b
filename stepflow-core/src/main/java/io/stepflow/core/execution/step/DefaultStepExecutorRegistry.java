package io.stepflow.core.execution.step;

import io.stepflow.core.workflow.step.WorkflowStep;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/// Default implementation of {@link StepExecutorRegistry} with every built-in executor
/// registered.
///
/// The built-in executors are stateless, so one registry can serve every run of an
/// environment.
public class DefaultStepExecutorRegistry implements StepExecutorRegistry {

    private final Map<Class<? extends WorkflowStep>, StepExecutor<?>> registry =
            new ConcurrentHashMap<>();

    /// Creates a registry with all built-in executors pre-registered.
    public DefaultStepExecutorRegistry() {
        register(new ActionStepExecutor());
        register(new IfStepExecutor());
        register(new ForEachStepExecutor());
        register(new WhileStepExecutor());
        register(new SwitchStepExecutor());
        register(new TryStepExecutor());
        register(new ParallelStepExecutor());
    }

    @Override
    public <T extends WorkflowStep> Optional<StepExecutor<T>> getExecutor(Class<T> stepType) {
        return Optional.ofNullable((StepExecutor<T>) registry.get(stepType));
    }

    @Override
    public <T extends WorkflowStep> StepExecutor<T> getExecutorOrThrow(Class<T> stepType) {
        return getExecutor(stepType)
                .orElseThrow(
                        () ->
                                new IllegalStateException(
                                        "No executor registered for step type: "
                                                + stepType.getSimpleName()));
    }

    @Override
    public <T extends WorkflowStep> void register(StepExecutor<T> executor) {
        Objects.requireNonNull(executor, "executor must not be null");
        registry.put(executor.getStepType(), executor);
    }

    @Override
    public boolean hasExecutor(Class<? extends WorkflowStep> stepType) {
        return registry.containsKey(stepType);
    }
}
