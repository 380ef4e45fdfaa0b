package io.stepflow.core;

import io.stepflow.core.checkpoint.CheckpointStore;
import io.stepflow.core.event.EventSourceManager;
import io.stepflow.core.execution.WorkflowEngine;
import io.stepflow.core.reliability.ReliabilityWrapper;
import io.stepflow.core.tool.ToolRegistry;
import io.stepflow.core.tool.secret.SecretResolver;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.logging.Logger;

/// Container holding all Stepflow components required for workflow execution.
///
/// This class serves as the central access point for all services after environment
/// initialization. It implements {@link AutoCloseable} to release the thread pools, the
/// rate limiter's drain tasks and any connected event sources.
///
/// ### Contracts
/// - **Precondition**: All constructor parameters must be non-null
/// - **Postcondition**: All getters return the same instances passed to constructor
/// - **Invariant**: Component references are immutable after construction
///
/// @implNote **Not thread-safe** for mutation, but safe for concurrent reads.
/// All fields are final and set at construction time.
///
/// @apiNote Create instances via {@link StepflowFactory#createEnvironment()} or
/// {@link StepflowFactory.Builder} rather than direct construction.
///
/// @see StepflowFactory#createEnvironment()
/// @see StepflowFactory.Builder
public final class StepflowEnvironment implements AutoCloseable {

    private static final Logger logger = Logger.getLogger(StepflowEnvironment.class.getName());

    private final StepflowConfig config;
    private final WorkflowEngine engine;
    private final ToolRegistry toolRegistry;
    private final SecretResolver secretResolver;
    private final ReliabilityWrapper reliability;
    private final EventSourceManager eventSources;
    private final List<ExecutorService> executors;

    /// Creates a new environment with the specified components.
    ///
    /// @param config configuration the components were built from, not null
    /// @param engine the engine running workflows, not null
    /// @param toolRegistry registry of external tools, not null
    /// @param secretResolver resolver for secret references in tool config, not null
    /// @param reliability wrapper guarding tool calls, not null
    /// @param eventSources manager of connected event sources, not null
    /// @param executors executors owned by this environment, shut down on close, not null
    StepflowEnvironment(
            StepflowConfig config,
            WorkflowEngine engine,
            ToolRegistry toolRegistry,
            SecretResolver secretResolver,
            ReliabilityWrapper reliability,
            EventSourceManager eventSources,
            List<ExecutorService> executors) {
        this.config = config;
        this.engine = engine;
        this.toolRegistry = toolRegistry;
        this.secretResolver = secretResolver;
        this.reliability = reliability;
        this.eventSources = eventSources;
        this.executors = List.copyOf(executors);
    }

    public StepflowConfig getConfig() {
        return config;
    }

    /// Returns the engine for running workflow definitions.
    ///
    /// @return the workflow engine, never null
    public WorkflowEngine getEngine() {
        return engine;
    }

    /// Returns the registry where external tools are registered before running workflows.
    ///
    /// @return the tool registry, never null
    public ToolRegistry getToolRegistry() {
        return toolRegistry;
    }

    public SecretResolver getSecretResolver() {
        return secretResolver;
    }

    /// Returns the reliability wrapper, giving access to breaker and limiter state.
    ///
    /// @return the reliability wrapper, never null
    public ReliabilityWrapper getReliability() {
        return reliability;
    }

    public EventSourceManager getEventSources() {
        return eventSources;
    }

    /// Returns the store receiving execution records and checkpoints.
    ///
    /// @return the checkpoint store, never null
    public CheckpointStore getCheckpointStore() {
        return engine.getCheckpointStore();
    }

    /// Releases everything the environment started.
    ///
    /// @apiNote **Side effects**:
    /// - Fails all rate-limiter waiters with "Rate limiter destroyed"
    /// - Stops every event source and fails pending event waits
    /// - Initiates orderly shutdown of the owned thread pools
    ///
    /// @implNote Calls `ExecutorService.shutdown()` which does not block. Runs still in
    /// flight keep their threads until they finish.
    @Override
    public void close() {
        logger.info("Closing Stepflow environment");
        reliability.getRateLimiters().destroy();
        eventSources.stopAll();
        executors.forEach(ExecutorService::shutdown);
    }
}
