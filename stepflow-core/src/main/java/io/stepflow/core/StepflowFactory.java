package io.stepflow.core;

import io.stepflow.core.checkpoint.CheckpointStore;
import io.stepflow.core.checkpoint.InMemoryCheckpointStore;
import io.stepflow.core.event.EventSourceManager;
import io.stepflow.core.execution.WorkflowEngine;
import io.stepflow.core.execution.action.DefaultStepInvoker;
import io.stepflow.core.execution.builtin.BuiltinOperations;
import io.stepflow.core.execution.parallel.ParallelExecutor;
import io.stepflow.core.reliability.CircuitBreakerRegistry;
import io.stepflow.core.reliability.InputSchema;
import io.stepflow.core.reliability.InputSchemas;
import io.stepflow.core.reliability.KnownRateLimits;
import io.stepflow.core.reliability.RateLimiterRegistry;
import io.stepflow.core.reliability.ReliabilityOptions;
import io.stepflow.core.reliability.ReliabilityWrapper;
import io.stepflow.core.template.ExpressionTemplateResolver;
import io.stepflow.core.tool.DefaultToolRegistry;
import io.stepflow.core.tool.ToolDefinition;
import io.stepflow.core.tool.secret.EnvironmentSecretProvider;
import io.stepflow.core.tool.secret.SecretProvider;
import io.stepflow.core.tool.secret.SecretResolver;
import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Logger;

/// Factory for creating and wiring Stepflow execution environments.
///
/// Provides static factory methods and a fluent {@link Builder} for constructing
/// fully-configured {@link StepflowEnvironment} instances. Every shared component (breaker and
/// limiter registries, secret resolver, event-source manager) is built once here and passed by
/// constructor injection.
///
/// ### Usage Patterns
///
/// **Builder with tools and a file-backed store**:
/// {@snippet :
/// var env = StepflowFactory.builder()
///     .config(StepflowConfig.builder().threadPoolSize(16).build())
///     .tool(ToolDefinition.simple("github", config -> new GitHubClient(config)))
///     .checkpointStore(new JsonFileCheckpointStore(Path.of("runs")))
///     .build();
/// }
///
/// **Quick start**:
/// {@snippet :
/// try (var env = StepflowFactory.createEnvironment()) {
///     env.getEngine().execute(workflow, Map.of("repo", "acme/api"));
/// }
/// }
///
/// ### Threads
/// - a fixed pool of `threadPoolSize` threads runs parallel tasks
/// - a cached pool runs guarded tool calls and step bodies that carry a timeout, so a task on
///   the fixed pool never waits for a slot in its own pool
/// - a two-thread scheduler drives timeouts, rate-limiter drains and interval event sources
///
/// @see StepflowEnvironment
/// @see StepflowConfig
/// @see Builder
public final class StepflowFactory {

    private static final Logger logger = Logger.getLogger(StepflowFactory.class.getName());

    private StepflowFactory() {
        // Utility class - prevent instantiation
    }

    /// Creates an environment with default configuration.
    ///
    /// @return a fully-configured environment, never null
    public static StepflowEnvironment createEnvironment() {
        return createEnvironment(new StepflowConfig());
    }

    /// Creates an environment with custom configuration.
    ///
    /// @apiNote **Side effects**: creates three thread pools, released by
    /// {@link StepflowEnvironment#close()}.
    ///
    /// @param config configuration options, not null
    /// @return a fully-configured environment, never null
    public static StepflowEnvironment createEnvironment(StepflowConfig config) {
        return builder().config(config).build();
    }

    /// Creates a new builder.
    ///
    /// @return a new builder instance, never null
    public static Builder builder() {
        return new Builder();
    }

    /// Merges the reference input schemas under the configured ones.
    static ReliabilityOptions reliabilityDefaults(StepflowConfig config) {
        Map<String, InputSchema> schemas = new HashMap<>(InputSchemas.REFERENCE);
        schemas.putAll(config.getReliability().getInputSchemas());
        return config.getReliability().toBuilder().inputSchemas(schemas).build();
    }

    private static ThreadFactory named(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    /// Fluent builder for constructing {@link StepflowEnvironment} instances with fine-grained
    /// control.
    ///
    /// ### Example
    /// {@snippet :
    /// var env = StepflowFactory.builder()
    ///     .config(StepflowConfig.fromProperties(properties))
    ///     .secretProvider("vault", vaultProvider)
    ///     .tool(slackTool)
    ///     .build();
    /// }
    ///
    /// @implNote **Not thread-safe**. Intended for single-threaded configuration before
    /// calling {@link #build()}.
    public static class Builder {
        private StepflowConfig config = new StepflowConfig();
        private Clock clock = Clock.systemUTC();
        private CheckpointStore checkpointStore;
        private ExecutorService executorService;
        private final List<ToolDefinition> tools = new ArrayList<>();
        private final Map<String, SecretProvider> secretProviders = new LinkedHashMap<>();

        private Builder() {}

        /// Sets the configuration options.
        ///
        /// @param config the configuration, not null
        /// @return this builder for chaining, never null
        public Builder config(StepflowConfig config) {
            this.config = Objects.requireNonNull(config, "config must not be null");
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "clock must not be null");
            return this;
        }

        /// Sets the store for execution records and checkpoints. Defaults to an in-memory
        /// store.
        ///
        /// @param checkpointStore the store, not null
        /// @return this builder for chaining, never null
        public Builder checkpointStore(CheckpointStore checkpointStore) {
            this.checkpointStore =
                    Objects.requireNonNull(checkpointStore, "checkpointStore must not be null");
            return this;
        }

        /// Supplies the pool for parallel tasks instead of creating one.
        ///
        /// A supplied pool is not shut down when the environment closes.
        ///
        /// @param executorService caller-owned pool, not null
        /// @return this builder for chaining, never null
        public Builder executorService(ExecutorService executorService) {
            this.executorService =
                    Objects.requireNonNull(executorService, "executorService must not be null");
            return this;
        }

        /// Registers a tool in the environment's tool registry.
        ///
        /// @param tool tool definition, not null
        /// @return this builder for chaining, never null
        public Builder tool(ToolDefinition tool) {
            tools.add(Objects.requireNonNull(tool, "tool must not be null"));
            return this;
        }

        /// Registers a secret provider. The `env` scheme is registered by default and may be
        /// replaced here.
        ///
        /// @param scheme scheme used in `${secret:<scheme>://...}`, not null
        /// @param provider provider to register, not null
        /// @return this builder for chaining, never null
        public Builder secretProvider(String scheme, SecretProvider provider) {
            Objects.requireNonNull(scheme, "scheme must not be null");
            Objects.requireNonNull(provider, "provider must not be null");
            secretProviders.put(scheme, provider);
            return this;
        }

        /// Wires and returns the environment.
        ///
        /// @return a fully-configured environment, never null
        public StepflowEnvironment build() {
            List<ExecutorService> owned = new ArrayList<>();
            ExecutorService taskPool = executorService;
            if (taskPool == null) {
                taskPool =
                        Executors.newFixedThreadPool(
                                config.getThreadPoolSize(), named("stepflow-task"));
                owned.add(taskPool);
            }
            ExecutorService callPool = Executors.newCachedThreadPool(named("stepflow-call"));
            ScheduledExecutorService scheduler =
                    Executors.newScheduledThreadPool(2, named("stepflow-scheduler"));
            owned.add(callPool);
            owned.add(scheduler);

            CircuitBreakerRegistry circuitBreakers =
                    new CircuitBreakerRegistry(config.getCircuitBreaker());
            RateLimiterRegistry rateLimiters = new RateLimiterRegistry(scheduler, clock);
            if (config.isPreloadKnownRateLimits()) {
                rateLimiters.configureAll(KnownRateLimits.ALL);
            }
            rateLimiters.configureAll(config.getRateLimitOverrides());
            ReliabilityWrapper reliability =
                    new ReliabilityWrapper(
                            circuitBreakers, rateLimiters, callPool, reliabilityDefaults(config));

            SecretResolver secrets = new SecretResolver(config.getSecretCacheTtl(), clock);
            secrets.registerProvider("env", new EnvironmentSecretProvider());
            secretProviders.forEach(secrets::registerProvider);

            DefaultToolRegistry toolRegistry = new DefaultToolRegistry(secrets);
            tools.forEach(toolRegistry::register);

            EventSourceManager events = new EventSourceManager(scheduler, clock);
            ParallelExecutor parallel = new ParallelExecutor(taskPool, scheduler, clock);

            WorkflowEngine engine =
                    WorkflowEngine.builder()
                            .builtins(
                                    BuiltinOperations.standard(
                                            clock,
                                            events,
                                            parallel,
                                            config.getDefaultMapConcurrency()))
                            .stepInvoker(new DefaultStepInvoker(toolRegistry, reliability))
                            .templateResolver(new ExpressionTemplateResolver())
                            .checkpoints(
                                    checkpointStore != null
                                            ? checkpointStore
                                            : new InMemoryCheckpointStore())
                            .stepTimeoutExecutor(callPool)
                            .retryBackoff(reliability.getDefaults().backoffPolicy())
                            .defaultMaxIterations(config.getDefaultMaxIterations())
                            .clock(clock)
                            .build();

            logger.info(
                    "Stepflow environment ready: threadPoolSize="
                            + config.getThreadPoolSize()
                            + ", tools="
                            + tools.size());

            return new StepflowEnvironment(
                    config, engine, toolRegistry, secrets, reliability, events, owned);
        }
    }
}
