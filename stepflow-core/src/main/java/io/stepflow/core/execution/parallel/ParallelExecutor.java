package io.stepflow.core.execution.parallel;

import io.stepflow.core.exception.ParallelExecutionException;
import io.stepflow.core.exception.StepflowException;
import io.stepflow.core.exception.ValidationException;
import io.stepflow.core.exception.WorkflowCancelledException;
import io.stepflow.core.execution.ExecutionContext;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Queue;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/// Runs independent task sets concurrently: `spawn` with wait policies and `map` with bounded
/// concurrency.
///
/// ### Contracts
/// - every task settles exactly once; a late completion after a timeout or after the wait
///   policy was satisfied is logged and dropped
/// - no more than the configured concurrency of tasks hold a permit at once; a permit is
///   returned when the task's run actually ends, not when its timeout fires
/// - timers scheduled for a call are cancelled once the call settles
/// - task runs are abandoned, never interrupted
/// - each task runs in its own fork of the caller's context, so sibling tasks never see each
///   other's variable writes
///
/// ### Usage
/// {@snippet :
/// ParallelExecutor parallel = new ParallelExecutor(pool, scheduler, Clock.systemUTC());
/// SpawnResult result =
///         parallel.spawn(
///                 SpawnRequest.of(tasks, WaitPolicy.MAJORITY),
///                 context,
///                 (task, scope) -> dispatcher.dispatch(task.action(), task.inputs(), scope));
/// }
///
/// @implNote The executor service and scheduler are owned by the environment and are never shut
/// down here. The calling thread blocks until the call settles.
public class ParallelExecutor {

    private static final Logger logger = Logger.getLogger(ParallelExecutor.class.getName());

    private final ExecutorService executor;
    private final ScheduledExecutorService scheduler;
    private final Clock clock;

    public ParallelExecutor(
            ExecutorService executor, ScheduledExecutorService scheduler, Clock clock) {
        this.executor = Objects.requireNonNull(executor, "executor must not be null");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /// Runs every task concurrently and waits according to the request's wait policy.
    ///
    /// Tasks still running when the call settles are reported as failed; their eventual
    /// results are discarded.
    ///
    /// @param request tasks and policies, not null
    /// @param context caller's context, forked once per task, not null
    /// @param runner runs a single task, not null
    /// @return per-task outcomes, never null
    /// @throws ValidationException if there are no tasks or task ids repeat
    /// @throws ParallelExecutionException if a task fails under {@link FailurePolicy#FAIL}
    /// @throws WorkflowCancelledException if the calling thread is interrupted
    public SpawnResult spawn(SpawnRequest request, ExecutionContext context, TaskRunner runner) {
        Objects.requireNonNull(request, "request must not be null");
        Objects.requireNonNull(context, "context must not be null");
        Objects.requireNonNull(runner, "runner must not be null");
        List<ParallelTask> tasks = request.tasks();
        if (tasks.isEmpty()) {
            throw new ValidationException("parallel.spawn requires at least one agent");
        }
        requireUniqueIds(tasks);

        int total = tasks.size();
        int concurrency =
                request.concurrency() != null && request.concurrency() > 0
                        ? request.concurrency()
                        : total;
        Instant startedAt = clock.instant();
        logger.info(
                "Spawning "
                        + total
                        + " parallel tasks (wait="
                        + request.waitPolicy().wireName()
                        + ", onError="
                        + request.onError().wireName()
                        + ")");

        // true when the overall timeout fired first
        CompletableFuture<Boolean> done = new CompletableFuture<>();
        AtomicInteger settled = new AtomicInteger();
        AtomicInteger succeeded = new AtomicInteger();

        Batch batch =
                new Batch(tasks, concurrency, request.taskTimeoutMs(), context.fork(), runner);
        batch.onSettle(
                outcome -> {
                    if (done.isDone()) {
                        return;
                    }
                    int settledCount = settled.incrementAndGet();
                    int successCount =
                            outcome.isSuccess() ? succeeded.incrementAndGet() : succeeded.get();
                    if (outcome instanceof TaskOutcome.Failure failure
                            && request.onError() == FailurePolicy.FAIL) {
                        batch.stop();
                        done.completeExceptionally(
                                new ParallelExecutionException(
                                        "Parallel execution failed: task '"
                                                + failure.taskId()
                                                + "': "
                                                + failure.error(),
                                        failure.cause()));
                        return;
                    }
                    if (request.waitPolicy().isSatisfied(total, settledCount, successCount)) {
                        done.complete(false);
                    }
                });

        if (request.timeoutMs() != null && request.timeoutMs() > 0) {
            ScheduledFuture<?> timer =
                    scheduler.schedule(
                            () -> done.complete(true), request.timeoutMs(), TimeUnit.MILLISECONDS);
            done.whenComplete((timedOut, error) -> timer.cancel(false));
        }

        batch.start();
        boolean timedOut = await(done, batch);
        batch.stop();

        String unsettledReason =
                timedOut
                        ? "timed out after " + request.timeoutMs() + "ms"
                        : "did not complete before wait policy was satisfied";
        Map<String, TaskOutcome> outcomes = batch.closeUnsettled(unsettledReason);
        SpawnResult result = SpawnResult.from(tasks, outcomes, startedAt, clock.instant());
        logger.info(
                "Parallel spawn settled: "
                        + result.successful().size()
                        + " succeeded, "
                        + result.failed().size()
                        + " failed");
        return result;
    }

    /// Runs the request's action once per item with at most `concurrency` items in flight.
    ///
    /// @param request items, template and policies, not null
    /// @param context caller's context, forked once per item, not null
    /// @param runner runs a single item's task, not null
    /// @return one entry per item, index-aligned with the items; a failed item under
    ///     {@link FailurePolicy#CONTINUE} holds `{error, index}`
    /// @throws ParallelExecutionException if an item fails under {@link FailurePolicy#FAIL}
    /// @throws WorkflowCancelledException if the calling thread is interrupted
    public List<Object> map(MapRequest request, ExecutionContext context, TaskRunner runner) {
        Objects.requireNonNull(request, "request must not be null");
        Objects.requireNonNull(context, "context must not be null");
        Objects.requireNonNull(runner, "runner must not be null");
        List<Object> items = request.items();
        if (items.isEmpty()) {
            return new ArrayList<>();
        }

        List<ParallelTask> tasks = new ArrayList<>(items.size());
        for (int i = 0; i < items.size(); i++) {
            Map<String, Object> bindings = new LinkedHashMap<>();
            bindings.put("item", items.get(i));
            bindings.put("itemIndex", i);
            tasks.add(
                    new ParallelTask(
                            String.valueOf(i), request.action(), request.inputs(), bindings));
        }
        logger.fine(
                "Mapping "
                        + items.size()
                        + " items through "
                        + request.action()
                        + " (concurrency="
                        + request.concurrency()
                        + ")");

        CompletableFuture<Boolean> done = new CompletableFuture<>();
        AtomicInteger settled = new AtomicInteger();
        Batch batch =
                new Batch(
                        tasks, request.concurrency(), request.timeoutMs(), context.fork(), runner);
        batch.onSettle(
                outcome -> {
                    if (done.isDone()) {
                        return;
                    }
                    if (outcome instanceof TaskOutcome.Failure failure
                            && request.onError() == FailurePolicy.FAIL) {
                        batch.stop();
                        done.completeExceptionally(
                                new ParallelExecutionException(
                                        "Parallel execution failed: item "
                                                + failure.taskId()
                                                + ": "
                                                + failure.error(),
                                        failure.cause()));
                        return;
                    }
                    if (settled.incrementAndGet() >= tasks.size()) {
                        done.complete(false);
                    }
                });

        batch.start();
        await(done, batch);
        Map<String, TaskOutcome> outcomes = batch.closeUnsettled("did not complete");

        List<Object> results = new ArrayList<>(items.size());
        for (int i = 0; i < tasks.size(); i++) {
            TaskOutcome outcome = outcomes.get(tasks.get(i).id());
            if (outcome instanceof TaskOutcome.Success success) {
                results.add(success.value());
            } else {
                Map<String, Object> error = new LinkedHashMap<>();
                error.put("error", ((TaskOutcome.Failure) outcome).error());
                error.put("index", i);
                results.add(error);
            }
        }
        return results;
    }

    private boolean await(CompletableFuture<Boolean> done, Batch batch) {
        try {
            return done.get();
        } catch (InterruptedException e) {
            batch.stop();
            Thread.currentThread().interrupt();
            throw new WorkflowCancelledException("Interrupted while waiting for parallel tasks", e);
        } catch (ExecutionException e) {
            batch.stop();
            if (e.getCause() instanceof StepflowException stepflowException) {
                throw stepflowException;
            }
            throw new StepflowException(
                    "Parallel execution failed: " + e.getCause().getMessage(), e.getCause(), false);
        }
    }

    private static void requireUniqueIds(List<ParallelTask> tasks) {
        Set<String> seen = new HashSet<>();
        for (ParallelTask task : tasks) {
            if (!seen.add(task.id())) {
                throw new ValidationException("Duplicate parallel task id: " + task.id());
            }
        }
    }

    private static Throwable unwrap(Throwable error) {
        if (error instanceof CompletionException && error.getCause() != null) {
            return error.getCause();
        }
        return error;
    }

    private static String messageOf(Throwable error) {
        return error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
    }

    /// Launch queue and settlement slots of one call.
    private final class Batch {

        private final Map<String, CompletableFuture<TaskOutcome>> slots = new LinkedHashMap<>();
        private final Map<String, Instant> startedAt = new ConcurrentHashMap<>();
        private final Queue<ParallelTask> pending;
        private final Semaphore permits;
        private final Long taskTimeoutMs;
        private final ExecutionContext base;
        private final TaskRunner runner;
        private final AtomicBoolean stopped = new AtomicBoolean();
        private volatile Consumer<TaskOutcome> listener = outcome -> {};

        private Batch(
                List<ParallelTask> tasks,
                int concurrency,
                Long taskTimeoutMs,
                ExecutionContext base,
                TaskRunner runner) {
            for (ParallelTask task : tasks) {
                slots.put(task.id(), new CompletableFuture<>());
            }
            this.pending = new ConcurrentLinkedQueue<>(tasks);
            this.permits = new Semaphore(concurrency);
            this.taskTimeoutMs = taskTimeoutMs;
            this.base = base;
            this.runner = runner;
        }

        void onSettle(Consumer<TaskOutcome> listener) {
            this.listener = listener;
        }

        void start() {
            pump();
        }

        void stop() {
            stopped.set(true);
        }

        private void pump() {
            while (!stopped.get() && !pending.isEmpty() && permits.tryAcquire()) {
                ParallelTask task = pending.poll();
                if (task == null) {
                    permits.release();
                    return;
                }
                launch(task);
            }
        }

        private void launch(ParallelTask task) {
            Instant start = clock.instant();
            startedAt.put(task.id(), start);
            Map<String, Object> bindings = new LinkedHashMap<>(task.bindings());
            bindings.put("task", Map.of("id", task.id()));
            ExecutionContext scope = base.fork(bindings);

            CompletableFuture<TaskOutcome> slot = slots.get(task.id());
            if (taskTimeoutMs != null && taskTimeoutMs > 0) {
                ScheduledFuture<?> timer =
                        scheduler.schedule(
                                () ->
                                        settle(
                                                new TaskOutcome.Failure(
                                                        task.id(),
                                                        "Task '"
                                                                + task.id()
                                                                + "' timed out after "
                                                                + taskTimeoutMs
                                                                + "ms",
                                                        null,
                                                        start,
                                                        clock.instant())),
                                taskTimeoutMs,
                                TimeUnit.MILLISECONDS);
                slot.whenComplete((outcome, error) -> timer.cancel(false));
            }

            CompletableFuture<Object> run;
            try {
                run =
                        CompletableFuture.supplyAsync(
                                () -> {
                                    try {
                                        return runner.run(task, scope);
                                    } catch (RuntimeException e) {
                                        throw e;
                                    } catch (Exception e) {
                                        throw new CompletionException(e);
                                    }
                                },
                                executor);
            } catch (RejectedExecutionException e) {
                permits.release();
                settle(
                        new TaskOutcome.Failure(
                                task.id(),
                                "Task rejected: " + messageOf(e),
                                e,
                                start,
                                clock.instant()));
                return;
            }
            run.whenComplete(
                    (value, error) -> {
                        permits.release();
                        Instant end = clock.instant();
                        if (error == null) {
                            settle(new TaskOutcome.Success(task.id(), value, start, end));
                        } else {
                            Throwable cause = unwrap(error);
                            logger.log(
                                    Level.FINE, "Parallel task '" + task.id() + "' failed", cause);
                            settle(
                                    new TaskOutcome.Failure(
                                            task.id(), messageOf(cause), cause, start, end));
                        }
                        pump();
                    });
        }

        private void settle(TaskOutcome outcome) {
            if (slots.get(outcome.taskId()).complete(outcome)) {
                listener.accept(outcome);
            } else {
                logger.fine("Ignoring late outcome of parallel task '" + outcome.taskId() + "'");
            }
        }

        /// Fails every unsettled slot with the reason and returns all outcomes.
        Map<String, TaskOutcome> closeUnsettled(String reason) {
            Instant now = clock.instant();
            Map<String, TaskOutcome> outcomes = new LinkedHashMap<>();
            for (Map.Entry<String, CompletableFuture<TaskOutcome>> entry : slots.entrySet()) {
                String id = entry.getKey();
                entry.getValue()
                        .complete(
                                new TaskOutcome.Failure(
                                        id,
                                        "Task '" + id + "' " + reason,
                                        null,
                                        startedAt.get(id),
                                        now));
                outcomes.put(id, entry.getValue().join());
            }
            return outcomes;
        }
    }
}
