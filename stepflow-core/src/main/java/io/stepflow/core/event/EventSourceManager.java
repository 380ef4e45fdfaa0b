package io.stepflow.core.event;

import io.stepflow.core.exception.OperationTimeoutException;
import io.stepflow.core.exception.StepflowException;
import io.stepflow.core.exception.ValidationException;
import io.stepflow.core.exception.WorkflowCancelledException;
import io.stepflow.core.util.Values;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/// Owns the connected event sources of an environment and fans their events out to waiters.
///
/// Events are not buffered: a waiter only sees events emitted after it registered. Every
/// matching waiter receives the event, so two steps waiting on the same filter both resume.
///
/// ### Contracts
/// - source ids are unique while connected
/// - a wait with a positive timeout cancels its timer as soon as it settles
/// - {@link #stopAll()} stops every source and fails pending waiters
///
/// ### Usage
/// {@snippet :
/// manager.connect("manual", "inbox", Map.of());
/// CompletableFuture<Event> next =
///         manager.waitForEventAsync(new EventFilter("inbox", "message"), 5_000);
/// manager.emit("inbox", "message", Map.of("text", "hello"));
/// Event event = next.join();
/// }
public class EventSourceManager {

    private static final Logger logger = Logger.getLogger(EventSourceManager.class.getName());

    private final Map<String, EventSource> sources = new ConcurrentHashMap<>();
    private final List<Waiter> waiters = new CopyOnWriteArrayList<>();
    private final ScheduledExecutorService scheduler;
    private final Clock clock;

    public EventSourceManager(ScheduledExecutorService scheduler) {
        this(scheduler, Clock.systemUTC());
    }

    public EventSourceManager(ScheduledExecutorService scheduler, Clock clock) {
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /// Creates, registers and connects a source of a built-in kind.
    ///
    /// Recognized options besides the kind-specific ones: `filter`, a list of event types the
    /// source lets through.
    ///
    /// @param kind `manual` or `interval`, not null
    /// @param id unique source id, not null
    /// @param options kind-specific options, may be null
    /// @return stats of the connected source
    /// @throws ValidationException if the id is taken or the kind is unknown
    public EventSourceStats connect(String kind, String id, Map<String, Object> options) {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(id, "id must not be null");
        Map<String, Object> opts = options != null ? options : Map.of();
        return register(create(kind, id, opts));
    }

    /// Registers and connects a caller-supplied source.
    ///
    /// @param source source to connect, not null
    /// @return stats of the connected source
    /// @throws ValidationException if the id is taken
    public EventSourceStats register(EventSource source) {
        Objects.requireNonNull(source, "source must not be null");
        if (sources.putIfAbsent(source.id(), source) != null) {
            throw new ValidationException("Event source '" + source.id() + "' already exists");
        }
        source.setSink(this::dispatch);
        try {
            source.connect();
        } catch (RuntimeException e) {
            sources.remove(source.id());
            throw e;
        }
        logger.info("Connected " + source.kind() + " event source '" + source.id() + "'");
        return source.stats();
    }

    /// Blocks until a matching event arrives.
    ///
    /// @param filter event selection, not null
    /// @param timeoutMs maximum wait, 0 or less waits indefinitely
    /// @return the first matching event
    /// @throws OperationTimeoutException if no event matched in time
    /// @throws WorkflowCancelledException if the waiting thread is interrupted
    public Event waitForEvent(EventFilter filter, long timeoutMs) {
        CompletableFuture<Event> future = waitForEventAsync(filter, timeoutMs);
        try {
            return future.get();
        } catch (InterruptedException e) {
            future.cancel(false);
            Thread.currentThread().interrupt();
            throw new WorkflowCancelledException("Interrupted while waiting for event", e);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof StepflowException stepflowException) {
                throw stepflowException;
            }
            throw new StepflowException(
                    "Event wait failed: " + e.getCause().getMessage(), e.getCause(), false);
        }
    }

    /// Registers a waiter and returns immediately.
    ///
    /// @param filter event selection, not null
    /// @param timeoutMs maximum wait, 0 or less waits indefinitely
    /// @return future completed with the first matching event, or failed with
    ///     {@link OperationTimeoutException}
    public CompletableFuture<Event> waitForEventAsync(EventFilter filter, long timeoutMs) {
        Objects.requireNonNull(filter, "filter must not be null");
        Waiter waiter = new Waiter(filter, new CompletableFuture<>());
        waiters.add(waiter);
        if (timeoutMs > 0) {
            ScheduledFuture<?> timer =
                    scheduler.schedule(
                            () ->
                                    waiter.future.completeExceptionally(
                                            new OperationTimeoutException(
                                                    "Timed out waiting for event after "
                                                            + timeoutMs
                                                            + "ms",
                                                    timeoutMs)),
                            timeoutMs,
                            TimeUnit.MILLISECONDS);
            waiter.future.whenComplete((event, error) -> timer.cancel(false));
        }
        waiter.future.whenComplete((event, error) -> waiters.remove(waiter));
        return waiter.future;
    }

    /// Stops and removes a source.
    ///
    /// @param id source id, not null
    /// @return true if the source existed
    public boolean disconnect(String id) {
        Objects.requireNonNull(id, "id must not be null");
        EventSource source = sources.remove(id);
        if (source == null) {
            return false;
        }
        source.stop();
        logger.info("Disconnected event source '" + id + "'");
        return true;
    }

    /// Sends data outward through a source.
    ///
    /// @throws ValidationException if the source is unknown or cannot send
    public void send(String id, Object data) {
        EventSource source = require(id);
        if (!source.supportsSending()) {
            throw new ValidationException("Event source '" + id + "' does not support sending");
        }
        source.send(data);
    }

    /// Pushes an event through a `manual` source.
    ///
    /// @throws ValidationException if the source is unknown or not manual
    public void emit(String id, String type, Map<String, Object> data) {
        EventSource source = require(id);
        if (!(source instanceof ManualEventSource manual)) {
            throw new ValidationException(
                    "Event source '" + id + "' is not a " + ManualEventSource.KIND + " source");
        }
        manual.emit(type, data);
    }

    public Optional<EventSource> get(String id) {
        return Optional.ofNullable(sources.get(id));
    }

    /// Returns the stats of every connected source.
    public List<EventSourceStats> status() {
        return sources.values().stream().map(EventSource::stats).toList();
    }

    /// Stops every source and fails pending waiters.
    public void stopAll() {
        for (String id : List.copyOf(sources.keySet())) {
            EventSource source = sources.remove(id);
            if (source != null) {
                try {
                    source.stop();
                } catch (RuntimeException e) {
                    logger.log(Level.WARNING, "Failed to stop event source '" + id + "'", e);
                }
            }
        }
        for (Waiter waiter : waiters) {
            waiter.future.completeExceptionally(
                    new StepflowException("Event source manager stopped", false));
        }
    }

    private void dispatch(Event event) {
        for (Waiter waiter : waiters) {
            if (waiter.filter.matches(event)) {
                waiter.future.complete(event);
            }
        }
    }

    private EventSource require(String id) {
        Objects.requireNonNull(id, "id must not be null");
        EventSource source = sources.get(id);
        if (source == null) {
            throw new ValidationException("Event source '" + id + "' not found");
        }
        return source;
    }

    private EventSource create(String kind, String id, Map<String, Object> options) {
        List<String> typeFilter = null;
        List<Object> rawFilter = Values.asList(options.get("filter"));
        if (rawFilter != null) {
            typeFilter = rawFilter.stream().map(Values::stringify).toList();
        }
        return switch (kind) {
            case ManualEventSource.KIND -> new ManualEventSource(id, typeFilter, clock);
            case IntervalEventSource.KIND ->
                    new IntervalEventSource(id, options, typeFilter, scheduler, clock);
            default -> throw new ValidationException("Unknown event source kind: " + kind);
        };
    }

    private record Waiter(EventFilter filter, CompletableFuture<Event> future) {}
}
