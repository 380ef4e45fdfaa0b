package io.stepflow.core.reliability;

import io.stepflow.core.exception.RateLimitException;
import io.stepflow.core.exception.StepflowException;
import io.stepflow.core.exception.WorkflowCancelledException;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.logging.Logger;

/// Per-service token buckets.
///
/// Tokens refill continuously at `maxRequests / windowMs` per millisecond and never exceed the
/// bucket capacity. When a bucket is empty the service's {@link RateLimitStrategy} either rejects
/// the caller or parks it in a FIFO queue. A drain task on the shared scheduler is started only
/// while a queue is non-empty and cancels itself once the queue drains.
///
/// Services without a configured limit pass freely.
///
/// ### Contracts
/// - tokens stay within `[0, maxRequests]` after any acquire, refill, release or header update
/// - queued callers are served in arrival order
/// - after {@link #destroy()} no drain task remains scheduled and every waiter has failed
///
/// @implNote Thread-safe. Each bucket is mutated under its own monitor; waiter futures are
/// completed outside it.
public class RateLimiterRegistry {

    private static final Logger logger = Logger.getLogger(RateLimiterRegistry.class.getName());
    private static final long MIN_DRAIN_INTERVAL_MS = 10;

    private final ScheduledExecutorService scheduler;
    private final Clock clock;
    private final Map<String, Bucket> buckets = new ConcurrentHashMap<>();

    public RateLimiterRegistry(ScheduledExecutorService scheduler) {
        this(scheduler, Clock.systemUTC());
    }

    public RateLimiterRegistry(ScheduledExecutorService scheduler, Clock clock) {
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /// Installs or replaces a service's limit. The new bucket starts full.
    ///
    /// @param service service name, not null
    /// @param config limit, not null
    public void configure(String service, RateLimitConfig config) {
        Objects.requireNonNull(service, "service must not be null");
        Objects.requireNonNull(config, "config must not be null");
        Bucket previous = buckets.put(service, new Bucket(service, config, clock.millis()));
        if (previous != null) {
            previous.shutdown("Rate limit for " + service + " was reconfigured");
        }
    }

    /// Installs several limits at once.
    public void configureAll(Map<String, RateLimitConfig> configs) {
        Objects.requireNonNull(configs, "configs must not be null");
        configs.forEach(this::configure);
    }

    public boolean isConfigured(String service) {
        return buckets.containsKey(service);
    }

    /// Takes a token for the service, blocking while queued.
    ///
    /// @param service service name, not null
    /// @throws RateLimitException if the limiter rejects or the queue is full
    /// @throws WorkflowCancelledException if the calling thread is interrupted while queued
    public void acquire(String service) {
        CompletableFuture<Void> permit = acquireAsync(service);
        if (permit.isDone() && !permit.isCompletedExceptionally()) {
            return;
        }
        try {
            permit.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            permit.cancel(false);
            throw new WorkflowCancelledException(
                    "Interrupted while waiting for a rate limit token for " + service, e);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof StepflowException stepflowException) {
                throw stepflowException;
            }
            throw new StepflowException(
                    "Rate limiter failed for " + service, e.getCause(), false);
        }
    }

    /// Takes a token for the service without blocking.
    ///
    /// @param service service name, not null
    /// @return a future completed when a token is granted, or failed with
    ///     {@link RateLimitException}; never null
    public CompletableFuture<Void> acquireAsync(String service) {
        Objects.requireNonNull(service, "service must not be null");
        Bucket bucket = buckets.get(service);
        if (bucket == null) {
            return CompletableFuture.completedFuture(null);
        }
        return bucket.acquire();
    }

    /// Returns a token to the service's bucket (capped at capacity) and serves waiters.
    ///
    /// @param service service name, not null
    public void release(String service) {
        Objects.requireNonNull(service, "service must not be null");
        Bucket bucket = buckets.get(service);
        if (bucket != null) {
            bucket.release();
        }
    }

    /// Returns the bucket status for a configured service.
    ///
    /// @param service service name, not null
    /// @return status, or empty for an unlimited service
    public Optional<RateLimiterStatus> getStatus(String service) {
        Objects.requireNonNull(service, "service must not be null");
        return Optional.ofNullable(buckets.get(service)).map(Bucket::status);
    }

    /// Syncs the bucket with a server-reported remaining count.
    ///
    /// Reads `x-ratelimit-remaining` (case-insensitive); absent or malformed headers are
    /// ignored. The reported value is clamped to `[0, maxRequests]`.
    ///
    /// @param service service name, not null
    /// @param headers response headers, not null
    public void updateFromHeaders(String service, Map<String, String> headers) {
        Objects.requireNonNull(service, "service must not be null");
        Objects.requireNonNull(headers, "headers must not be null");
        Bucket bucket = buckets.get(service);
        if (bucket == null) {
            return;
        }
        for (Map.Entry<String, String> header : headers.entrySet()) {
            if ("x-ratelimit-remaining".equalsIgnoreCase(header.getKey())
                    && header.getValue() != null) {
                try {
                    bucket.setRemaining(Double.parseDouble(header.getValue().trim()));
                } catch (NumberFormatException e) {
                    logger.fine(
                            "Ignoring malformed x-ratelimit-remaining for "
                                    + service
                                    + ": "
                                    + header.getValue());
                }
                return;
            }
        }
    }

    /// Cancels every drain task and fails all waiters with "Rate limiter destroyed".
    public void destroy() {
        buckets.values().forEach(bucket -> bucket.shutdown("Rate limiter destroyed"));
        buckets.clear();
    }

    private final class Bucket {
        private final String service;
        private final RateLimitConfig config;
        private final double refillRatePerMs;
        private final Deque<CompletableFuture<Void>> waiters = new ArrayDeque<>();
        private double tokens;
        private long lastRefillAt;
        private ScheduledFuture<?> drainTask;

        private Bucket(String service, RateLimitConfig config, long now) {
            this.service = service;
            this.config = config;
            this.refillRatePerMs = config.refillRatePerMs();
            this.tokens = config.maxRequests();
            this.lastRefillAt = now;
        }

        private CompletableFuture<Void> acquire() {
            synchronized (this) {
                refill();
                if (tokens >= 1) {
                    tokens -= 1;
                    return CompletableFuture.completedFuture(null);
                }
                if (config.strategy() == RateLimitStrategy.REJECT) {
                    long waitMs = (long) Math.ceil((1 - tokens) / refillRatePerMs);
                    return CompletableFuture.failedFuture(
                            new RateLimitException(
                                    service,
                                    "Rate limit reached for "
                                            + service
                                            + " ("
                                            + config.maxRequests()
                                            + " requests per "
                                            + config.windowMs()
                                            + "ms)",
                                    Duration.ofMillis(waitMs)));
                }
                if (waiters.size() >= config.maxQueueSize()) {
                    return CompletableFuture.failedFuture(
                            new RateLimitException(
                                    service,
                                    "Rate limit queue full for "
                                            + service
                                            + " ("
                                            + waiters.size()
                                            + " pending requests)",
                                    Duration.ofMillis(drainIntervalMs())));
                }
                CompletableFuture<Void> waiter = new CompletableFuture<>();
                waiters.addLast(waiter);
                logger.fine(
                        "Queued request for " + service + " (" + waiters.size() + " waiting)");
                ensureDrainScheduled();
                return waiter;
            }
        }

        private void release() {
            synchronized (this) {
                refill();
                tokens = Math.min(tokens + 1, config.maxRequests());
            }
            drain();
        }

        private void setRemaining(double remaining) {
            synchronized (this) {
                tokens = Math.max(0, Math.min(remaining, config.maxRequests()));
                lastRefillAt = clock.millis();
            }
            drain();
        }

        private RateLimiterStatus status() {
            synchronized (this) {
                refill();
                return new RateLimiterStatus(
                        (int) Math.floor(tokens),
                        config.maxRequests(),
                        waiters.size(),
                        refillRatePerMs * 1000);
            }
        }

        private void drain() {
            List<CompletableFuture<Void>> granted = new ArrayList<>();
            synchronized (this) {
                refill();
                while (tokens >= 1 && !waiters.isEmpty()) {
                    CompletableFuture<Void> waiter = waiters.pollFirst();
                    if (waiter.isDone()) {
                        continue;
                    }
                    tokens -= 1;
                    granted.add(waiter);
                }
                if (waiters.isEmpty() && drainTask != null) {
                    drainTask.cancel(false);
                    drainTask = null;
                }
            }
            for (CompletableFuture<Void> waiter : granted) {
                if (!waiter.complete(null)) {
                    release();
                }
            }
        }

        private void shutdown(String reason) {
            List<CompletableFuture<Void>> pending;
            synchronized (this) {
                if (drainTask != null) {
                    drainTask.cancel(false);
                    drainTask = null;
                }
                pending = new ArrayList<>(waiters);
                waiters.clear();
            }
            for (CompletableFuture<Void> waiter : pending) {
                waiter.completeExceptionally(new StepflowException(reason, false));
            }
        }

        // Caller holds the monitor.
        private void refill() {
            long now = clock.millis();
            long elapsed = now - lastRefillAt;
            if (elapsed > 0) {
                tokens = Math.min(config.maxRequests(), tokens + elapsed * refillRatePerMs);
                lastRefillAt = now;
            }
        }

        // Caller holds the monitor.
        private void ensureDrainScheduled() {
            if (drainTask == null) {
                long interval = drainIntervalMs();
                drainTask =
                        scheduler.scheduleAtFixedRate(
                                this::drain, interval, interval, TimeUnit.MILLISECONDS);
            }
        }

        private long drainIntervalMs() {
            return Math.max(MIN_DRAIN_INTERVAL_MS, (long) Math.ceil(1 / refillRatePerMs));
        }
    }
}
