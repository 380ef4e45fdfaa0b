package io.stepflow.core.event;

import io.stepflow.core.exception.ValidationException;
import io.stepflow.core.util.Durations;
import io.stepflow.core.util.Values;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/// Emits a `tick` event at a fixed interval on the shared scheduler.
///
/// ### Options
/// - `interval` (required): duration string or milliseconds
/// - `immediate`: emit the first tick on connect instead of after one interval
/// - `payload`: map merged into every tick's data
///
/// Each tick carries `scheduledAt` (ISO-8601) in addition to the payload.
public final class IntervalEventSource extends AbstractEventSource {

    private static final Logger logger = Logger.getLogger(IntervalEventSource.class.getName());

    public static final String KIND = "interval";

    private final ScheduledExecutorService scheduler;
    private final long intervalMs;
    private final boolean immediate;
    private final Map<String, Object> payload;
    private ScheduledFuture<?> timer;

    public IntervalEventSource(
            String id,
            Map<String, Object> options,
            List<String> typeFilter,
            ScheduledExecutorService scheduler,
            Clock clock) {
        super(id, KIND, typeFilter, clock);
        this.scheduler = scheduler;
        Object interval = options.get("interval");
        if (interval == null) {
            throw new ValidationException("Interval event source requires 'interval' option");
        }
        this.intervalMs = Durations.parseMillis(interval);
        if (intervalMs <= 0) {
            throw new ValidationException(
                    "Interval must be positive (current: " + intervalMs + "ms)");
        }
        this.immediate = Values.isTruthy(options.get("immediate"));
        Map<String, Object> configured = Values.asMap(options.get("payload"));
        this.payload = configured != null ? new LinkedHashMap<>(configured) : Map.of();
    }

    @Override
    public synchronized void connect() {
        markConnected();
        long initialDelay = immediate ? 0 : intervalMs;
        timer =
                scheduler.scheduleAtFixedRate(
                        this::tick, initialDelay, intervalMs, TimeUnit.MILLISECONDS);
    }

    @Override
    public synchronized void stop() {
        if (timer != null) {
            timer.cancel(false);
            timer = null;
        }
        markStopped();
    }

    public long getIntervalMs() {
        return intervalMs;
    }

    private void tick() {
        try {
            Map<String, Object> data = new LinkedHashMap<>(payload);
            data.put("scheduledAt", clock.instant().toString());
            emitEvent("tick", data);
        } catch (RuntimeException e) {
            // A throwing task would silently cancel the fixed-rate schedule.
            status = EventSourceStatus.ERROR;
            logger.log(Level.WARNING, "Interval source '" + id() + "' failed to emit tick", e);
        }
    }
}
