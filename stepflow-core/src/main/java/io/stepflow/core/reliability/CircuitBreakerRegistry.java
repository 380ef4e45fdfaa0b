package io.stepflow.core.reliability;

import io.stepflow.core.exception.CircuitOpenException;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Logger;

/// Per-service circuit breakers sharing one configuration.
///
/// Each service gets its own state record, created on first use and mutated under that record's
/// monitor. Unrelated services never contend.
///
/// ### Contracts
/// - `open` rejects every request until `resetTimeoutMs` has elapsed since it opened
/// - the first request after that moves the circuit to `half_open` and is admitted as the probe
/// - while a probe is in flight further requests are rejected; once the probe's outcome is
///   recorded, the next probe is admitted
/// - one half-open failure reopens the circuit; `successThreshold` consecutive half-open
///   successes close it and clear the failure history
///
/// ### Usage
/// {@snippet :
/// CircuitBreakerRegistry breakers = new CircuitBreakerRegistry(CircuitBreakerConfig.defaults());
/// breakers.allowRequest("github");      // throws CircuitOpenException when open
/// try {
///     Object result = client.call();
///     breakers.recordSuccess("github");
/// } catch (Exception e) {
///     breakers.recordFailure("github");
///     throw e;
/// }
/// }
///
/// @implNote Thread-safe.
public class CircuitBreakerRegistry {

    private static final Logger logger = Logger.getLogger(CircuitBreakerRegistry.class.getName());

    private final CircuitBreakerConfig config;
    private final Clock clock;
    private final CircuitStateListener listener;
    private final Map<String, ServiceCircuit> circuits = new ConcurrentHashMap<>();

    public CircuitBreakerRegistry(CircuitBreakerConfig config) {
        this(config, Clock.systemUTC(), CircuitStateListener.NOOP);
    }

    /// Creates a registry with an explicit clock and transition listener.
    ///
    /// @param config thresholds applied to every service, not null
    /// @param clock time source for windows and timeouts, not null
    /// @param listener transition callback, not null
    public CircuitBreakerRegistry(
            CircuitBreakerConfig config, Clock clock, CircuitStateListener listener) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.listener = Objects.requireNonNull(listener, "listener must not be null");
    }

    /// Admits or rejects a request for the service.
    ///
    /// @param service service name, not null
    /// @throws CircuitOpenException if the circuit is open or a half-open probe is in flight
    public void allowRequest(String service) {
        Objects.requireNonNull(service, "service must not be null");
        ServiceCircuit circuit = circuit(service);
        CircuitState from;
        synchronized (circuit) {
            long now = clock.millis();
            switch (circuit.state) {
                case CLOSED:
                    return;
                case HALF_OPEN:
                    if (circuit.probeInFlight) {
                        throw new CircuitOpenException(service, Duration.ofSeconds(1));
                    }
                    circuit.probeInFlight = true;
                    return;
                default:
                    long elapsed = now - circuit.openedAt;
                    if (elapsed < config.resetTimeoutMs()) {
                        throw new CircuitOpenException(
                                service, Duration.ofMillis(config.resetTimeoutMs() - elapsed));
                    }
                    from = circuit.transition(CircuitState.HALF_OPEN, now);
                    circuit.probeInFlight = true;
            }
        }
        notifyTransition(service, from, CircuitState.HALF_OPEN);
    }

    /// Records a successful call.
    ///
    /// @param service service name, not null
    public void recordSuccess(String service) {
        Objects.requireNonNull(service, "service must not be null");
        ServiceCircuit circuit = circuit(service);
        CircuitState from = null;
        synchronized (circuit) {
            if (circuit.state != CircuitState.HALF_OPEN) {
                return;
            }
            circuit.probeInFlight = false;
            circuit.halfOpenSuccesses++;
            if (circuit.halfOpenSuccesses >= config.successThreshold()) {
                from = circuit.transition(CircuitState.CLOSED, clock.millis());
                circuit.failures.clear();
            }
        }
        if (from != null) {
            notifyTransition(service, from, CircuitState.CLOSED);
        }
    }

    /// Records a failed call.
    ///
    /// @param service service name, not null
    public void recordFailure(String service) {
        Objects.requireNonNull(service, "service must not be null");
        ServiceCircuit circuit = circuit(service);
        CircuitState from = null;
        synchronized (circuit) {
            long now = clock.millis();
            circuit.failures.addLast(now);
            circuit.prune(now - config.failureWindowMs());
            if (circuit.state == CircuitState.HALF_OPEN) {
                from = circuit.transition(CircuitState.OPEN, now);
            } else if (circuit.state == CircuitState.CLOSED
                    && circuit.failures.size() >= config.failureThreshold()) {
                from = circuit.transition(CircuitState.OPEN, now);
            }
        }
        if (from != null) {
            notifyTransition(service, from, CircuitState.OPEN);
        }
    }

    /// Returns the service's current state. Unknown services are `CLOSED`.
    ///
    /// @param service service name, not null
    /// @return state, never null
    public CircuitState getState(String service) {
        Objects.requireNonNull(service, "service must not be null");
        ServiceCircuit circuit = circuits.get(service);
        if (circuit == null) {
            return CircuitState.CLOSED;
        }
        synchronized (circuit) {
            return circuit.state;
        }
    }

    /// Returns stats for every service seen so far.
    ///
    /// @return service name to stats, never null
    public Map<String, CircuitStats> getStats() {
        Map<String, CircuitStats> stats = new LinkedHashMap<>();
        long cutoff = clock.millis() - config.failureWindowMs();
        circuits.forEach(
                (service, circuit) -> {
                    synchronized (circuit) {
                        circuit.prune(cutoff);
                        stats.put(
                                service,
                                new CircuitStats(circuit.state, circuit.failures.size()));
                    }
                });
        return stats;
    }

    /// Forces a service's circuit back to `CLOSED` with an empty history.
    ///
    /// @param service service name, not null
    public void reset(String service) {
        Objects.requireNonNull(service, "service must not be null");
        ServiceCircuit removed = circuits.remove(service);
        if (removed != null) {
            logger.info("Circuit breaker reset for " + service);
        }
    }

    /// Forces every circuit back to `CLOSED`.
    public void resetAll() {
        circuits.clear();
    }

    public CircuitBreakerConfig getConfig() {
        return config;
    }

    private ServiceCircuit circuit(String service) {
        return circuits.computeIfAbsent(service, s -> new ServiceCircuit());
    }

    private void notifyTransition(String service, CircuitState from, CircuitState to) {
        if (to == CircuitState.OPEN) {
            logger.warning("Circuit breaker for " + service + " transitioned " + from.wireName()
                    + " -> " + to.wireName());
        } else {
            logger.info("Circuit breaker for " + service + " transitioned " + from.wireName()
                    + " -> " + to.wireName());
        }
        listener.onStateChange(service, from, to);
    }

    private static final class ServiceCircuit {
        private CircuitState state = CircuitState.CLOSED;
        private final Deque<Long> failures = new ArrayDeque<>();
        private int halfOpenSuccesses;
        private long openedAt;
        private boolean probeInFlight;

        private CircuitState transition(CircuitState to, long now) {
            CircuitState from = state;
            state = to;
            probeInFlight = false;
            if (to == CircuitState.OPEN) {
                openedAt = now;
                halfOpenSuccesses = 0;
            } else if (to == CircuitState.HALF_OPEN) {
                halfOpenSuccesses = 0;
            }
            return from;
        }

        private void prune(long cutoff) {
            while (!failures.isEmpty() && failures.peekFirst() < cutoff) {
                failures.removeFirst();
            }
        }
    }
}
