package io.stepflow.core.reliability;

/// Callback fired on every circuit state transition.
///
/// @implNote Invoked on the thread that caused the transition, outside the per-service lock.
@FunctionalInterface
public interface CircuitStateListener {

    CircuitStateListener NOOP = (service, from, to) -> {};

    /// @param service the service whose circuit changed, not null
    /// @param from previous state, not null
    /// @param to new state, not null
    void onStateChange(String service, CircuitState from, CircuitState to);
}
