package io.stepflow.core.reliability;

/// Point-in-time view of one service's circuit.
///
/// @param state current state, not null
/// @param recentFailures failures still inside the sliding window
public record CircuitStats(CircuitState state, int recentFailures) {}
