package io.stepflow.core.reliability;

/// A single external call guarded by {@link ReliabilityWrapper}. May throw checked exceptions,
/// which the wrapper converts to {@link io.stepflow.core.exception.ToolInvocationException}.
///
/// @param <T> result type
@FunctionalInterface
public interface ReliableCall<T> {

    T call() throws Exception;
}
