package io.stepflow.core.reliability;

import io.stepflow.core.exception.CircuitOpenException;
import io.stepflow.core.exception.OperationTimeoutException;
import io.stepflow.core.exception.StepflowException;
import io.stepflow.core.exception.ToolInvocationException;
import io.stepflow.core.exception.ValidationException;
import io.stepflow.core.exception.WorkflowCancelledException;
import java.io.IOException;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Proxy;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.logging.Logger;

/// Guards every external call with validation, rate limiting, circuit breaking, a timeout and
/// retries, in that order.
///
/// ### Pipeline
/// 1. **Validation** (once per call): a registered {@link InputSchema} for the action path
///    rejects bad input with a non-retryable {@link ValidationException}. No I/O happens.
/// 2. **Rate limit** (per attempt): takes a token from {@link RateLimiterRegistry}, queueing or
///    rejecting per the service's strategy.
/// 3. **Circuit check** (once per call): {@link CircuitBreakerRegistry#allowRequest} throws
///    {@link CircuitOpenException} when open. That exception is never retried and is not
///    recorded as a new failure.
/// 4. **Timed call**: the call runs on the call executor and the caller waits at most
///    `timeoutMs`. A call that loses the race is abandoned, not interrupted; its late outcome is
///    logged at `FINE` and dropped.
/// 5. **Retry**: retryable failures are retried up to `maxRetries` times with
///    {@link BackoffPolicy} delays.
/// 6. **Outcome** (once per call): the final success or failure, timeouts included, is
///    recorded into the breaker. Failed attempts that are later retried are not recorded.
///
/// ### Retry classification
/// - {@link ToolInvocationException} with a status code: retried iff the code is in `retryOn`
/// - any other {@link StepflowException}: retried iff {@link StepflowException#isRetryable()}
/// - {@link IOException}: wrapped as a retryable {@link ToolInvocationException}
/// - any other exception: wrapped as a permanent {@link ToolInvocationException}
///
/// ### Usage
/// {@snippet :
/// GitHubClient guarded = wrapper.wrap("github", GitHubClient.class, rawClient, options);
/// guarded.createIssue(Map.of("owner", "acme", "repo", "api", "title", "Broken build"));
///
/// Object result = wrapper.call("slack", "slack.chat.postMessage", input,
///         () -> slack.post(input));
/// }
///
/// @implNote Thread-safe. All mutable state lives in the two registries.
public class ReliabilityWrapper {

    private static final Logger logger = Logger.getLogger(ReliabilityWrapper.class.getName());

    private final CircuitBreakerRegistry circuitBreakers;
    private final RateLimiterRegistry rateLimiters;
    private final ExecutorService callExecutor;
    private final ReliabilityOptions defaults;

    /// @param circuitBreakers breaker registry shared across the process, not null
    /// @param rateLimiters limiter registry shared across the process, not null
    /// @param callExecutor executor that runs guarded calls, not null
    /// @param defaults options used when a call does not bring its own, not null
    public ReliabilityWrapper(
            CircuitBreakerRegistry circuitBreakers,
            RateLimiterRegistry rateLimiters,
            ExecutorService callExecutor,
            ReliabilityOptions defaults) {
        this.circuitBreakers =
                Objects.requireNonNull(circuitBreakers, "circuitBreakers must not be null");
        this.rateLimiters = Objects.requireNonNull(rateLimiters, "rateLimiters must not be null");
        this.callExecutor = Objects.requireNonNull(callExecutor, "callExecutor must not be null");
        this.defaults = Objects.requireNonNull(defaults, "defaults must not be null");
    }

    /// Wraps every interface method of a client.
    ///
    /// The action path of a method is `<service>.<methodName>`. When the first argument is a
    /// map it is the input checked against the schema; otherwise validation is skipped.
    /// `Object` methods (`equals`, `hashCode`, `toString`) bypass the pipeline.
    ///
    /// @param service service name used for breaker and limiter state, not null
    /// @param iface interface implemented by the client, not null
    /// @param client client to guard, not null
    /// @param options reliability settings, not null
    /// @param <T> client interface type
    /// @return proxy implementing `iface`, never null
    public <T> T wrap(String service, Class<T> iface, T client, ReliabilityOptions options) {
        Objects.requireNonNull(service, "service must not be null");
        Objects.requireNonNull(iface, "iface must not be null");
        Objects.requireNonNull(client, "client must not be null");
        Objects.requireNonNull(options, "options must not be null");
        if (!iface.isInterface()) {
            throw new IllegalArgumentException(iface.getName() + " is not an interface");
        }
        Object proxy =
                Proxy.newProxyInstance(
                        iface.getClassLoader(),
                        new Class<?>[] {iface},
                        (self, method, args) -> {
                            if (method.getDeclaringClass() == Object.class) {
                                return invokeDirect(method, client, args);
                            }
                            Object input = args != null && args.length > 0 ? args[0] : null;
                            String actionPath = service + "." + method.getName();
                            if (input instanceof Map<?, ?>) {
                                validate(actionPath, input, options);
                            }
                            return execute(
                                    service,
                                    actionPath,
                                    () -> invokeDirect(method, client, args),
                                    options);
                        });
        return iface.cast(proxy);
    }

    /// Runs one call through the pipeline with the default options.
    ///
    /// @param service service name, not null
    /// @param actionPath action path used for schema lookup, not null
    /// @param input call input, may be null
    /// @param call the external call, not null
    /// @param <T> result type
    /// @return the call's result
    public <T> T call(String service, String actionPath, Object input, ReliableCall<T> call) {
        return call(service, actionPath, input, call, defaults, CallOptions.NONE);
    }

    /// Runs one call through the pipeline.
    ///
    /// @param service service name, not null
    /// @param actionPath action path used for schema lookup, not null
    /// @param input call input, may be null
    /// @param call the external call, not null
    /// @param options reliability settings, not null
    /// @param overrides per-call overrides, not null
    /// @param <T> result type
    /// @return the call's result
    public <T> T call(
            String service,
            String actionPath,
            Object input,
            ReliableCall<T> call,
            ReliabilityOptions options,
            CallOptions overrides) {
        Objects.requireNonNull(service, "service must not be null");
        Objects.requireNonNull(actionPath, "actionPath must not be null");
        Objects.requireNonNull(call, "call must not be null");
        Objects.requireNonNull(options, "options must not be null");
        Objects.requireNonNull(overrides, "overrides must not be null");
        ReliabilityOptions effective = overrides.applyTo(options);
        if (!overrides.skipValidation()) {
            validate(actionPath, input, effective);
        }
        return execute(service, actionPath, call, effective);
    }

    public ReliabilityOptions getDefaults() {
        return defaults;
    }

    public CircuitBreakerRegistry getCircuitBreakers() {
        return circuitBreakers;
    }

    public RateLimiterRegistry getRateLimiters() {
        return rateLimiters;
    }

    private <T> T execute(
            String service, String actionPath, ReliableCall<T> call, ReliabilityOptions options) {
        if (options.isRateLimiter()) {
            rateLimiters.acquire(service);
        }
        if (!options.isCircuitBreaker()) {
            return retrying(service, actionPath, call, options);
        }
        circuitBreakers.allowRequest(service);
        T result;
        try {
            result = retrying(service, actionPath, call, options);
        } catch (RuntimeException e) {
            circuitBreakers.recordFailure(service);
            throw e;
        }
        circuitBreakers.recordSuccess(service);
        return result;
    }

    /// The first attempt uses the token taken by {@link #execute}; each retry takes its own.
    private <T> T retrying(
            String service, String actionPath, ReliableCall<T> call, ReliabilityOptions options) {
        BackoffPolicy backoff = options.backoffPolicy();
        int attempt = 0;
        while (true) {
            try {
                if (attempt > 0 && options.isRateLimiter()) {
                    rateLimiters.acquire(service);
                }
                return timedCall(service, actionPath, call, options.getTimeoutMs());
            } catch (ValidationException | CircuitOpenException e) {
                throw e;
            } catch (StepflowException e) {
                if (attempt >= options.getMaxRetries() || !isRetryable(e, options)) {
                    throw e;
                }
                long delay = backoff.delayMillis(attempt, e.retryAfter());
                logger.fine(
                        "Retrying "
                                + actionPath
                                + " after "
                                + delay
                                + "ms (attempt "
                                + (attempt + 1)
                                + "/"
                                + options.getMaxRetries()
                                + "): "
                                + e.getMessage());
                sleep(delay, actionPath);
                attempt++;
            }
        }
    }

    private <T> T timedCall(
            String service, String actionPath, ReliableCall<T> call, long timeoutMs) {
        CompletableFuture<T> future =
                CompletableFuture.supplyAsync(
                        () -> {
                            try {
                                return call.call();
                            } catch (RuntimeException e) {
                                throw e;
                            } catch (Exception e) {
                                throw new CompletionException(e);
                            }
                        },
                        callExecutor);
        try {
            return future.get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.whenComplete(
                    (late, error) ->
                            logger.fine(
                                    "Dropping late "
                                            + (error == null ? "result" : "failure")
                                            + " of "
                                            + actionPath
                                            + " after timeout"));
            throw new OperationTimeoutException(
                    "Request timed out after " + timeoutMs + "ms", timeoutMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new WorkflowCancelledException("Interrupted while calling " + actionPath, e);
        } catch (ExecutionException e) {
            throw translate(service, actionPath, unwrap(e.getCause()));
        }
    }

    private void validate(String actionPath, Object input, ReliabilityOptions options) {
        InputSchema schema = options.getInputSchemas().get(actionPath);
        if (schema == null) {
            return;
        }
        List<String> errors = schema.validate(input);
        if (!errors.isEmpty()) {
            throw new ValidationException("Input validation failed: " + String.join("; ", errors));
        }
    }

    private static boolean isRetryable(StepflowException e, ReliabilityOptions options) {
        if (e instanceof ToolInvocationException tool && tool.getStatusCode() != null) {
            return options.getRetryOn().contains(tool.getStatusCode());
        }
        return e.isRetryable();
    }

    private static StepflowException translate(String service, String actionPath, Throwable error) {
        if (error instanceof StepflowException stepflowException) {
            return stepflowException;
        }
        String message = error.getMessage() != null ? error.getMessage() : error.toString();
        return new ToolInvocationException(
                service, actionPath, message, error, error instanceof IOException);
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException
                        || current instanceof InvocationTargetException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private static Object invokeDirect(Method method, Object target, Object[] args)
            throws Exception {
        try {
            return method.invoke(target, args);
        } catch (InvocationTargetException e) {
            if (e.getCause() instanceof Exception cause) {
                throw cause;
            }
            if (e.getCause() instanceof Error error) {
                throw error;
            }
            throw e;
        }
    }

    private static void sleep(long delayMs, String actionPath) {
        if (delayMs <= 0) {
            return;
        }
        try {
            Thread.sleep(delayMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new WorkflowCancelledException(
                    "Interrupted while backing off before retrying " + actionPath, e);
        }
    }
}
