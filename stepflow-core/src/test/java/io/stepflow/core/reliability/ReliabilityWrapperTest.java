package io.stepflow.core.reliability;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

import io.stepflow.core.exception.CircuitOpenException;
import io.stepflow.core.exception.OperationTimeoutException;
import io.stepflow.core.exception.RateLimitException;
import io.stepflow.core.exception.ToolInvocationException;
import io.stepflow.core.exception.ValidationException;
import io.stepflow.core.testing.MutableClock;
import io.stepflow.core.tool.ToolDefinition.ParameterDef;
import java.io.IOException;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class ReliabilityWrapperTest {

    /// Client surface used to exercise the proxy path.
    interface IssueClient {
        Map<String, Object> create(Map<String, Object> input) throws IOException;
    }

    private ScheduledExecutorService scheduler;
    private ExecutorService callPool;
    private CircuitBreakerRegistry breakers;
    private RateLimiterRegistry limiters;
    private ReliabilityOptions fast;
    private ReliabilityWrapper wrapper;

    @BeforeEach
    void setUp() {
        scheduler = Executors.newSingleThreadScheduledExecutor();
        callPool = Executors.newCachedThreadPool();
        breakers = new CircuitBreakerRegistry(new CircuitBreakerConfig(3, 60_000, 1, 60_000));
        limiters = new RateLimiterRegistry(scheduler);
        fast =
                ReliabilityOptions.builder()
                        .timeoutMs(1_000)
                        .maxRetries(2)
                        .initialRetryDelayMs(1)
                        .maxRetryDelayMs(5)
                        .build();
        wrapper = new ReliabilityWrapper(breakers, limiters, callPool, fast);
    }

    @AfterEach
    void tearDown() {
        limiters.destroy();
        scheduler.shutdownNow();
        callPool.shutdownNow();
    }

    @Nested
    class Retries {

        @Test
        void shouldRetryIoFailuresUntilSuccess() {
            AtomicInteger attempts = new AtomicInteger();

            String result =
                    wrapper.call(
                            "github",
                            "github.issues.list",
                            null,
                            () -> {
                                if (attempts.incrementAndGet() < 3) {
                                    throw new IOException("connection reset");
                                }
                                return "ok";
                            });

            assertThat(result).isEqualTo("ok");
            assertThat(attempts).hasValue(3);
        }

        @Test
        void shouldGiveUpAfterMaxRetries() {
            AtomicInteger attempts = new AtomicInteger();

            assertThatThrownBy(
                            () ->
                                    wrapper.call(
                                            "github",
                                            "github.issues.list",
                                            null,
                                            () -> {
                                                attempts.incrementAndGet();
                                                throw new IOException("down");
                                            }))
                    .isInstanceOf(ToolInvocationException.class)
                    .hasMessage("down");
            assertThat(attempts).hasValue(3);
        }

        @Test
        void shouldNotRetryPermanentFailures() {
            AtomicInteger attempts = new AtomicInteger();

            assertThatThrownBy(
                            () ->
                                    wrapper.call(
                                            "github",
                                            "github.issues.list",
                                            null,
                                            () -> {
                                                attempts.incrementAndGet();
                                                throw new IllegalStateException("bad client");
                                            }))
                    .isInstanceOfSatisfying(
                            ToolInvocationException.class,
                            e -> assertThat(e.isRetryable()).isFalse());
            assertThat(attempts).hasValue(1);
        }

        @Test
        @DisplayName("status codes decide retries through retryOn")
        void shouldClassifyByStatusCode() {
            AtomicInteger attempts = new AtomicInteger();

            assertThatThrownBy(
                            () ->
                                    wrapper.call(
                                            "github",
                                            "github.issues.list",
                                            null,
                                            () -> {
                                                attempts.incrementAndGet();
                                                throw new ToolInvocationException(
                                                        "github", "list", "not found", null, true,
                                                        404);
                                            }))
                    .isInstanceOf(ToolInvocationException.class);
            assertThat(attempts).hasValue(1);

            attempts.set(0);
            String result =
                    wrapper.call(
                            "github",
                            "github.issues.list",
                            null,
                            () -> {
                                if (attempts.incrementAndGet() == 1) {
                                    throw new ToolInvocationException(
                                            "github", "list", "busy", null, false, 503);
                                }
                                return "ok";
                            });
            assertThat(result).isEqualTo("ok");
            assertThat(attempts).hasValue(2);
        }

        @Test
        void shouldHonourPerCallOverrides() {
            AtomicInteger attempts = new AtomicInteger();

            assertThatThrownBy(
                            () ->
                                    wrapper.call(
                                            "github",
                                            "github.issues.list",
                                            null,
                                            () -> {
                                                attempts.incrementAndGet();
                                                throw new IOException("down");
                                            },
                                            fast,
                                            new CallOptions(null, 0, false)))
                    .isInstanceOf(ToolInvocationException.class);
            assertThat(attempts).hasValue(1);
        }
    }

    @Nested
    class Guards {

        @Test
        void shouldTimeOutSlowCalls() {
            ReliabilityOptions options = fast.toBuilder().timeoutMs(50).maxRetries(0).build();

            assertThatThrownBy(
                            () ->
                                    wrapper.call(
                                            "slow",
                                            "slow.op",
                                            null,
                                            () -> {
                                                TimeUnit.SECONDS.sleep(5);
                                                return "late";
                                            },
                                            options,
                                            CallOptions.NONE))
                    .isInstanceOf(OperationTimeoutException.class)
                    .hasMessage("Request timed out after 50ms");
            assertThat(breakers.getStats().get("slow").recentFailures()).isEqualTo(1);
        }

        @Test
        @DisplayName("a late failure after a timeout leaves the breaker untouched")
        void shouldDropLateFailureAfterTimeout() {
            ReliabilityOptions options = fast.toBuilder().timeoutMs(100).maxRetries(0).build();
            AtomicBoolean finished = new AtomicBoolean();

            assertThatThrownBy(
                            () ->
                                    wrapper.call(
                                            "slow",
                                            "slow.op",
                                            null,
                                            () -> {
                                                TimeUnit.MILLISECONDS.sleep(500);
                                                finished.set(true);
                                                throw new IOException("late boom");
                                            },
                                            options,
                                            CallOptions.NONE))
                    .isInstanceOf(OperationTimeoutException.class);

            await().during(Duration.ofMillis(700))
                    .atMost(Duration.ofSeconds(2))
                    .until(() -> breakers.getStats().get("slow").recentFailures() == 1);
            assertThat(finished).isTrue();
            assertThat(breakers.getState("slow")).isEqualTo(CircuitState.CLOSED);
        }

        @Test
        void shouldRecordRetriedCallOnceInBreaker() {
            ReliabilityOptions options = fast.toBuilder().maxRetries(3).build();
            AtomicInteger attempts = new AtomicInteger();

            assertThatThrownBy(
                            () ->
                                    wrapper.call(
                                            "flaky",
                                            "flaky.op",
                                            null,
                                            () -> {
                                                attempts.incrementAndGet();
                                                throw new IOException("boom");
                                            },
                                            options,
                                            CallOptions.NONE))
                    .isInstanceOf(ToolInvocationException.class)
                    .hasMessageContaining("boom");
            assertThat(attempts).hasValue(4);
            assertThat(breakers.getState("flaky")).isEqualTo(CircuitState.CLOSED);
            assertThat(breakers.getStats().get("flaky").recentFailures()).isEqualTo(1);
        }

        @Test
        void shouldCloseHalfOpenCircuitWhenRetrySucceeds() {
            MutableClock clock = MutableClock.startingAt("2026-03-01T00:00:00Z");
            CircuitBreakerRegistry probing =
                    new CircuitBreakerRegistry(
                            new CircuitBreakerConfig(3, 60_000, 1, 60_000),
                            clock,
                            CircuitStateListener.NOOP);
            ReliabilityWrapper guarded = new ReliabilityWrapper(probing, limiters, callPool, fast);
            for (int i = 0; i < 3; i++) {
                probing.recordFailure("flaky");
            }
            clock.advance(Duration.ofMinutes(2));
            AtomicInteger attempts = new AtomicInteger();

            Object result =
                    guarded.call(
                            "flaky",
                            "flaky.op",
                            null,
                            () -> {
                                if (attempts.incrementAndGet() == 1) {
                                    throw new IOException("first attempt fails");
                                }
                                return "ok";
                            },
                            fast.toBuilder().maxRetries(1).build(),
                            CallOptions.NONE);

            assertThat(result).isEqualTo("ok");
            assertThat(attempts).hasValue(2);
            assertThat(probing.getState("flaky")).isEqualTo(CircuitState.CLOSED);
        }

        @Test
        void shouldFailFastOnceCircuitOpens() {
            ReliabilityOptions options = fast.toBuilder().maxRetries(0).build();
            for (int i = 0; i < 3; i++) {
                assertThatThrownBy(
                                () ->
                                        wrapper.call(
                                                "flaky",
                                                "flaky.op",
                                                null,
                                                () -> {
                                                    throw new IOException("boom");
                                                },
                                                options,
                                                CallOptions.NONE))
                        .isInstanceOf(ToolInvocationException.class);
            }

            AtomicInteger attempts = new AtomicInteger();
            assertThatThrownBy(
                            () ->
                                    wrapper.call(
                                            "flaky",
                                            "flaky.op",
                                            null,
                                            attempts::incrementAndGet))
                    .isInstanceOf(CircuitOpenException.class);
            assertThat(attempts).hasValue(0);
        }

        @Test
        void shouldPropagateRateLimitRejection() {
            limiters.configure(
                    "stripe", RateLimitConfig.of(1, 60_000).withStrategy(RateLimitStrategy.REJECT));
            ReliabilityOptions options = fast.toBuilder().maxRetries(0).build();
            wrapper.call("stripe", "stripe.charge", null, () -> "first", options, CallOptions.NONE);

            assertThatThrownBy(
                            () ->
                                    wrapper.call(
                                            "stripe",
                                            "stripe.charge",
                                            null,
                                            () -> "second",
                                            options,
                                            CallOptions.NONE))
                    .isInstanceOf(RateLimitException.class);
        }

        @Test
        void shouldValidateInputBeforeAnyCall() {
            ReliabilityOptions options =
                    fast.toBuilder()
                            .inputSchema(
                                    "slack.chat.postMessage",
                                    ParameterSchema.of(
                                            ParameterDef.required("channel", "string", "Channel")))
                            .build();
            AtomicInteger attempts = new AtomicInteger();

            assertThatThrownBy(
                            () ->
                                    wrapper.call(
                                            "slack",
                                            "slack.chat.postMessage",
                                            Map.of("text", "hi"),
                                            attempts::incrementAndGet,
                                            options,
                                            CallOptions.NONE))
                    .isInstanceOf(ValidationException.class)
                    .hasMessageContaining("channel is required");
            assertThat(attempts).hasValue(0);
            assertThat(breakers.getStats()).doesNotContainKey("slack");

            Object skipped =
                    wrapper.call(
                            "slack",
                            "slack.chat.postMessage",
                            Map.of("text", "hi"),
                            attempts::incrementAndGet,
                            options,
                            new CallOptions(null, null, true));
            assertThat(skipped).isEqualTo(1);
        }
    }

    @Nested
    class Wrapping {

        @Test
        void shouldGuardEveryInterfaceMethod() throws IOException {
            AtomicInteger calls = new AtomicInteger();
            IssueClient raw =
                    input -> {
                        if (calls.incrementAndGet() == 1) {
                            throw new IOException("reset");
                        }
                        return Map.of("number", 42, "title", input.get("title"));
                    };
            ReliabilityOptions options =
                    fast.toBuilder()
                            .inputSchema(
                                    "github.create",
                                    ParameterSchema.of(
                                            ParameterDef.required("title", "string", "Title")))
                            .build();

            IssueClient guarded = wrapper.wrap("github", IssueClient.class, raw, options);

            assertThat(guarded.create(Map.of("title", "Broken build")))
                    .containsEntry("number", 42);
            assertThat(calls).hasValue(2);
            assertThatThrownBy(() -> guarded.create(Map.of()))
                    .isInstanceOf(ValidationException.class);
            assertThat(guarded.toString()).isNotNull();
        }

        @Test
        void shouldRejectNonInterfaceTypes() {
            assertThatThrownBy(() -> wrapper.wrap("x", String.class, "raw", fast))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("is not an interface");
        }
    }
}
