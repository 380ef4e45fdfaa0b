package io.stepflow.core.reliability;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoMoreInteractions;

import io.stepflow.core.exception.CircuitOpenException;
import io.stepflow.core.testing.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class CircuitBreakerRegistryTest {

    private static final CircuitBreakerConfig CONFIG =
            new CircuitBreakerConfig(3, 10_000, 2, 60_000);

    @Mock private CircuitStateListener listener;

    private MutableClock clock;
    private CircuitBreakerRegistry breakers;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2026-03-01T10:00:00Z");
        breakers = new CircuitBreakerRegistry(CONFIG, clock, listener);
    }

    private void fail(String service, int times) {
        for (int i = 0; i < times; i++) {
            breakers.recordFailure(service);
        }
    }

    @Nested
    class Closed {

        @Test
        void shouldAdmitRequestsForUnknownService() {
            assertThatCode(() -> breakers.allowRequest("github")).doesNotThrowAnyException();
            assertThat(breakers.getState("github")).isEqualTo(CircuitState.CLOSED);
        }

        @Test
        void shouldStayClosedBelowThreshold() {
            fail("github", 2);

            assertThat(breakers.getState("github")).isEqualTo(CircuitState.CLOSED);
            assertThat(breakers.getStats().get("github").recentFailures()).isEqualTo(2);
        }

        @Test
        @DisplayName("failures outside the window do not count toward the threshold")
        void shouldForgetFailuresOutsideWindow() {
            fail("github", 2);
            clock.advanceMillis(60_001);
            fail("github", 1);

            assertThat(breakers.getState("github")).isEqualTo(CircuitState.CLOSED);
            assertThat(breakers.getStats().get("github").recentFailures()).isEqualTo(1);
        }

        @Test
        void shouldKeepServicesIndependent() {
            fail("github", 3);

            assertThat(breakers.getState("github")).isEqualTo(CircuitState.OPEN);
            assertThat(breakers.getState("slack")).isEqualTo(CircuitState.CLOSED);
        }
    }

    @Nested
    class Open {

        @Test
        void shouldOpenAtThresholdAndNotifyListener() {
            fail("github", 3);

            assertThat(breakers.getState("github")).isEqualTo(CircuitState.OPEN);
            verify(listener).onStateChange("github", CircuitState.CLOSED, CircuitState.OPEN);
        }

        @Test
        void shouldRejectWithRemainingCooldown() {
            fail("github", 3);
            clock.advanceMillis(4_000);

            assertThatThrownBy(() -> breakers.allowRequest("github"))
                    .isInstanceOfSatisfying(
                            CircuitOpenException.class,
                            e -> {
                                assertThat(e.getService()).isEqualTo("github");
                                assertThat(e.isRetryable()).isTrue();
                                assertThat(e.retryAfter()).hasValueSatisfying(
                                        d -> assertThat(d.toMillis()).isEqualTo(6_000));
                            })
                    .hasMessageContaining("Circuit breaker is open for github");
        }
    }

    @Nested
    class HalfOpen {

        @BeforeEach
        void openAndCoolDown() {
            fail("github", 3);
            clock.advanceMillis(10_000);
        }

        @Test
        void shouldAdmitExactlyOneProbe() {
            breakers.allowRequest("github");

            assertThat(breakers.getState("github")).isEqualTo(CircuitState.HALF_OPEN);
            assertThatThrownBy(() -> breakers.allowRequest("github"))
                    .isInstanceOf(CircuitOpenException.class);
        }

        @Test
        void shouldAdmitNextProbeAfterSuccess() {
            breakers.allowRequest("github");
            breakers.recordSuccess("github");

            assertThatCode(() -> breakers.allowRequest("github")).doesNotThrowAnyException();
            assertThat(breakers.getState("github")).isEqualTo(CircuitState.HALF_OPEN);
        }

        @Test
        void shouldCloseAfterSuccessThresholdAndClearHistory() {
            breakers.allowRequest("github");
            breakers.recordSuccess("github");
            breakers.allowRequest("github");
            breakers.recordSuccess("github");

            assertThat(breakers.getState("github")).isEqualTo(CircuitState.CLOSED);
            assertThat(breakers.getStats().get("github").recentFailures()).isZero();
            verify(listener).onStateChange("github", CircuitState.CLOSED, CircuitState.OPEN);
            verify(listener).onStateChange("github", CircuitState.OPEN, CircuitState.HALF_OPEN);
            verify(listener).onStateChange("github", CircuitState.HALF_OPEN, CircuitState.CLOSED);
            verifyNoMoreInteractions(listener);
        }

        @Test
        void shouldReopenOnSingleProbeFailure() {
            breakers.allowRequest("github");
            breakers.recordFailure("github");

            assertThat(breakers.getState("github")).isEqualTo(CircuitState.OPEN);
            assertThatThrownBy(() -> breakers.allowRequest("github"))
                    .isInstanceOf(CircuitOpenException.class);
        }
    }

    @Test
    void resetShouldCloseCircuit() {
        fail("github", 3);

        breakers.reset("github");

        assertThat(breakers.getState("github")).isEqualTo(CircuitState.CLOSED);
        assertThatCode(() -> breakers.allowRequest("github")).doesNotThrowAnyException();
    }
}
