package io.stepflow.core;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.stepflow.core.exception.ValidationException;
import io.stepflow.core.reliability.CircuitBreakerConfig;
import io.stepflow.core.reliability.RateLimitConfig;
import io.stepflow.core.reliability.RateLimitStrategy;
import io.stepflow.core.reliability.ReliabilityOptions;
import java.time.Duration;
import java.util.Properties;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class StepflowConfigTest {

    @Test
    void shouldUseDefaults() {
        StepflowConfig config = new StepflowConfig();

        assertThat(config.getThreadPoolSize()).isEqualTo(10);
        assertThat(config.getDefaultMaxIterations()).isEqualTo(1000);
        assertThat(config.getDefaultMapConcurrency()).isEqualTo(5);
        assertThat(config.isPreloadKnownRateLimits()).isTrue();
        assertThat(config.getSecretCacheTtl()).isEqualTo(Duration.ofMinutes(5));
        assertThat(config.getRateLimitOverrides()).isEmpty();
        assertThat(config.getReliability().getTimeoutMs())
                .isEqualTo(ReliabilityOptions.DEFAULT_TIMEOUT_MS);
        assertThat(config.getReliability().getMaxRetries())
                .isEqualTo(ReliabilityOptions.DEFAULT_MAX_RETRIES);
    }

    @Test
    void shouldBuildWithOverrides() {
        StepflowConfig config =
                StepflowConfig.builder()
                        .threadPoolSize(2)
                        .defaultMaxIterations(10)
                        .rateLimit("crm", RateLimitConfig.of(1, 1_000))
                        .preloadKnownRateLimits(false)
                        .build();

        assertThat(config.getThreadPoolSize()).isEqualTo(2);
        assertThat(config.getDefaultMaxIterations()).isEqualTo(10);
        assertThat(config.getRateLimitOverrides())
                .containsEntry("crm", RateLimitConfig.of(1, 1_000));
        assertThat(config.isPreloadKnownRateLimits()).isFalse();
    }

    // ---------------------------------------------------------------------
    // properties
    // ---------------------------------------------------------------------

    @Nested
    class FromProperties {

        @Test
        void shouldReadEveryKnownKey() {
            Properties properties = new Properties();
            properties.setProperty("stepflow.threadPoolSize", "16");
            properties.setProperty("stepflow.maxIterations", "200");
            properties.setProperty("stepflow.map.concurrency", "3");
            properties.setProperty("stepflow.reliability.timeout", "10s");
            properties.setProperty("stepflow.reliability.maxRetries", "1");
            properties.setProperty("stepflow.reliability.initialRetryDelay", "250ms");
            properties.setProperty("stepflow.reliability.maxRetryDelay", "2s");
            properties.setProperty("stepflow.circuitBreaker.failureThreshold", "3");
            properties.setProperty("stepflow.circuitBreaker.resetTimeout", "1m");
            properties.setProperty("stepflow.rateLimit.github", "5/1s reject");
            properties.setProperty("stepflow.rateLimit.preloadKnown", "false");
            properties.setProperty("stepflow.secrets.cacheTtl", "30s");

            StepflowConfig config = StepflowConfig.fromProperties(properties);

            assertThat(config.getThreadPoolSize()).isEqualTo(16);
            assertThat(config.getDefaultMaxIterations()).isEqualTo(200);
            assertThat(config.getDefaultMapConcurrency()).isEqualTo(3);
            assertThat(config.getReliability().getTimeoutMs()).isEqualTo(10_000);
            assertThat(config.getReliability().getMaxRetries()).isEqualTo(1);
            assertThat(config.getReliability().getInitialRetryDelayMs()).isEqualTo(250);
            assertThat(config.getReliability().getMaxRetryDelayMs()).isEqualTo(2_000);
            assertThat(config.getCircuitBreaker().failureThreshold()).isEqualTo(3);
            assertThat(config.getCircuitBreaker().resetTimeoutMs()).isEqualTo(60_000);
            assertThat(config.getRateLimitOverrides())
                    .containsEntry(
                            "github",
                            RateLimitConfig.of(5, 1_000).withStrategy(RateLimitStrategy.REJECT));
            assertThat(config.isPreloadKnownRateLimits()).isFalse();
            assertThat(config.getSecretCacheTtl()).isEqualTo(Duration.ofSeconds(30));
        }

        @Test
        void shouldKeepDefaultsForAbsentKeys() {
            StepflowConfig config = StepflowConfig.fromProperties(new Properties());

            assertThat(config.getThreadPoolSize()).isEqualTo(10);
            assertThat(config.getCircuitBreaker()).isEqualTo(CircuitBreakerConfig.defaults());
        }

        @Test
        void shouldRejectNonIntegerValue() {
            Properties properties = new Properties();
            properties.setProperty("stepflow.threadPoolSize", "many");

            assertThatThrownBy(() -> StepflowConfig.fromProperties(properties))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessage("stepflow.threadPoolSize must be an integer, got 'many'");
        }

        @Test
        void shouldRejectMalformedDuration() {
            Properties properties = new Properties();
            properties.setProperty("stepflow.reliability.timeout", "soon");

            assertThatThrownBy(() -> StepflowConfig.fromProperties(properties))
                    .isInstanceOf(ValidationException.class);
        }
    }

    @Nested
    class RateLimits {

        @Test
        void shouldDefaultToQueueStrategy() {
            RateLimitConfig limit =
                    StepflowConfig.parseRateLimit("stepflow.rateLimit.x", "100/1m");

            assertThat(limit.maxRequests()).isEqualTo(100);
            assertThat(limit.windowMs()).isEqualTo(60_000);
            assertThat(limit.strategy()).isEqualTo(RateLimitStrategy.QUEUE);
        }

        @ParameterizedTest
        @ValueSource(strings = {"100", "1/2/3", "/1s"})
        void shouldRejectMalformedLimit(String value) {
            assertThatThrownBy(() -> StepflowConfig.parseRateLimit("stepflow.rateLimit.x", value))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        void shouldNameKeyInFormatError() {
            assertThatThrownBy(() -> StepflowConfig.parseRateLimit("stepflow.rateLimit.x", "100"))
                    .hasMessage(
                            "stepflow.rateLimit.x must look like <requests>/<window>, got '100'");
        }
    }
}
