package io.stepflow.core.reliability;

import java.util.Map;

/// Published API limits of common SaaS services, preloaded into the rate limiter unless
/// {@link io.stepflow.core.StepflowConfig#isPreloadKnownRateLimits()} is turned off.
public final class KnownRateLimits {

    public static final Map<String, RateLimitConfig> ALL =
            Map.of(
                    "slack", RateLimitConfig.of(50, 60_000),
                    "github", RateLimitConfig.of(5000, 3_600_000),
                    "gmail", RateLimitConfig.of(250, 1_000),
                    "discord", RateLimitConfig.of(50, 1_000),
                    "notion", RateLimitConfig.of(3, 1_000),
                    "linear", RateLimitConfig.of(50, 60_000),
                    "stripe", RateLimitConfig.of(100, 1_000),
                    "sendgrid", RateLimitConfig.of(600, 60_000),
                    "trello", RateLimitConfig.of(100, 10_000),
                    "shopify", RateLimitConfig.of(40, 1_000));

    private KnownRateLimits() {}
}
