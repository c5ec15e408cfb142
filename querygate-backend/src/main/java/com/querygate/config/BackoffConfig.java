package com.querygate.config;

import org.springframework.core.env.Environment;

import java.time.Duration;

/**
 * Exponential backoff parameters for transient warehouse failures.
 *
 * @param initialDelay delay before the first retry
 * @param maxDelay cap on any single delay
 * @param multiplier growth factor between consecutive delays
 */
public record BackoffConfig(Duration initialDelay, Duration maxDelay, double multiplier) {

    public BackoffConfig {
        if (initialDelay == null || initialDelay.isNegative()) {
            throw new IllegalArgumentException("initialDelay must be >= 0");
        }
        if (maxDelay == null || maxDelay.compareTo(initialDelay) < 0) {
            throw new IllegalArgumentException("maxDelay must be >= initialDelay");
        }
        if (multiplier < 1.0) {
            throw new IllegalArgumentException("multiplier must be >= 1.0");
        }
    }

    public static BackoffConfig defaults() {
        return new BackoffConfig(Duration.ofSeconds(1), Duration.ofSeconds(10), 2.0);
    }

    /**
     * Delay to wait after the given number of failed attempts.
     *
     * @param failedAttempts failed attempts so far, starting at 1
     * @return capped delay
     */
    public Duration delayAfter(int failedAttempts) {
        double factor = Math.pow(multiplier, Math.max(0, failedAttempts - 1));
        double millis = initialDelay.toMillis() * factor;
        if (Double.isInfinite(millis) || millis >= maxDelay.toMillis()) {
            return maxDelay;
        }
        return Duration.ofMillis((long) millis);
    }

    static BackoffConfig fromEnvironment(Environment environment) {
        BackoffConfig defaults = defaults();
        return new BackoffConfig(
                Duration.ofMillis(EnvironmentValues.getLong(environment, "querygate.backoff.initial-delay-ms",
                        "QUERYGATE_BACKOFF_INITIAL_DELAY_MS", defaults.initialDelay().toMillis())),
                Duration.ofMillis(EnvironmentValues.getLong(environment, "querygate.backoff.max-delay-ms",
                        "QUERYGATE_BACKOFF_MAX_DELAY_MS", defaults.maxDelay().toMillis())),
                EnvironmentValues.getDouble(environment, "querygate.backoff.multiplier",
                        "QUERYGATE_BACKOFF_MULTIPLIER", defaults.multiplier())
        );
    }
}
