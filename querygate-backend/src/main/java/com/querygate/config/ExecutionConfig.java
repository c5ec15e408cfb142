package com.querygate.config;

import org.springframework.core.env.Environment;

import java.time.Duration;

/**
 * Orchestrator limits and request defaults.
 *
 * @param maxRepairAttempts upper bound on repair calls per execute call
 * @param defaultTimeoutSeconds execution budget when the request does not set one
 * @param defaultMaxResults row cap when the request does not set one
 * @param dryRunTimeout independent bound for the dry-run sub-call
 * @param workerThreads size of the pool used by asynchronous submissions
 */
public record ExecutionConfig(
        int maxRepairAttempts,
        int defaultTimeoutSeconds,
        int defaultMaxResults,
        Duration dryRunTimeout,
        int workerThreads
) {

    public ExecutionConfig {
        if (maxRepairAttempts < 0) {
            throw new IllegalArgumentException("maxRepairAttempts must be >= 0");
        }
        if (defaultTimeoutSeconds <= 0 || defaultMaxResults <= 0) {
            throw new IllegalArgumentException("default timeout and max results must be positive");
        }
        if (dryRunTimeout == null || dryRunTimeout.isNegative() || dryRunTimeout.isZero()) {
            throw new IllegalArgumentException("dryRunTimeout must be positive");
        }
        if (workerThreads <= 0) {
            throw new IllegalArgumentException("workerThreads must be positive");
        }
    }

    public static ExecutionConfig defaults() {
        return new ExecutionConfig(3, 300, 1000, Duration.ofSeconds(30), 8);
    }

    static ExecutionConfig fromEnvironment(Environment environment) {
        ExecutionConfig defaults = defaults();
        return new ExecutionConfig(
                EnvironmentValues.getInt(environment, "querygate.execution.max-repair-attempts",
                        "QUERYGATE_MAX_REPAIR_ATTEMPTS", defaults.maxRepairAttempts()),
                EnvironmentValues.getInt(environment, "querygate.execution.default-timeout-seconds",
                        "QUERY_TIMEOUT_SECONDS", defaults.defaultTimeoutSeconds()),
                EnvironmentValues.getInt(environment, "querygate.execution.default-max-results",
                        "MAX_QUERY_ROWS", defaults.defaultMaxResults()),
                Duration.ofSeconds(EnvironmentValues.getLong(environment, "querygate.execution.dry-run-timeout-seconds",
                        "QUERYGATE_DRY_RUN_TIMEOUT_SECONDS", defaults.dryRunTimeout().toSeconds())),
                EnvironmentValues.getInt(environment, "querygate.execution.worker-threads",
                        "QUERYGATE_WORKER_THREADS", defaults.workerThreads())
        );
    }
}
