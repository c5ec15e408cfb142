package com.querygate.warehouse;

import com.querygate.api.QueryHistoryEntry;
import com.querygate.config.BackoffConfig;
import com.querygate.model.ClassifiedError;
import com.querygate.model.DryRunResult;
import com.querygate.model.QueryExecutionResult;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.function.LongSupplier;

/**
 * Wraps a {@link WarehouseClient} with the dry-run timeout and the transient retry policy.
 *
 * <p>Only transient failures are retried here. Logic and fatal failures are returned on the first
 * occurrence so the orchestrator alone decides whether to repair. The caller's timeout is a hard
 * budget for the whole retry sequence: once the next backoff would cross it, the call ends with a
 * deadline-exceeded error instead of retrying.
 */
@Slf4j
public class WarehouseGateway {

    static final String CANCELLED_MESSAGE = "Execution cancelled";

    /**
     * Blocking pause between attempts.
     */
    @FunctionalInterface
    public interface Sleeper {
        void sleep(Duration duration) throws InterruptedException;
    }

    private final WarehouseClient client;
    private final BackoffConfig backoff;
    private final Duration dryRunTimeout;
    private final Sleeper sleeper;
    private final LongSupplier nanoClock;

    public WarehouseGateway(WarehouseClient client, BackoffConfig backoff, Duration dryRunTimeout) {
        this(client, backoff, dryRunTimeout, duration -> Thread.sleep(duration.toMillis()), System::nanoTime);
    }

    public WarehouseGateway(
            WarehouseClient client,
            BackoffConfig backoff,
            Duration dryRunTimeout,
            Sleeper sleeper,
            LongSupplier nanoClock
    ) {
        this.client = client;
        this.backoff = backoff;
        this.dryRunTimeout = dryRunTimeout;
        this.sleeper = sleeper;
        this.nanoClock = nanoClock;
    }

    /**
     * Validate and estimate a query with the configured dry-run timeout. Not retried.
     *
     * @param project billing project, may be null
     * @param sql query text
     * @return estimate or classified error
     */
    public DryRunResult dryRun(String project, String sql) {
        if (Thread.currentThread().isInterrupted()) {
            return DryRunResult.failure(ClassifiedError.fatal(CANCELLED_MESSAGE, null));
        }
        DryRunResult result = client.dryRun(project, sql, dryRunTimeout);
        if (result.isSuccess()) {
            log.debug("Dry run succeeded (bytes_processed={})", result.getBytesProcessed());
        } else {
            log.info("Dry run failed (kind={}): {}", result.getError().getKind(), result.getError().getMessage());
        }
        return result;
    }

    /**
     * Execute a query, retrying transient failures with exponential backoff until the budget is
     * spent.
     *
     * @param project billing project, may be null
     * @param sql query text
     * @param timeoutSeconds total budget for all attempts
     * @param maxResults maximum rows to return
     * @return rows or the classified error of the last attempt
     */
    public QueryExecutionResult executeWithRetry(String project, String sql, int timeoutSeconds, int maxResults) {
        long deadline = nanoClock.getAsLong() + TimeUnit.SECONDS.toNanos(timeoutSeconds);
        int attempt = 0;

        while (true) {
            if (Thread.currentThread().isInterrupted()) {
                return QueryExecutionResult.failure(ClassifiedError.fatal(CANCELLED_MESSAGE, null));
            }

            long remaining = deadline - nanoClock.getAsLong();
            if (remaining <= 0) {
                return QueryExecutionResult.failure(ClassifiedError.deadlineExceeded(
                        "Query exceeded timeout of " + timeoutSeconds + "s after " + attempt + " attempt(s)", null));
            }

            attempt++;
            QueryExecutionResult result = client.execute(project, sql, Duration.ofNanos(remaining), maxResults);
            if (result.isSuccess() || !result.getError().isTransient()) {
                return result;
            }

            ClassifiedError error = result.getError();
            Duration delay = backoff.delayAfter(attempt);
            if (nanoClock.getAsLong() + delay.toNanos() >= deadline) {
                log.warn("Transient failure with no budget left for another attempt (attempt={}, timeout_seconds={}): {}",
                        attempt, timeoutSeconds, error.getMessage());
                return QueryExecutionResult.failure(ClassifiedError.deadlineExceeded(
                        "Query exceeded timeout of " + timeoutSeconds + "s after " + attempt
                                + " attempt(s); last error: " + error.getMessage(),
                        error.getCause()));
            }

            log.warn("Transient warehouse failure, retrying (attempt={}, delay_ms={}): {}", attempt, delay.toMillis(), error.getMessage());
            try {
                sleeper.sleep(delay);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return QueryExecutionResult.failure(ClassifiedError.fatal(CANCELLED_MESSAGE, e));
            }
        }
    }

    /**
     * Recent warehouse jobs for the audit trail.
     *
     * @param limit maximum entries
     * @return history, possibly empty
     */
    public List<QueryHistoryEntry> recentJobs(int limit) {
        return client.recentJobs(limit);
    }
}
