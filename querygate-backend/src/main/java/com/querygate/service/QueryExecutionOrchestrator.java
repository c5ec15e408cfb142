package com.querygate.service;

import com.querygate.api.ExecutionRequest;
import com.querygate.api.ExecutionResponse;
import com.querygate.config.ExecutionConfig;
import com.querygate.cost.CostModel;
import com.querygate.model.ClassifiedError;
import com.querygate.model.DryRunResult;
import com.querygate.model.QueryExecutionResult;
import com.querygate.model.RetryState;
import com.querygate.model.SafetyVerdict;
import com.querygate.repair.RepairClient;
import com.querygate.safety.SqlSafetyPolicy;
import com.querygate.warehouse.WarehouseGateway;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

/**
 * Runs one query through validation, dry run, execution and the bounded repair loop, and reduces the
 * outcome to exactly one {@link ExecutionResponse}.
 *
 * <p>The request is never mutated. The working query text is local to one call and is replaced only
 * by a repair, after which it goes through validation again.
 */
@Slf4j
@Service
public class QueryExecutionOrchestrator {

    static final String CANCELLED_MESSAGE = "Execution cancelled";

    private static final String MDC_QUERY_DOMAIN = "query_domain";
    private static final String MDC_REPAIR_ATTEMPT = "repair_attempt";
    private static final int MAX_LOGGED_QUERY_CHARS = 200;

    private final SqlSafetyPolicy safetyPolicy;
    private final WarehouseGateway warehouseGateway;
    private final CostModel costModel;
    private final RepairClient repairClient;
    private final ExecutionConfig executionConfig;
    private final ExecutorService executorService;

    public QueryExecutionOrchestrator(
            SqlSafetyPolicy safetyPolicy,
            WarehouseGateway warehouseGateway,
            CostModel costModel,
            RepairClient repairClient,
            ExecutionConfig executionConfig,
            ExecutorService executorService
    ) {
        this.safetyPolicy = safetyPolicy;
        this.warehouseGateway = warehouseGateway;
        this.costModel = costModel;
        this.repairClient = repairClient;
        this.executionConfig = executionConfig;
        this.executorService = executorService;
    }

    /**
     * Execute a request on the calling thread.
     *
     * @param request execution request
     * @return terminal response, never null
     */
    public ExecutionResponse execute(ExecutionRequest request) {
        long startNanos = System.nanoTime();
        String domain = request.getMetadata() != null ? request.getMetadata().getDomain() : null;
        MDC.put(MDC_QUERY_DOMAIN, domain != null ? domain : "-");
        MDC.put(MDC_REPAIR_ATTEMPT, "0");

        RetryState retryState = new RetryState(executionConfig.maxRepairAttempts());
        retryState.recordQuery(request.getQueryText());
        try {
            return runLoop(request, retryState, startNanos);
        } catch (RuntimeException e) {
            log.error("Unexpected failure while executing query (repair_attempts={})", retryState.getAttempt(), e);
            return ExecutionResponse.failed("Internal error: " + e.getMessage(),
                    elapsedMs(startNanos), retryState.getAttempt(), retryState.getCurrentQuery());
        } finally {
            MDC.remove(MDC_QUERY_DOMAIN);
            MDC.remove(MDC_REPAIR_ATTEMPT);
        }
    }

    /**
     * Execute a request on the worker pool. Cancelling the returned future interrupts the worker,
     * which stops the call before its next warehouse or repair sub-call.
     *
     * @param request execution request
     * @return future completed with the terminal response
     */
    public CompletableFuture<ExecutionResponse> submit(ExecutionRequest request) {
        CompletableFuture<ExecutionResponse> result = new CompletableFuture<>();
        Map<String, String> callerContext = MDC.getCopyOfContextMap();

        Future<?> task = executorService.submit(() -> {
            if (callerContext != null) {
                MDC.setContextMap(callerContext);
            }
            try {
                result.complete(execute(request));
            } catch (Throwable t) {
                result.completeExceptionally(t);
            } finally {
                MDC.clear();
            }
        });

        result.whenComplete((response, error) -> {
            if (result.isCancelled()) {
                task.cancel(true);
            }
        });
        return result;
    }

    private ExecutionResponse runLoop(ExecutionRequest request, RetryState retryState, long startNanos) {
        String project = blankToNull(request.getWarehouseProject());
        int timeoutSeconds = request.getTimeoutSeconds() != null
                ? request.getTimeoutSeconds() : executionConfig.defaultTimeoutSeconds();
        int maxResults = request.getMaxResults() != null
                ? request.getMaxResults() : executionConfig.defaultMaxResults();

        String currentQuery = retryState.getCurrentQuery();
        log.info("Executing query (dry_run={}, timeout_seconds={}, max_results={}, intent={}): {}",
                request.isDryRun(), timeoutSeconds, maxResults,
                request.getMetadata() != null ? request.getMetadata().getIntent() : null,
                truncateForLog(currentQuery));

        while (true) {
            SafetyVerdict verdict = safetyPolicy.validate(currentQuery);
            if (!verdict.isSafe()) {
                log.warn("Query blocked (rule={}, repair_attempts={})", verdict.getRule(), retryState.getAttempt());
                retryState.recordFailure(verdict.toError());
                return ExecutionResponse.blocked(verdict.getReason(), elapsedMs(startNanos), retryState.getAttempt(), currentQuery);
            }

            if (Thread.currentThread().isInterrupted()) {
                return cancelled(retryState, currentQuery, startNanos);
            }
            DryRunResult dryRun = warehouseGateway.dryRun(project, currentQuery);
            if (!dryRun.isSuccess()) {
                ClassifiedError error = dryRun.getError();
                if (error.isLogic() && retryState.canRepair()) {
                    if (Thread.currentThread().isInterrupted()) {
                        return cancelled(retryState, currentQuery, startNanos);
                    }
                    currentQuery = repair(currentQuery, error, retryState);
                    continue;
                }
                retryState.recordFailure(error);
                return ExecutionResponse.failed(error.getMessage(), elapsedMs(startNanos), retryState.getAttempt(), currentQuery);
            }

            long estimatedBytes = dryRun.getBytesProcessed();
            if (request.isDryRun()) {
                double cost = costModel.estimateCost(estimatedBytes);
                log.info("Dry run complete (bytes_processed={}, estimated_cost_usd={})", estimatedBytes, cost);
                return ExecutionResponse.dryRun(estimatedBytes, cost, elapsedMs(startNanos), retryState.getAttempt(), currentQuery);
            }

            if (Thread.currentThread().isInterrupted()) {
                return cancelled(retryState, currentQuery, startNanos);
            }
            QueryExecutionResult result = warehouseGateway.executeWithRetry(project, currentQuery, timeoutSeconds, maxResults);
            if (!result.isSuccess()) {
                ClassifiedError error = result.getError();
                if (error.isLogic() && retryState.canRepair()) {
                    if (Thread.currentThread().isInterrupted()) {
                        return cancelled(retryState, currentQuery, startNanos);
                    }
                    currentQuery = repair(currentQuery, error, retryState);
                    continue;
                }
                retryState.recordFailure(error);
                if (error.isDeadlineExceeded()) {
                    log.warn("Query timed out (timeout_seconds={}): {}", timeoutSeconds, error.getMessage());
                    return ExecutionResponse.timeout(error.getMessage(), elapsedMs(startNanos), retryState.getAttempt(), currentQuery);
                }
                log.warn("Query failed (kind={}, repair_attempts={}): {}", error.getKind(), retryState.getAttempt(), error.getMessage());
                return ExecutionResponse.failed(error.getMessage(), elapsedMs(startNanos), retryState.getAttempt(), currentQuery);
            }

            double cost = costModel.estimateCost(result.getBytesProcessed());
            log.info("Query succeeded (row_count={}, bytes_processed={}, estimated_cost_usd={}, job_id={}, repair_attempts={})",
                    result.getRows().size(), result.getBytesProcessed(), cost, result.getJobId(), retryState.getAttempt());
            return ExecutionResponse.success(
                    result.getRows(),
                    result.getColumns(),
                    result.getBytesProcessed(),
                    cost,
                    result.getJobId(),
                    elapsedMs(startNanos),
                    retryState.getAttempt(),
                    currentQuery
            );
        }
    }

    /**
     * Ask the repair client for a corrected query. Every call consumes one attempt; a failed or
     * empty repair keeps the current query so the loop goes on until the budget runs out.
     *
     * @return the query to run next
     */
    private String repair(String currentQuery, ClassifiedError error, RetryState retryState) {
        retryState.recordRepair(error);
        MDC.put(MDC_REPAIR_ATTEMPT, String.valueOf(retryState.getAttempt()));

        String repaired;
        try {
            repaired = repairClient.repair(currentQuery, error.getMessage());
        } catch (RuntimeException e) {
            log.warn("Repair client failed (attempt={}/{}): {}", retryState.getAttempt(), retryState.getMaxAttempts(), e.getMessage());
            return currentQuery;
        }

        if (repaired == null || repaired.isBlank() || repaired.trim().equals(currentQuery.trim())) {
            log.info("Repair produced no new query (attempt={}/{})", retryState.getAttempt(), retryState.getMaxAttempts());
            return currentQuery;
        }

        log.info("Retrying with repaired query (attempt={}/{}): {}",
                retryState.getAttempt(), retryState.getMaxAttempts(), truncateForLog(repaired));
        retryState.recordQuery(repaired);
        return repaired;
    }

    private ExecutionResponse cancelled(RetryState retryState, String currentQuery, long startNanos) {
        log.info("Execution cancelled (repair_attempts={})", retryState.getAttempt());
        retryState.recordFailure(ClassifiedError.fatal(CANCELLED_MESSAGE, null));
        return ExecutionResponse.failed(CANCELLED_MESSAGE, elapsedMs(startNanos), retryState.getAttempt(), currentQuery);
    }

    private static long elapsedMs(long startNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }

    static String truncateForLog(String query) {
        if (query == null) {
            return null;
        }
        String flat = query.replaceAll("\\s+", " ").trim();
        return flat.length() <= MAX_LOGGED_QUERY_CHARS ? flat : flat.substring(0, MAX_LOGGED_QUERY_CHARS) + "...";
    }
}
