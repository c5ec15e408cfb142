package com.querygate.warehouse;

import com.querygate.api.QueryHistoryEntry;
import com.querygate.model.DryRunResult;
import com.querygate.model.QueryExecutionResult;

import java.time.Duration;
import java.util.List;

/**
 * Boundary to a query engine. Implementations are thread-safe and never throw for warehouse
 * failures: every failure is returned as a classified error on the result.
 */
public interface WarehouseClient {

    /**
     * Validate a query and estimate the bytes it would scan, without running it.
     *
     * @param project billing project, null for the client default
     * @param sql query text
     * @param timeout bound for this call
     * @return estimated bytes or a classified error
     */
    DryRunResult dryRun(String project, String sql, Duration timeout);

    /**
     * Run a query once.
     *
     * @param project billing project, null for the client default
     * @param sql query text
     * @param timeout bound for this attempt
     * @param maxResults maximum rows to return
     * @return rows and statistics or a classified error
     */
    QueryExecutionResult execute(String project, String sql, Duration timeout, int maxResults);

    /**
     * Recent jobs submitted by this service account, most recent first.
     *
     * @param limit maximum entries
     * @return history entries, empty when the engine keeps no job history
     */
    List<QueryHistoryEntry> recentJobs(int limit);
}
