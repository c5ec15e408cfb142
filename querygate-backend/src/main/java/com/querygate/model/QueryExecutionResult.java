package com.querygate.model;

import java.util.List;
import java.util.Map;

/**
 * Result of running a query on the warehouse: rows and statistics, or a classified error.
 */
public class QueryExecutionResult {
    private final List<Map<String, Object>> rows;
    private final List<String> columns;
    private final long bytesProcessed;
    private final String jobId;
    private final ClassifiedError error;

    private QueryExecutionResult(
            List<Map<String, Object>> rows,
            List<String> columns,
            long bytesProcessed,
            String jobId,
            ClassifiedError error
    ) {
        this.rows = rows;
        this.columns = columns;
        this.bytesProcessed = bytesProcessed;
        this.jobId = jobId;
        this.error = error;
    }

    /**
     * Create a successful result.
     *
     * @param rows result rows in order
     * @param columns column names in order
     * @param bytesProcessed bytes billed by the warehouse, 0 if unknown
     * @param jobId warehouse job id, may be null
     * @return result
     */
    public static QueryExecutionResult success(
            List<Map<String, Object>> rows,
            List<String> columns,
            long bytesProcessed,
            String jobId
    ) {
        List<Map<String, Object>> safeRows = rows != null ? List.copyOf(rows) : List.of();
        List<String> safeColumns = columns != null ? List.copyOf(columns) : List.of();
        return new QueryExecutionResult(safeRows, safeColumns, Math.max(0L, bytesProcessed), jobId, null);
    }

    public static QueryExecutionResult failure(ClassifiedError error) {
        if (error == null) {
            throw new IllegalArgumentException("error is required");
        }
        return new QueryExecutionResult(List.of(), List.of(), 0L, null, error);
    }

    public boolean isSuccess() {
        return error == null;
    }

    public List<Map<String, Object>> getRows() {
        return rows;
    }

    public List<String> getColumns() {
        return columns;
    }

    public long getBytesProcessed() {
        return bytesProcessed;
    }

    public String getJobId() {
        return jobId;
    }

    public ClassifiedError getError() {
        return error;
    }
}
