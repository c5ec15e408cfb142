package com.querygate.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Value;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;

/**
 * Terminal result of an execute call.
 *
 * <p>Instances are only created through the static factories, one per status, so that the optional
 * fields always match the status:
 * <ul>
 *   <li>{@code errorMessage} is set only for FAILED and TIMEOUT</li>
 *   <li>{@code blockedReason} is set only for BLOCKED</li>
 *   <li>{@code columns} is empty exactly when {@code rows} is empty</li>
 * </ul>
 */
@Value
@Builder(access = AccessLevel.PRIVATE)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ExecutionResponse {
    ExecutionStatus status;
    List<Map<String, Object>> rows;
    int rowCount;
    List<String> columns;
    long executionTimeMs;
    Long bytesProcessed;
    Double estimatedCostUsd;
    String errorMessage;
    String blockedReason;
    String queryId;
    OffsetDateTime executedAt;
    int repairAttempts;
    String executedQuery;

    public static ExecutionResponse success(
            List<Map<String, Object>> rows,
            List<String> columns,
            long bytesProcessed,
            double estimatedCostUsd,
            String queryId,
            long executionTimeMs,
            int repairAttempts,
            String executedQuery
    ) {
        List<Map<String, Object>> safeRows = rows != null ? List.copyOf(rows) : List.of();
        List<String> safeColumns = safeRows.isEmpty() || columns == null ? List.of() : List.copyOf(columns);
        return base(ExecutionStatus.SUCCESS, executionTimeMs, repairAttempts, executedQuery)
                .rows(safeRows)
                .rowCount(safeRows.size())
                .columns(safeColumns)
                .bytesProcessed(Math.max(0L, bytesProcessed))
                .estimatedCostUsd(Math.max(0.0, estimatedCostUsd))
                .queryId(queryId)
                .build();
    }

    public static ExecutionResponse dryRun(
            long bytesProcessed,
            double estimatedCostUsd,
            long executionTimeMs,
            int repairAttempts,
            String executedQuery
    ) {
        return base(ExecutionStatus.DRY_RUN, executionTimeMs, repairAttempts, executedQuery)
                .bytesProcessed(Math.max(0L, bytesProcessed))
                .estimatedCostUsd(Math.max(0.0, estimatedCostUsd))
                .build();
    }

    public static ExecutionResponse blocked(String reason, long executionTimeMs, int repairAttempts, String executedQuery) {
        return base(ExecutionStatus.BLOCKED, executionTimeMs, repairAttempts, executedQuery)
                .blockedReason(reason != null && !reason.isBlank() ? reason : "Blocked by safety policy")
                .build();
    }

    public static ExecutionResponse failed(String errorMessage, long executionTimeMs, int repairAttempts, String executedQuery) {
        return base(ExecutionStatus.FAILED, executionTimeMs, repairAttempts, executedQuery)
                .errorMessage(nonBlank(errorMessage, "Query execution failed"))
                .build();
    }

    public static ExecutionResponse timeout(String errorMessage, long executionTimeMs, int repairAttempts, String executedQuery) {
        return base(ExecutionStatus.TIMEOUT, executionTimeMs, repairAttempts, executedQuery)
                .errorMessage(nonBlank(errorMessage, "Query timed out"))
                .build();
    }

    private static ExecutionResponseBuilder base(ExecutionStatus status, long executionTimeMs, int repairAttempts, String executedQuery) {
        return ExecutionResponse.builder()
                .status(status)
                .rows(List.of())
                .rowCount(0)
                .columns(List.of())
                .executionTimeMs(Math.max(0L, executionTimeMs))
                .executedAt(OffsetDateTime.now())
                .repairAttempts(repairAttempts)
                .executedQuery(executedQuery);
    }

    private static String nonBlank(String value, String fallback) {
        return value != null && !value.isBlank() ? value : fallback;
    }
}
