package com.querygate.api;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

class ExecutionResponseTest {

    @Test
    void success_shouldDropColumnsWhenThereAreNoRows() {
        ExecutionResponse response = ExecutionResponse.success(List.of(), List.of("id"), 0L, 0.0, "job-1", 3L, 0, "SELECT id FROM t");

        Assertions.assertEquals(ExecutionStatus.SUCCESS, response.getStatus());
        Assertions.assertEquals(0, response.getRowCount());
        Assertions.assertTrue(response.getColumns().isEmpty());
        Assertions.assertNull(response.getErrorMessage());
        Assertions.assertNull(response.getBlockedReason());
    }

    @Test
    void success_shouldCountRows() {
        ExecutionResponse response = ExecutionResponse.success(
                List.of(Map.of("id", 1), Map.of("id", 2)), List.of("id"), 20L, 0.000001, "job-2", 3L, 1, "SELECT id FROM t");

        Assertions.assertEquals(2, response.getRowCount());
        Assertions.assertEquals(List.of("id"), response.getColumns());
        Assertions.assertEquals(20L, response.getBytesProcessed());
        Assertions.assertNotNull(response.getExecutedAt());
    }

    @Test
    void failureFactories_shouldOnlySetTheirOwnMessageField() {
        ExecutionResponse blocked = ExecutionResponse.blocked("Blocked [ALLOWLIST]: nope", 1L, 0, "EXPLAIN SELECT 1");
        ExecutionResponse failed = ExecutionResponse.failed(null, 1L, 0, "SELECT 1");
        ExecutionResponse timeout = ExecutionResponse.timeout("Query exceeded timeout of 5s", 1L, 0, "SELECT 1");

        Assertions.assertEquals("Blocked [ALLOWLIST]: nope", blocked.getBlockedReason());
        Assertions.assertNull(blocked.getErrorMessage());
        Assertions.assertEquals("Query execution failed", failed.getErrorMessage());
        Assertions.assertNull(failed.getBlockedReason());
        Assertions.assertEquals(ExecutionStatus.TIMEOUT, timeout.getStatus());
        Assertions.assertNull(timeout.getBytesProcessed());
        Assertions.assertNull(timeout.getEstimatedCostUsd());
    }
}
