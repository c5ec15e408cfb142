package com.querygate.controller;

import com.querygate.api.ExecutionRequest;
import com.querygate.api.ExecutionResponse;
import com.querygate.api.QueryHistoryEntry;
import com.querygate.api.ValidateRequest;
import com.querygate.model.SafetyVerdict;
import com.querygate.safety.SqlSafetyPolicy;
import com.querygate.service.QueryExecutionOrchestrator;
import com.querygate.warehouse.WarehouseGateway;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.concurrent.CompletableFuture;

@RestController
@RequestMapping("/v1/query")
public class QueryGateController {

    private static final Logger log = LoggerFactory.getLogger(QueryGateController.class);

    static final int DEFAULT_HISTORY_LIMIT = 10;
    static final int MAX_HISTORY_LIMIT = 100;

    private final QueryExecutionOrchestrator orchestrator;
    private final SqlSafetyPolicy safetyPolicy;
    private final WarehouseGateway warehouseGateway;

    public QueryGateController(
            QueryExecutionOrchestrator orchestrator,
            SqlSafetyPolicy safetyPolicy,
            WarehouseGateway warehouseGateway
    ) {
        this.orchestrator = orchestrator;
        this.safetyPolicy = safetyPolicy;
        this.warehouseGateway = warehouseGateway;
    }

    /**
     * Execute a generated query.
     *
     * POST /v1/query/execute
     *
     * <p>Every terminal status is returned as 200; the outcome is carried in {@code status}.
     *
     * @param request execution request
     * @return execution response, completed on the worker pool
     */
    @PostMapping("/execute")
    public CompletableFuture<ResponseEntity<ExecutionResponse>> execute(@Valid @RequestBody ExecutionRequest request) {
        return orchestrator.submit(request).thenApply(ResponseEntity::ok);
    }

    /**
     * Check a query against the read-only policy without touching the warehouse.
     *
     * POST /v1/query/validate
     */
    @PostMapping("/validate")
    public ResponseEntity<SafetyVerdict> validate(@Valid @RequestBody ValidateRequest request) {
        SafetyVerdict verdict = safetyPolicy.validate(request.getQueryText());
        if (!verdict.isSafe()) {
            log.info("Validation rejected query (rule={})", verdict.getRule());
        }
        return ResponseEntity.ok(verdict);
    }

    /**
     * Recent warehouse jobs for auditing.
     *
     * GET /v1/query/history?limit=N
     */
    @GetMapping("/history")
    public ResponseEntity<List<QueryHistoryEntry>> history(
            @RequestParam(value = "limit", required = false) Integer limit
    ) {
        int effective = limit == null ? DEFAULT_HISTORY_LIMIT : limit;
        if (effective <= 0) {
            throw new IllegalArgumentException("limit must be positive");
        }
        return ResponseEntity.ok(warehouseGateway.recentJobs(Math.min(effective, MAX_HISTORY_LIMIT)));
    }
}
