package com.querygate.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request to execute one generated query.
 *
 * <p>{@code maxResults} and {@code timeoutSeconds} fall back to the configured defaults when absent.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ExecutionRequest {
    @NotBlank(message = "Query text is required")
    private String queryText;

    private String warehouseProject;

    private boolean dryRun;

    @Positive(message = "max_results must be positive")
    private Integer maxResults;

    @Positive(message = "timeout_seconds must be positive")
    private Integer timeoutSeconds;

    @Valid
    private QueryMetadata metadata;
}
