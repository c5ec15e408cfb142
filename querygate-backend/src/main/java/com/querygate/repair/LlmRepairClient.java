package com.querygate.repair;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Repairs failing queries through an OpenAI-compatible chat completions gateway.
 *
 * <p>Plain HTTP with Jackson, no vendor SDK. Every failure path (disabled configuration, HTTP error,
 * timeout, unparseable output) returns the broken query unchanged.
 */
public class LlmRepairClient implements RepairClient {

    private static final Logger log = LoggerFactory.getLogger(LlmRepairClient.class);

    private static final int MAX_ERROR_CHARS = 2000;

    private final ObjectMapper objectMapper;
    private final HttpClient httpClient;
    private final RepairConfig config;

    public LlmRepairClient(ObjectMapper objectMapper, RepairConfig config) {
        this(objectMapper, HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(10)).build(), config);
    }

    public LlmRepairClient(ObjectMapper objectMapper, HttpClient httpClient, RepairConfig config) {
        this.objectMapper = objectMapper;
        this.httpClient = httpClient;
        this.config = config;
    }

    @Override
    public String repair(String brokenQuery, String errorMessage) {
        if (!config.isEnabled()) {
            return brokenQuery;
        }

        try {
            Map<String, Object> payload = new HashMap<>();
            payload.put("model", config.model());
            payload.put("temperature", 0);
            payload.put("messages", List.of(
                    Map.of("role", "system", "content", buildSystemPrompt()),
                    Map.of("role", "user", "content", buildUserPrompt(brokenQuery, errorMessage))
            ));

            HttpRequest request = HttpRequest.newBuilder()
                    .uri(URI.create(config.baseUrl() + "/v1/chat/completions"))
                    .timeout(Duration.ofMillis(config.timeoutMs()))
                    .header("Content-Type", "application/json")
                    .header("x-portkey-api-key", config.apiKey())
                    .header("x-portkey-virtual-key", config.provider())
                    .POST(HttpRequest.BodyPublishers.ofString(objectMapper.writeValueAsString(payload), StandardCharsets.UTF_8))
                    .build();

            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() >= 400) {
                log.warn("Repair gateway request failed (status_code={}, gateway_base_url={}, model={})",
                        response.statusCode(), config.baseUrl(), config.model());
                return brokenQuery;
            }

            JsonNode root = objectMapper.readTree(response.body());
            JsonNode contentNode = root.path("choices").path(0).path("message").path("content");
            String repaired = extractSql(contentNode.isTextual() ? contentNode.asText() : "");
            if (repaired.isBlank()) {
                log.warn("Repair gateway returned no usable query (model={})", config.model());
                return brokenQuery;
            }
            return repaired;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Repair call interrupted");
            return brokenQuery;
        } catch (Exception e) {
            log.warn("Repair call failed: {}", e.getMessage());
            return brokenQuery;
        }
    }

    private String buildSystemPrompt() {
        return "You repair SQL queries for a cloud data warehouse (BigQuery Standard SQL). "
                + "Output ONLY valid JSON and nothing else. Do not use markdown fences. Do not add explanations. "
                + "Output schema: {\"sql\": \"<corrected query>\"}. "
                + "The corrected query must be a single read-only SELECT or WITH statement without a trailing semicolon. "
                + "Keep the intent of the original query and change only what is needed to fix the error.";
    }

    private String buildUserPrompt(String brokenQuery, String errorMessage) {
        String error = errorMessage != null ? errorMessage.trim() : "";
        if (error.length() > MAX_ERROR_CHARS) {
            error = error.substring(0, MAX_ERROR_CHARS);
        }
        return "Query:\n" + brokenQuery + "\n\nWarehouse error:\n" + error;
    }

    /**
     * Pull the {@code sql} field out of the model output.
     *
     * @param content raw message content
     * @return query text, or empty string when the output is unusable
     */
    String extractSql(String content) {
        if (content == null) {
            return "";
        }
        String s = content.trim();
        if (s.startsWith("```")) {
            s = s.replaceFirst("^```[a-zA-Z0-9_-]*\\n", "");
            s = s.replaceFirst("\\n?```$", "");
            s = s.trim();
        }
        if (s.isBlank()) {
            return "";
        }

        try {
            JsonNode sqlNode = objectMapper.readTree(s).path("sql");
            if (!sqlNode.isTextual()) {
                return "";
            }
            String sql = sqlNode.asText().trim();
            while (sql.endsWith(";")) {
                sql = sql.substring(0, sql.length() - 1).trim();
            }
            return sql;
        } catch (Exception e) {
            log.debug("Repair output is not valid JSON: {}", e.getMessage());
            return "";
        }
    }
}
