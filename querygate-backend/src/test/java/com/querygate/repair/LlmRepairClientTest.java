package com.querygate.repair;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class LlmRepairClientTest {

    private static final String BROKEN = "SELECT amout FROM orders";
    private static final String ERROR = "Unrecognized name: amout at [1:8]";

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final RepairConfig enabled = new RepairConfig("https://gateway.test", "pk-test", "vk-test", "gpt-4o-mini", 5000);

    @Mock
    private HttpClient httpClient;
    @Mock
    private HttpResponse<String> response;

    @Test
    void repair_shouldReturnCorrectedQueryFromJsonContent() throws Exception {
        doReturn(response).when(httpClient).send(any(HttpRequest.class), any());
        when(response.statusCode()).thenReturn(200);
        when(response.body()).thenReturn(chatCompletion("{\\\"sql\\\": \\\"SELECT amount FROM orders;\\\"}"));

        String repaired = new LlmRepairClient(objectMapper, httpClient, enabled).repair(BROKEN, ERROR);

        Assertions.assertEquals("SELECT amount FROM orders", repaired);

        ArgumentCaptor<HttpRequest> captor = ArgumentCaptor.forClass(HttpRequest.class);
        verify(httpClient).send(captor.capture(), any());
        HttpRequest request = captor.getValue();
        Assertions.assertEquals("https://gateway.test/v1/chat/completions", request.uri().toString());
        Assertions.assertEquals("pk-test", request.headers().firstValue("x-portkey-api-key").orElse(null));
        Assertions.assertEquals("vk-test", request.headers().firstValue("x-portkey-virtual-key").orElse(null));
        Assertions.assertEquals(Duration.ofMillis(5000), request.timeout().orElse(null));
    }

    @Test
    void repair_shouldReturnInputWhenDisabled() {
        RepairConfig disabled = new RepairConfig(RepairConfig.DEFAULT_BASE_URL, null, null, null, 5000);

        String repaired = new LlmRepairClient(objectMapper, httpClient, disabled).repair(BROKEN, ERROR);

        Assertions.assertEquals(BROKEN, repaired);
        verifyNoInteractions(httpClient);
    }

    @Test
    void repair_shouldReturnInputOnHttpError() throws Exception {
        doReturn(response).when(httpClient).send(any(HttpRequest.class), any());
        when(response.statusCode()).thenReturn(502);

        Assertions.assertEquals(BROKEN, new LlmRepairClient(objectMapper, httpClient, enabled).repair(BROKEN, ERROR));
    }

    @Test
    void repair_shouldReturnInputOnTimeout() throws Exception {
        doThrow(new HttpTimeoutException("request timed out")).when(httpClient).send(any(HttpRequest.class), any());

        Assertions.assertEquals(BROKEN, new LlmRepairClient(objectMapper, httpClient, enabled).repair(BROKEN, ERROR));
    }

    @Test
    void repair_shouldReturnInputOnIoFailure() throws Exception {
        doThrow(new IOException("connection refused")).when(httpClient).send(any(HttpRequest.class), any());

        Assertions.assertEquals(BROKEN, new LlmRepairClient(objectMapper, httpClient, enabled).repair(BROKEN, ERROR));
    }

    @Test
    void repair_shouldReturnInputWhenContentIsNotJson() throws Exception {
        doReturn(response).when(httpClient).send(any(HttpRequest.class), any());
        when(response.statusCode()).thenReturn(200);
        when(response.body()).thenReturn(chatCompletion("Sorry, I cannot help with that."));

        Assertions.assertEquals(BROKEN, new LlmRepairClient(objectMapper, httpClient, enabled).repair(BROKEN, ERROR));
    }

    @Test
    void extractSql_shouldStripMarkdownFences() {
        LlmRepairClient client = new LlmRepairClient(objectMapper, httpClient, enabled);

        Assertions.assertEquals("SELECT 1", client.extractSql("```json\n{\"sql\": \"SELECT 1\"}\n```"));
        Assertions.assertEquals("", client.extractSql("```json\n{\"query\": \"SELECT 1\"}\n```"));
        Assertions.assertEquals("", client.extractSql("   "));
    }

    private static String chatCompletion(String escapedContent) {
        return "{\"choices\":[{\"message\":{\"role\":\"assistant\",\"content\":\"" + escapedContent + "\"}}]}";
    }
}
