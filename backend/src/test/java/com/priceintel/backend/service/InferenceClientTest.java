package com.priceintel.backend.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.priceintel.backend.TestFixtures;
import com.priceintel.backend.dto.InferenceResponse;
import com.priceintel.backend.exception.InferenceFailedException;
import com.priceintel.backend.model.AnalysisJob;
import com.priceintel.backend.model.JobStatus;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class InferenceClientTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    private HttpServer server;
    private InferenceClient client;
    private final AtomicReference<String> requestBody = new AtomicReference<>();
    private final AtomicReference<String> authorization = new AtomicReference<>();
    private volatile int responseStatus;
    private volatile String responseBody;

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/api/analysis/analyze", exchange -> {
            requestBody.set(new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
            authorization.set(exchange.getRequestHeaders().getFirst("Authorization"));
            byte[] bytes = responseBody.getBytes(StandardCharsets.UTF_8);
            exchange.sendResponseHeaders(responseStatus, bytes.length);
            try (OutputStream out = exchange.getResponseBody()) {
                out.write(bytes);
            }
        });
        server.start();

        String url = "http://127.0.0.1:" + server.getAddress().getPort();
        client = new InferenceClient(objectMapper, url, "test-key", Duration.ofSeconds(5), "https://api.example.com");
    }

    @AfterEach
    void tearDown() {
        server.stop(0);
    }

    private AnalysisJob job() {
        return TestFixtures.job("job-1", "owner-1", JobStatus.ANALYZING);
    }

    @Test
    void shouldSendJobAndParseResult() throws Exception {
        // Given
        responseStatus = 200;
        responseBody = "{\"productName\":\"Canon AE-1\",\"brand\":\"Canon\",\"category\":\"Cameras\","
                + "\"pricing\":{\"low\":120,\"median\":150,\"high\":180},"
                + "\"marketplaceRecommendations\":[{\"platform\":\"eBay\",\"suitability\":9,\"reasoning\":\"Collectors\"}],"
                + "\"confidenceScore\":0.92,\"generatedTitle\":\"Canon AE-1\",\"description\":\"Classic\","
                + "\"tags\":[\"film\"],\"processingTimeMs\":5300}";

        // When
        InferenceResponse result = client.analyze(job());

        // Then
        assertEquals("Canon AE-1", result.getProductName());
        assertEquals(150.0, result.getPricing().getMedian());
        assertEquals(1, result.getMarketplaceRecommendations().size());
        assertEquals("Bearer test-key", authorization.get());

        JsonNode sent = objectMapper.readTree(requestBody.get());
        assertEquals("job-1", sent.path("analysisId").asText());
        assertEquals("https://api.example.com/api/files/65f0c0ffee0000000000abcd", sent.path("imageUrl").asText());
        assertEquals("Good", sent.path("condition").asText());
        assertEquals(10.0, sent.path("estimatedCost").asDouble());
    }

    @Test
    void shouldKeepServiceErrorTextVerbatim() {
        responseStatus = 503;
        responseBody = "service unavailable";

        InferenceFailedException ex = assertThrows(InferenceFailedException.class, () -> client.analyze(job()));

        assertEquals("service unavailable", ex.getMessage());
    }

    @Test
    void shouldReadErrorFieldFromJsonBody() {
        responseStatus = 500;
        responseBody = "{\"detail\":\"model overloaded\"}";

        InferenceFailedException ex = assertThrows(InferenceFailedException.class, () -> client.analyze(job()));

        assertEquals("model overloaded", ex.getMessage());
    }

    @Test
    void shouldFallBackToStatusCodeWithoutBody() {
        assertEquals("Inference service returned HTTP 502", client.errorMessage(502, ""));
    }

    @Test
    void shouldRejectPayloadWithoutPricing() {
        responseStatus = 200;
        responseBody = "{\"productName\":\"Canon AE-1\",\"marketplaceRecommendations\":[]}";

        InferenceFailedException ex = assertThrows(InferenceFailedException.class, () -> client.analyze(job()));

        assertEquals("Malformed inference response: missing pricing", ex.getMessage());
    }

    @Test
    void shouldTreatErrorInSuccessfulResponseAsFailure() {
        InferenceFailedException ex = assertThrows(InferenceFailedException.class,
                () -> client.parse("{\"error\":\"image unreadable\"}"));

        assertEquals("image unreadable", ex.getMessage());
    }

    @Test
    void shouldRejectMalformedJson() {
        InferenceFailedException ex = assertThrows(InferenceFailedException.class, () -> client.parse("<html>"));

        assertTrue(ex.getMessage().startsWith("Malformed inference response"));
    }

    @Test
    void shouldReportUnreachableService() {
        InferenceClient unreachable = new InferenceClient(objectMapper, "http://127.0.0.1:1", "",
                Duration.ofSeconds(2), "http://localhost:8080");

        InferenceFailedException ex = assertThrows(InferenceFailedException.class, () -> unreachable.analyze(job()));

        assertTrue(ex.getMessage().startsWith("Inference service"));
    }
}
