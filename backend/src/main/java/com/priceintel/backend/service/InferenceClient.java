package com.priceintel.backend.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.priceintel.backend.dto.InferenceRequest;
import com.priceintel.backend.dto.InferenceResponse;
import com.priceintel.backend.exception.InferenceFailedException;
import com.priceintel.backend.model.AnalysisJob;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;

/**
 * Client for the external product inference service. One blocking call per job, no retries.
 */
@Service
public class InferenceClient {

    private static final Logger log = LoggerFactory.getLogger(InferenceClient.class);

    private static final String ANALYZE_PATH = "/api/analysis/analyze";
    private static final int MAX_ERROR_BODY_LENGTH = 500;

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final String apiUrl;
    private final String apiKey;
    private final Duration timeout;
    private final String publicUrl;

    public InferenceClient(ObjectMapper objectMapper,
            @Value("${inference.api.url}") String apiUrl,
            @Value("${inference.api.key:}") String apiKey,
            @Value("${inference.api.timeout:90s}") Duration timeout,
            @Value("${backend.public.url:http://localhost:8080}") String publicUrl) {
        // Force HTTP/1.1 - the inference service sits behind Uvicorn
        this.httpClient = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(timeout)
                .build();
        this.objectMapper = objectMapper;
        this.apiUrl = apiUrl;
        this.apiKey = apiKey;
        this.timeout = timeout;
        this.publicUrl = publicUrl;
    }

    /**
     * Analyze the job's image.
     *
     * @throws InferenceFailedException on transport errors, non-2xx statuses and unusable payloads
     */
    public InferenceResponse analyze(AnalysisJob job) {
        InferenceRequest body = InferenceRequest.builder()
                .analysisId(job.getId())
                .imageUrl(publicUrl + job.getArtifactUrl())
                .condition(job.getCondition())
                .estimatedCost(job.getEstimatedCost())
                .notes(job.getNotes())
                .build();

        String fullUrl = apiUrl + ANALYZE_PATH;
        HttpResponse<String> response;
        try {
            String jsonBody = objectMapper.writeValueAsString(body);
            log.info("[INFERENCE HTTP] Job: {} | POST {} | Image: {}", job.getId(), fullUrl, body.getImageUrl());

            HttpRequest.Builder request = HttpRequest.newBuilder()
                    .uri(URI.create(fullUrl))
                    .timeout(timeout)
                    .header("Content-Type", "application/json")
                    .header("Accept", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(jsonBody));
            if (apiKey != null && !apiKey.isBlank()) {
                request.header("Authorization", "Bearer " + apiKey);
            }

            response = httpClient.send(request.build(), HttpResponse.BodyHandlers.ofString());
        } catch (HttpTimeoutException e) {
            log.error("[INFERENCE HTTP] Job: {} timed out after {}", job.getId(), timeout);
            throw new InferenceFailedException("Inference service timed out after " + timeout.toSeconds() + "s", e);
        } catch (IOException e) {
            log.error("[INFERENCE HTTP] Job: {} failed to reach {}: {}", job.getId(), fullUrl, e.getMessage());
            throw new InferenceFailedException("Inference service unreachable: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InferenceFailedException("Inference call interrupted", e);
        }

        if (response.statusCode() < 200 || response.statusCode() >= 300) {
            log.error("[INFERENCE HTTP] Job: {} | Status: {} | Body: {}",
                    job.getId(), response.statusCode(), response.body());
            throw new InferenceFailedException(errorMessage(response.statusCode(), response.body()));
        }

        return parse(response.body());
    }

    InferenceResponse parse(String responseBody) {
        InferenceResponse result;
        try {
            result = objectMapper.readValue(responseBody, InferenceResponse.class);
        } catch (JsonProcessingException e) {
            throw new InferenceFailedException("Malformed inference response: " + e.getOriginalMessage(), e);
        }

        if (result == null) {
            throw new InferenceFailedException("Malformed inference response: empty body");
        }
        if (hasText(result.getError())) {
            throw new InferenceFailedException(result.getError());
        }
        if (!hasText(result.getProductName())) {
            throw new InferenceFailedException("Malformed inference response: missing productName");
        }
        if (result.getPricing() == null || result.getPricing().getMedian() == null) {
            throw new InferenceFailedException("Malformed inference response: missing pricing");
        }
        if (result.getMarketplaceRecommendations() == null) {
            throw new InferenceFailedException("Malformed inference response: missing marketplaceRecommendations");
        }
        return result;
    }

    /**
     * Prefer the service's own error text so it can be shown to the seller unchanged.
     */
    String errorMessage(int statusCode, String responseBody) {
        if (hasText(responseBody)) {
            try {
                JsonNode json = objectMapper.readTree(responseBody);
                for (String field : new String[] { "error", "detail", "message" }) {
                    JsonNode node = json.path(field);
                    if (node.isTextual() && hasText(node.asText())) {
                        return node.asText();
                    }
                }
            } catch (JsonProcessingException e) {
                String text = responseBody.trim();
                if (text.length() <= MAX_ERROR_BODY_LENGTH) {
                    return text;
                }
            }
        }
        return "Inference service returned HTTP " + statusCode;
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
