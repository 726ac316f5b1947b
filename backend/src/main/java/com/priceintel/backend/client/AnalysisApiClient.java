package com.priceintel.backend.client;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.priceintel.backend.dto.AnalysisJobResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * HTTP client for the job API, used by callers that poll from outside the backend.
 */
public class AnalysisApiClient implements JobStateFetcher {

    private static final Logger log = LoggerFactory.getLogger(AnalysisApiClient.class);

    private static final Duration REQUEST_TIMEOUT = Duration.ofSeconds(10);

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final String baseUrl;
    private final String sessionCookie;

    /**
     * @param sessionCookie cookie header value of an authenticated session, e.g. {@code JSESSIONID=...}
     */
    public AnalysisApiClient(String baseUrl, String sessionCookie) {
        this(HttpClient.newBuilder().version(HttpClient.Version.HTTP_1_1).build(),
                new ObjectMapper()
                        .findAndRegisterModules()
                        .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false),
                baseUrl, sessionCookie);
    }

    public AnalysisApiClient(HttpClient httpClient, ObjectMapper objectMapper, String baseUrl, String sessionCookie) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.sessionCookie = sessionCookie;
    }

    public AnalysisJobResponse getJob(String jobId) throws IOException, InterruptedException {
        HttpRequest.Builder request = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + "/api/jobs/" + jobId))
                .timeout(REQUEST_TIMEOUT)
                .header("Accept", "application/json")
                .GET();
        if (sessionCookie != null && !sessionCookie.isBlank()) {
            request.header("Cookie", sessionCookie);
        }

        HttpResponse<String> response = httpClient.send(request.build(), HttpResponse.BodyHandlers.ofString());
        if (response.statusCode() != 200) {
            log.debug("[JOB API] GET job: {} returned {}", jobId, response.statusCode());
            throw new IOException("Job API returned HTTP " + response.statusCode() + " for job " + jobId);
        }
        return objectMapper.readValue(response.body(), AnalysisJobResponse.class);
    }

    @Override
    public AnalysisJobResponse fetch(String jobId) throws IOException, InterruptedException {
        return getJob(jobId);
    }

    /**
     * Poll this API with the given interval and deadline.
     */
    public CompletionPoller poller(Duration interval, Duration maxWait) {
        return new CompletionPoller(this, interval, maxWait);
    }
}
