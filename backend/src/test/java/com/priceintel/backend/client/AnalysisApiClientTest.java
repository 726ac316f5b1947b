package com.priceintel.backend.client;

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
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class AnalysisApiClientTest {

    private HttpServer server;
    private AnalysisApiClient client;
    private final AtomicInteger requests = new AtomicInteger();
    private final AtomicReference<String> cookie = new AtomicReference<>();

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/api/jobs/", exchange -> {
            cookie.set(exchange.getRequestHeaders().getFirst("Cookie"));
            String path = exchange.getRequestURI().getPath();
            int status = 200;
            String body;
            if (path.endsWith("/job-1")) {
                // ANALYZING twice, then COMPLETED
                String state = requests.incrementAndGet() < 3 ? "ANALYZING" : "COMPLETED";
                body = "{\"id\":\"job-1\",\"status\":\"" + state + "\",\"productName\":\"Canon AE-1\","
                        + "\"completedAt\":\"2026-03-15T10:00:05Z\",\"unknownField\":1}";
            } else {
                status = 404;
                body = "{\"status\":404,\"reason\":\"not_found\"}";
            }
            byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
            exchange.sendResponseHeaders(status, bytes.length);
            try (OutputStream out = exchange.getResponseBody()) {
                out.write(bytes);
            }
        });
        server.start();
        client = new AnalysisApiClient("http://127.0.0.1:" + server.getAddress().getPort() + "/", "JSESSIONID=abc");
    }

    @AfterEach
    void tearDown() {
        server.stop(0);
    }

    @Test
    void shouldFetchJobWithSessionCookie() throws Exception {
        var job = client.getJob("job-1");

        assertEquals("job-1", job.getId());
        assertEquals(JobStatus.ANALYZING, job.getStatus());
        assertEquals("JSESSIONID=abc", cookie.get());
    }

    @Test
    void shouldReportMissingJobAsIoFailure() {
        IOException e = assertThrows(IOException.class, () -> client.getJob("job-2"));
        assertTrue(e.getMessage().contains("404"));
    }

    @Test
    void shouldPollUntilCompleted() {
        PollResult result = client.poller(Duration.ofMillis(10), Duration.ofSeconds(5)).poll("job-1");

        assertEquals(PollResult.Outcome.COMPLETED, result.outcome());
        assertEquals(3, result.attempts());
        assertEquals("Canon AE-1", result.job().getProductName());
    }
}
