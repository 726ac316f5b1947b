package com.priceintel.backend;

import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.MongoDBContainer;
import org.testcontainers.junit.jupiter.Testcontainers;

/**
 * Base class for E2E tests against a TestContainers MongoDB replica set.
 * One container is shared by every Spring context the test run creates.
 */
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@Testcontainers(disabledWithoutDocker = true)
public abstract class BaseE2ETest {

    protected static final String ADMIN_API_KEY = "test-admin-key";

    static final MongoDBContainer mongoDBContainer = new MongoDBContainer("mongo:7.0");

    @DynamicPropertySource
    static void setProperties(DynamicPropertyRegistry registry) {
        startContainer();
        registry.add("spring.data.mongodb.uri", mongoDBContainer::getReplicaSetUrl);
        registry.add("spring.data.mongodb.database", () -> "priceintel-test");
        // Disable OAuth for tests
        registry.add("spring.security.oauth2.client.registration.github.client-id", () -> "test-client-id");
        registry.add("spring.security.oauth2.client.registration.github.client-secret", () -> "test-client-secret");
        registry.add("admin.api.key", () -> ADMIN_API_KEY);
        registry.add("inference.api.url", () -> "http://localhost:1");
        registry.add("priceintel.credits.max-write-attempts", () -> "25");
        registry.add("priceintel.poller.interval", () -> "100ms");
        registry.add("priceintel.poller.max-wait", () -> "30s");
    }

    private static synchronized void startContainer() {
        if (!mongoDBContainer.isRunning()) {
            mongoDBContainer.start();
        }
    }
}
