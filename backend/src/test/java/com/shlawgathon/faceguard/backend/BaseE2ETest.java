package com.shlawgathon.faceguard.backend;

import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.MongoDBContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;

/**
 * Base class for E2E tests with TestContainers MongoDB.
 */
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@ActiveProfiles("test")
@Testcontainers(disabledWithoutDocker = true)
public abstract class BaseE2ETest {

    protected static final String INTERNAL_API_KEY = "test-internal-key";

    @Container
    static MongoDBContainer mongoDBContainer = new MongoDBContainer("mongo:7.0");

    @DynamicPropertySource
    static void setProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.data.mongodb.uri", mongoDBContainer::getReplicaSetUrl);
        registry.add("spring.data.mongodb.database", () -> "faceguard-test");
        registry.add("faceguard.internal.api-key", () -> INTERNAL_API_KEY);
        registry.add("faceguard.index.snapshot-dir", BaseE2ETest::snapshotDir);
    }

    private static String snapshotDir() {
        try {
            return Files.createTempDirectory("faceguard-e2e-index").toString();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
