package com.flagship.coin_economy;

import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.util.UUID;

/**
 * Base for tests that need the real schema.
 *
 * One Postgres container is shared by every test class so the cached Spring
 * context keeps pointing at a live database. Ledger entries are append-only and
 * the treasury is a singleton, so tests create their own owners and assert on
 * balance deltas rather than absolute totals.
 *
 * Kafka, Redis, the outbox publisher, the moderation consumer and the
 * scheduled jobs are switched off; tests trigger jobs directly.
 */
@Testcontainers(disabledWithoutDocker = true)
public abstract class IntegrationTestSupport {

    protected static final PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16-alpine")
            .withDatabaseName("coin_economy_test")
            .withUsername("test")
            .withPassword("test");

    static {
        postgres.start();
    }

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
        registry.add("spring.autoconfigure.exclude", () ->
                "org.springframework.boot.autoconfigure.data.redis.RedisAutoConfiguration,"
                + "org.springframework.boot.autoconfigure.data.redis.RedisRepositoriesAutoConfiguration");
        registry.add("spring.kafka.bootstrap-servers", () -> "localhost:9999");
        registry.add("spring.kafka.admin.auto-create", () -> "false");
        registry.add("consumer.enabled", () -> "false");
        registry.add("outbox.publisher.enabled", () -> "false");
        registry.add("scheduler.refunds.enabled", () -> "false");
        registry.add("scheduler.expirations.enabled", () -> "false");
        registry.add("scheduler.daily-reset.enabled", () -> "false");
        registry.add("scheduler.reconciliation.enabled", () -> "false");
        registry.add("economy.refund.inter-item-delay-ms", () -> "0");
    }

    protected static String uniqueOwner(String prefix) {
        return prefix + "-" + UUID.randomUUID().toString().substring(0, 8);
    }

    protected void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    protected void printInput(String label, Object value) {
        System.out.println("INPUT  - " + label + ": " + value);
    }

    protected void printOutput(String label, Object value) {
        System.out.println("OUTPUT - " + label + ": " + value);
    }

    protected void printSuccess(String message) {
        System.out.println("✓ SUCCESS: " + message);
    }
}
