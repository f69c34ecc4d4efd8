package com.flagship.textile_ledger.health;

import com.flagship.textile_ledger.observability.OutboxBacklogMonitor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.web.servlet.MockMvc;
import org.testcontainers.containers.GenericContainer;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import java.sql.Timestamp;
import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@SpringBootTest
@AutoConfigureMockMvc
@Testcontainers(disabledWithoutDocker = true)
class HealthControllerTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16")
            .withDatabaseName("textile_ledger_test")
            .withUsername("test")
            .withPassword("test");

    @Container
    static GenericContainer<?> redis = new GenericContainer<>(DockerImageName.parse("redis:7-alpine"))
            .withExposedPorts(6379);

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
        registry.add("spring.data.redis.host", redis::getHost);
        registry.add("spring.data.redis.port", () -> redis.getMappedPort(6379).toString());
        registry.add("spring.kafka.bootstrap-servers", () -> "localhost:9999");
        registry.add("consumer.enabled", () -> "false");
        registry.add("outbox.publisher.enabled", () -> "false");
    }

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @Autowired
    private OutboxBacklogMonitor outboxMonitor;

    @BeforeEach
    void setUp() {
        jdbcTemplate.update("DELETE FROM outbox_events");
    }

    private void insertOutboxEvent(int retryCount) {
        jdbcTemplate.update(
            "INSERT INTO outbox_events (id, aggregate_type, aggregate_id, event_type, payload, created_at, retry_count) " +
            "VALUES (?, 'LedgerEntry', 'bill:1', 'LedgerPaymentRecorded', '{}'::jsonb, ?, ?)",
            UUID.randomUUID(), Timestamp.from(Instant.now().minus(Duration.ofMinutes(5))), retryCount);
    }

    @Test
    @DisplayName("Reports UP with database, cache and an empty outbox")
    void healthy() throws Exception {
        outboxMonitor.refresh();

        mockMvc.perform(get("/health"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("UP"))
            .andExpect(jsonPath("$.database").value("UP"))
            .andExpect(jsonPath("$.idempotencyCache").value("UP"))
            .andExpect(jsonPath("$.outbox.status").value("UP"))
            .andExpect(jsonPath("$.outbox.backlog").value(0))
            .andExpect(jsonPath("$.outbox.stuck").value(0))
            .andExpect(jsonPath("$.inventoryConsumer").value("DISABLED"))
            .andExpect(jsonPath("$.timestamp").exists());
    }

    @Test
    @DisplayName("Pending events show as backlog without degrading the service")
    void backlogOnly() throws Exception {
        insertOutboxEvent(0);
        insertOutboxEvent(1);
        outboxMonitor.refresh();

        mockMvc.perform(get("/health"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("UP"))
            .andExpect(jsonPath("$.outbox.backlog").value(2))
            .andExpect(jsonPath("$.outbox.stuck").value(0));
    }

    @Test
    @DisplayName("An event out of retries degrades the service but keeps it ready")
    void stuckEventDegrades() throws Exception {
        insertOutboxEvent(0);
        insertOutboxEvent(5);
        outboxMonitor.refresh();

        mockMvc.perform(get("/health"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("DEGRADED"))
            .andExpect(jsonPath("$.database").value("UP"))
            .andExpect(jsonPath("$.outbox.status").value("DEGRADED"))
            .andExpect(jsonPath("$.outbox.backlog").value(2))
            .andExpect(jsonPath("$.outbox.stuck").value(1));
    }
}
