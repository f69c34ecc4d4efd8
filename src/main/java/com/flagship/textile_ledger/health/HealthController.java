package com.flagship.textile_ledger.health;

import com.flagship.textile_ledger.observability.OutboxBacklogMonitor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Readiness of the ledger and inventory service, open to probes without authorization.
 *
 * Only the database is fatal: without it neither reads nor payments work, so the
 * probe answers 503. Stuck outbox events and a missing idempotency cache leave the
 * service usable and report DEGRADED with a 200.
 */
@RestController
@Slf4j
public class HealthController {

    static final String UP = "UP";
    static final String DOWN = "DOWN";
    static final String DEGRADED = "DEGRADED";

    private final DataSource dataSource;
    private final OutboxBacklogMonitor outboxMonitor;
    private final Optional<RedisTemplate<String, String>> redisTemplate;
    private final boolean consumerEnabled;

    public HealthController(DataSource dataSource,
                            OutboxBacklogMonitor outboxMonitor,
                            Optional<RedisTemplate<String, String>> redisTemplate,
                            @Value("${consumer.enabled:true}") boolean consumerEnabled) {
        this.dataSource = dataSource;
        this.outboxMonitor = outboxMonitor;
        this.redisTemplate = redisTemplate;
        this.consumerEnabled = consumerEnabled;
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        boolean databaseUp = checkDatabase();
        String idempotencyCache = checkIdempotencyCache();
        long stuck = outboxMonitor.getStuckEventCount();

        Map<String, Object> outbox = new LinkedHashMap<>();
        outbox.put("status", stuck > 0 ? DEGRADED : UP);
        outbox.put("backlog", outboxMonitor.getBacklogSize());
        outbox.put("oldestAgeSeconds", outboxMonitor.getOldestEventAgeSeconds());
        outbox.put("stuck", stuck);

        String status;
        if (!databaseUp) {
            status = DOWN;
        } else if (stuck > 0 || !UP.equals(idempotencyCache)) {
            status = DEGRADED;
        } else {
            status = UP;
        }

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", status);
        response.put("timestamp", Instant.now().toString());
        response.put("database", databaseUp ? UP : DOWN);
        response.put("idempotencyCache", idempotencyCache);
        response.put("outbox", outbox);
        response.put("inventoryConsumer", consumerEnabled ? "ENABLED" : "DISABLED");

        if (!databaseUp) {
            return ResponseEntity.status(503).body(response);
        }
        return ResponseEntity.ok(response);
    }

    private boolean checkDatabase() {
        try (Connection connection = dataSource.getConnection()) {
            return connection.isValid(2);
        } catch (SQLException e) {
            log.warn("Database health check failed: {}", e.getMessage());
            return false;
        }
    }

    /**
     * Payments fall back to the database for idempotency keys, so Redis being
     * unreachable degrades the service without taking it down.
     */
    private String checkIdempotencyCache() {
        if (redisTemplate.isEmpty()) {
            return DEGRADED;
        }
        RedisConnectionFactory factory = redisTemplate.get().getConnectionFactory();
        if (factory == null) {
            return DEGRADED;
        }
        try (RedisConnection connection = factory.getConnection()) {
            return "PONG".equalsIgnoreCase(connection.ping()) ? UP : DEGRADED;
        } catch (Exception e) {
            log.debug("Idempotency cache unreachable: {}", e.getMessage());
            return DEGRADED;
        }
    }
}
