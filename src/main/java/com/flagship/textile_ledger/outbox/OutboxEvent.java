package com.flagship.textile_ledger.outbox;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * An event waiting in the outbox table to be published to Kafka.
 *
 * Written in the same transaction as the ledger or inventory change it describes,
 * published later by {@link OutboxPublisher}.
 */
@Value
public class OutboxEvent {
    UUID id;
    String aggregateType;
    String aggregateId;
    String eventType;
    String payload;
    String correlationId;
    Instant createdAt;
    Instant publishedAt;
    int retryCount;
    String lastError;
    Long sequenceNumber;

    public static OutboxEvent create(UUID id, String aggregateType, String aggregateId,
                                     String eventType, String payload, String correlationId) {
        return new OutboxEvent(id, aggregateType, aggregateId, eventType, payload, correlationId,
            Instant.now(), null, 0, null, null);
    }

    public boolean isPublished() {
        return publishedAt != null;
    }
}
