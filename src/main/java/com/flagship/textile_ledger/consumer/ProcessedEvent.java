package com.flagship.textile_ledger.consumer;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Record that a consumer group has handled an event, so redelivery is a no-op.
 */
@Value
public class ProcessedEvent {
    UUID eventId;
    String eventType;
    String aggregateId;
    String consumerGroup;
    Instant processedAt;
    ProcessingResult result;
    String note;

    public enum ProcessingResult {
        SUCCESS,
        SKIPPED
    }

    public static ProcessedEvent success(UUID eventId, String eventType, String aggregateId, String consumerGroup) {
        return new ProcessedEvent(eventId, eventType, aggregateId, consumerGroup, Instant.now(),
            ProcessingResult.SUCCESS, null);
    }

    public static ProcessedEvent skipped(UUID eventId, String eventType, String aggregateId,
                                         String consumerGroup, String reason) {
        return new ProcessedEvent(eventId, eventType, aggregateId, consumerGroup, Instant.now(),
            ProcessingResult.SKIPPED, reason);
    }
}
