package com.flagship.textile_ledger.event;

import java.time.Instant;
import java.util.UUID;

/**
 * Common shape of the facts this service publishes through the outbox.
 */
public interface LedgerEvent {

    /**
     * Unique per event instance; consumers deduplicate on it.
     */
    UUID getEventId();

    String getAggregateType();

    /**
     * Textual id of the aggregate, e.g. {@code bill:12} or {@code DYEING_PROCESS:7}.
     * Also the Kafka partition key.
     */
    String getAggregateId();

    Instant getOccurredAt();

    String getEventType();
}
