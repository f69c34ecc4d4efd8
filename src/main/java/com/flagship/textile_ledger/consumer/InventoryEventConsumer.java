package com.flagship.textile_ledger.consumer;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.textile_ledger.event.InventoryItemAbsorbedEvent;
import com.flagship.textile_ledger.inventory.InventoryStatusSynchronizer;
import com.flagship.textile_ledger.inventory.SourceKey;
import com.flagship.textile_ledger.inventory.SourceKind;
import com.flagship.textile_ledger.observability.CorrelationContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.slf4j.MDC;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.UUID;

/**
 * Consumes the ledger topic and keeps the upstream {@code inventory_status} flag
 * in step with absorptions.
 *
 * The flag is a lagging cache; pending-item reconciliation does not depend on it.
 * Offsets are acknowledged only after the event is handled or recorded as skipped.
 */
@Component
@ConditionalOnProperty(name = "consumer.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class InventoryEventConsumer {

    static final String CONSUMER_GROUP = "inventory-status-sync";

    private final IdempotentEventProcessor eventProcessor;
    private final InventoryStatusSynchronizer synchronizer;
    private final ObjectMapper objectMapper;

    @KafkaListener(
        topics = "${kafka.topic.ledger:textile-ledger}",
        groupId = "${spring.kafka.consumer.group-id:textile-ledger-consumers}"
    )
    public void consume(ConsumerRecord<String, String> record, Acknowledgment ack) {
        String correlationId = header(record, CorrelationContext.CORRELATION_ID_HEADER);
        if (correlationId != null) {
            MDC.put(CorrelationContext.CORRELATION_ID_MDC_KEY, correlationId);
        }
        try {
            JsonNode payload = parse(record.value());
            if (payload == null || !payload.hasNonNull("eventId") || !payload.hasNonNull("eventType")) {
                log.warn("Could not parse event at offset {}, acknowledging to skip", record.offset());
                ack.acknowledge();
                return;
            }

            UUID eventId = UUID.fromString(payload.get("eventId").asText());
            String eventType = payload.get("eventType").asText();

            if (InventoryItemAbsorbedEvent.EVENT_TYPE.equals(eventType)) {
                SourceKey key = SourceKey.of(
                    SourceKind.valueOf(payload.get("sourceKind").asText()),
                    payload.get("sourceId").asLong());
                eventProcessor.processEvent(eventId, eventType, key.toString(), CONSUMER_GROUP,
                    () -> synchronizer.markAdded(key));
            } else {
                eventProcessor.skipEvent(eventId, eventType, String.valueOf(record.key()), CONSUMER_GROUP,
                    "Not relevant to inventory status");
            }
            ack.acknowledge();
        } catch (RuntimeException e) {
            log.error("Error processing message at offset {}: {}", record.offset(), e.getMessage(), e);
            throw e;
        } finally {
            MDC.remove(CorrelationContext.CORRELATION_ID_MDC_KEY);
        }
    }

    private JsonNode parse(String json) {
        if (json == null) {
            return null;
        }
        try {
            return objectMapper.readTree(json);
        } catch (IOException e) {
            log.error("Failed to parse event payload: {}", e.getMessage());
            return null;
        }
    }

    private static String header(ConsumerRecord<String, String> record, String name) {
        var header = record.headers().lastHeader(name);
        return header == null ? null : new String(header.value(), StandardCharsets.UTF_8);
    }
}
