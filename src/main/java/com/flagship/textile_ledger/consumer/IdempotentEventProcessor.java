package com.flagship.textile_ledger.consumer;

import com.flagship.textile_ledger.observability.LedgerMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.UUID;

/**
 * Runs an event handler at most once per event and consumer group.
 *
 * The handler and the {@code processed_events} row share one transaction: if the
 * handler throws, neither is committed and the redelivered event is handled again.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class IdempotentEventProcessor {

    private final ProcessedEventRepository repository;
    private final LedgerMetrics metrics;

    /**
     * @return true if the handler ran, false if the event had been processed before
     */
    @Transactional
    public boolean processEvent(UUID eventId, String eventType, String aggregateId,
                                String consumerGroup, Runnable handler) {
        if (isAlreadyProcessed(eventId, consumerGroup)) {
            log.info("Event {} already processed by consumer group {}, skipping", eventId, consumerGroup);
            metrics.recordEventProcessed(eventType, false);
            return false;
        }

        handler.run();
        repository.save(ProcessedEventEntity.fromDomain(
            ProcessedEvent.success(eventId, eventType, aggregateId, consumerGroup)));
        metrics.recordEventProcessed(eventType, true);
        return true;
    }

    /**
     * Marks an event this consumer has no use for, so replays skip it cheaply.
     */
    @Transactional
    public void skipEvent(UUID eventId, String eventType, String aggregateId,
                          String consumerGroup, String reason) {
        if (isAlreadyProcessed(eventId, consumerGroup)) {
            return;
        }
        repository.save(ProcessedEventEntity.fromDomain(
            ProcessedEvent.skipped(eventId, eventType, aggregateId, consumerGroup, reason)));
        log.debug("Skipped event {} by consumer group {}: {}", eventId, consumerGroup, reason);
    }

    public boolean isAlreadyProcessed(UUID eventId, String consumerGroup) {
        return repository.existsByEventIdAndConsumerGroup(eventId, consumerGroup);
    }
}
