package com.flagship.textile_ledger.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.function.Supplier;

/**
 * Micrometer meters for the ledger and the inventory import.
 *
 * Meters:
 * <ul>
 *   <li>{@code ledger.payments.recorded{mode}}</li>
 *   <li>{@code ledger.payments.rejected{reason}}</li>
 *   <li>{@code ledger.payments.replayed} (idempotency hits)</li>
 *   <li>{@code ledger.repairs{action}}</li>
 *   <li>{@code inventory.absorptions{source,outcome}}</li>
 *   <li>{@code ledger.operation.duration{operation}}</li>
 *   <li>{@code outbox.events.published{event_type,status}}</li>
 *   <li>{@code consumer.events.processed{event_type,was_new}}</li>
 * </ul>
 */
@Component
public class LedgerMetrics {

    private final MeterRegistry registry;
    private final Counter paymentsReplayed;

    public LedgerMetrics(MeterRegistry registry) {
        this.registry = registry;
        this.paymentsReplayed = Counter.builder("ledger.payments.replayed")
                .description("Payment requests answered from an already used idempotency key")
                .register(registry);
    }

    public void recordPaymentRecorded(String paymentMode) {
        registry.counter("ledger.payments.recorded", "mode", sanitizeTag(paymentMode)).increment();
    }

    public void recordPaymentRejected(String reason) {
        registry.counter("ledger.payments.rejected", "reason", sanitizeTag(reason)).increment();
    }

    public void recordPaymentReplayed() {
        paymentsReplayed.increment();
    }

    public void recordRepair(String action) {
        registry.counter("ledger.repairs", "action", sanitizeTag(action)).increment();
    }

    public void recordAbsorption(String sourceKind, boolean succeeded) {
        registry.counter("inventory.absorptions",
                "source", sanitizeTag(sourceKind),
                "outcome", succeeded ? "imported" : "failed"
        ).increment();
    }

    public <T> T timeOperation(String operation, Supplier<T> body) {
        Timer timer = Timer.builder("ledger.operation.duration")
                .tag("operation", sanitizeTag(operation))
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry);
        return timer.record(body);
    }

    public void recordEventPublished(String eventType) {
        registry.counter("outbox.events.published", "event_type", eventType, "status", "success").increment();
    }

    public void recordEventPublishFailed(String eventType) {
        registry.counter("outbox.events.published", "event_type", eventType, "status", "failure").increment();
    }

    public void recordEventProcessed(String eventType, boolean wasNew) {
        registry.counter("consumer.events.processed",
                "event_type", eventType,
                "was_new", String.valueOf(wasNew)
        ).increment();
    }

    /**
     * Keeps tag cardinality bounded.
     */
    private String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.replaceAll("[^a-zA-Z0-9_]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
