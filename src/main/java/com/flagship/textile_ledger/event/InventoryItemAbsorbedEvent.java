package com.flagship.textile_ledger.event;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Published when a production record has been absorbed into inventory.
 *
 * Consumers use it to keep the upstream {@code inventory_status} flag in step.
 */
@Value
public class InventoryItemAbsorbedEvent implements LedgerEvent {
    UUID eventId;
    String sourceKind;
    long sourceId;
    long inventoryItemId;
    long inventoryTransactionId;
    String itemCode;
    BigDecimal quantity;
    Instant occurredAt;

    public static final String EVENT_TYPE = "InventoryItemAbsorbed";
    public static final String AGGREGATE_TYPE = "ProductionSource";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    @Override
    public String getAggregateType() {
        return AGGREGATE_TYPE;
    }

    @Override
    public String getAggregateId() {
        return sourceKind + ":" + sourceId;
    }
}
