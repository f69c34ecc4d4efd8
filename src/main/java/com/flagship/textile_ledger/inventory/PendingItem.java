package com.flagship.textile_ledger.inventory;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * A completed production record that has not been absorbed into inventory yet.
 * Recomputed on every reconciliation pass, never stored.
 */
@Value
@Builder
public class PendingItem {
    SourceKind sourceKind;
    long sourceId;
    ProductKind productKind;
    String name;
    BigDecimal quantity;
    String unitOfMeasure;
    BigDecimal totalCost;

    public SourceKey getKey() {
        return SourceKey.of(sourceKind, sourceId);
    }
}
