package com.flagship.textile_ledger.inventory.dto;

import com.flagship.textile_ledger.inventory.PendingItem;
import com.flagship.textile_ledger.inventory.ProductKind;
import com.flagship.textile_ledger.inventory.SourceKind;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

@Value
@Builder
public class PendingItemResponse {
    SourceKind sourceKind;
    long sourceId;
    ProductKind productKind;
    String name;
    BigDecimal quantity;
    String unitOfMeasure;
    BigDecimal totalCost;

    public static PendingItemResponse from(PendingItem item) {
        return PendingItemResponse.builder()
            .sourceKind(item.getSourceKind())
            .sourceId(item.getSourceId())
            .productKind(item.getProductKind())
            .name(item.getName())
            .quantity(item.getQuantity())
            .unitOfMeasure(item.getUnitOfMeasure())
            .totalCost(item.getTotalCost())
            .build();
    }
}
