package com.flagship.textile_ledger.inventory;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

@Value
@Builder
public class InventoryItem {
    Long id;
    String itemCode;
    String description;
    ProductKind productKind;
    BigDecimal currentQuantity;
    String unitOfMeasure;
    BigDecimal costPerUnit;
    BigDecimal salePrice;
    BigDecimal minStockLevel;
    String location;
}
