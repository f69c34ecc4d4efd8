package com.flagship.textile_ledger.inventory;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;

@Value
@Builder
public class FabricProduction {
    long id;
    String fabricType;
    String dimensions;
    BigDecimal quantityProduced;
    String unitOfMeasure;
    BigDecimal totalCost;
    LocalDate completionDate;
    String status;
    String inventoryStatus;
}
