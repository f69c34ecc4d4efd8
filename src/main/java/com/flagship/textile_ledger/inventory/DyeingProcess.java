package com.flagship.textile_ledger.inventory;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;

@Value
@Builder
public class DyeingProcess {
    long id;
    Long threadPurchaseId;
    String colorName;
    String colorCode;
    BigDecimal outputQuantity;
    BigDecimal totalCost;
    LocalDate completionDate;
    String resultStatus;
    String inventoryStatus;
}
