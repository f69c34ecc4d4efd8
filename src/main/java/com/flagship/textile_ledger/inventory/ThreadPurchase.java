package com.flagship.textile_ledger.inventory;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;

@Value
@Builder
public class ThreadPurchase {
    long id;
    String vendorName;
    String threadType;
    String color;
    BigDecimal quantity;
    String unitOfMeasure;
    BigDecimal totalCost;
    LocalDate orderDate;
    boolean received;
    String inventoryStatus;
}
