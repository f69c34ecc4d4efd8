package com.flagship.textile_ledger.inventory;

public enum InventoryTransactionType {
    PURCHASE,
    PRODUCTION,
    SALES,
    ADJUSTMENT,
    TRANSFER
}
