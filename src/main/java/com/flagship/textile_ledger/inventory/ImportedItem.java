package com.flagship.textile_ledger.inventory;

import lombok.Value;

@Value
public class ImportedItem {
    SourceKey source;
    long inventoryItemId;
    long inventoryTransactionId;
    String itemCode;
}
