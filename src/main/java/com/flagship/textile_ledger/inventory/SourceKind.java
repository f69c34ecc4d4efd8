package com.flagship.textile_ledger.inventory;

/**
 * Upstream production records that can be absorbed into inventory.
 * Declaration order is the order pending items are listed in.
 */
public enum SourceKind {
    THREAD_PURCHASE("THR", ProductKind.THREAD, InventoryTransactionType.PURCHASE),
    DYEING_PROCESS("DYE", ProductKind.THREAD, InventoryTransactionType.PRODUCTION),
    FABRIC_PRODUCTION("FAB", ProductKind.FABRIC, InventoryTransactionType.PRODUCTION);

    private final String itemCodePrefix;
    private final ProductKind productKind;
    private final InventoryTransactionType transactionType;

    SourceKind(String itemCodePrefix, ProductKind productKind, InventoryTransactionType transactionType) {
        this.itemCodePrefix = itemCodePrefix;
        this.productKind = productKind;
        this.transactionType = transactionType;
    }

    public String itemCodePrefix() {
        return itemCodePrefix;
    }

    public ProductKind productKind() {
        return productKind;
    }

    /**
     * Type of the inventory transaction that absorbs a record of this kind.
     */
    public InventoryTransactionType transactionType() {
        return transactionType;
    }
}
