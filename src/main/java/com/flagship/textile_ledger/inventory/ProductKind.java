package com.flagship.textile_ledger.inventory;

public enum ProductKind {
    THREAD,
    FABRIC
}
