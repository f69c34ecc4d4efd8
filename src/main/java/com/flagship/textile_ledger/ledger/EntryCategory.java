package com.flagship.textile_ledger.ledger;

/**
 * User-facing category of a ledger entry.
 * BILL is only used for bills whose direction is neither SALE nor PURCHASE.
 */
public enum EntryCategory {
    PAYABLE,
    RECEIVABLE,
    BILL,
    TRANSACTION,
    CHEQUE,
    INVENTORY,
    BANK
}
