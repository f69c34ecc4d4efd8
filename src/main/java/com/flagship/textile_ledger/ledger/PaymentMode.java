package com.flagship.textile_ledger.ledger;

public enum PaymentMode {
    CASH,
    CHEQUE,
    ONLINE
}
