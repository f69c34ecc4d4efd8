package com.flagship.textile_ledger.ledger;

/**
 * Why {@link PaymentRecorder} refused a payment.
 */
public enum PaymentRejectionReason {
    NOT_BALANCE_TRACKED,
    ENTRY_CLOSED,
    INVALID_AMOUNT,
    EXCEEDS_REMAINING_BALANCE,
    MISSING_CHEQUE_NUMBER,
    MISSING_BANK_NAME
}
