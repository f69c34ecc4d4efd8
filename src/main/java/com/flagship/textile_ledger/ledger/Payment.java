package com.flagship.textile_ledger.ledger;

import com.flagship.textile_ledger.money.Money;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;

/**
 * One settlement recorded against a ledger entry.
 *
 * Payments are facts: once appended to an entry they are never changed.
 * {@code id} is null until the store has assigned one.
 */
@Value
@Builder(toBuilder = true)
public class Payment {
    Long id;
    Money amount;
    PaymentMode paymentMode;
    String chequeNumber;
    String bankName;
    LocalDate transactionDate;
    String referenceNumber;
    String notes;

    public boolean isCheque() {
        return paymentMode == PaymentMode.CHEQUE;
    }
}
