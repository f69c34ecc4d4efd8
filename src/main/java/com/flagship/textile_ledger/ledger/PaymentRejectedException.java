package com.flagship.textile_ledger.ledger;

import com.flagship.textile_ledger.money.Money;
import lombok.Getter;

/**
 * A payment precondition failed. Never retried: the same payment against the
 * same entry will fail the same way.
 */
@Getter
public class PaymentRejectedException extends RuntimeException {

    private final transient EntryId entryId;
    private final PaymentRejectionReason reason;
    private final transient Money remainingBalance;

    public PaymentRejectedException(EntryId entryId, PaymentRejectionReason reason,
                                    Money remainingBalance, String message) {
        super(message);
        this.entryId = entryId;
        this.reason = reason;
        this.remainingBalance = remainingBalance;
    }
}
