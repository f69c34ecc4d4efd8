package com.flagship.textile_ledger.ledger;

import lombok.Value;

/**
 * The entry after a payment request; {@code replayed} is true when the
 * idempotency key had already been used and nothing was applied.
 */
@Value
public class PaymentOutcome {
    LedgerEntry entry;
    boolean replayed;
}
