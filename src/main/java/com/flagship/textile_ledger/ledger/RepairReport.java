package com.flagship.textile_ledger.ledger;

import lombok.Value;

import java.util.List;

/**
 * The repaired entry plus the corrections that produced it, in application order.
 */
@Value
public class RepairReport {
    LedgerEntry entry;
    List<RepairAction> actions;

    public boolean isRepaired() {
        return !actions.isEmpty();
    }
}
