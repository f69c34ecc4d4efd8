package com.flagship.textile_ledger.ledger;

/**
 * A correction {@link LedgerConsistencyRepair} applied to an entry on read.
 */
public enum RepairAction {
    CLAMPED_NEGATIVE_REMAINING,
    CLAMPED_REMAINING_TO_TOTAL,
    MARKED_COMPLETED,
    DOWNGRADED_SETTLED_STATUS
}
