package com.flagship.textile_ledger.inventory;

import lombok.Value;

import java.util.List;

/**
 * Result of an import together with the pending set recomputed afterwards.
 */
@Value
public class ImportOutcome {
    ImportResult result;
    List<PendingItem> pending;
}
