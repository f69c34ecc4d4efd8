package com.flagship.textile_ledger.ledger;

import lombok.Value;

import java.util.List;

/**
 * Entries as served, each with the repairs applied on read, plus the summary of
 * the khata they were listed from.
 */
@Value
public class LedgerListing {
    List<RepairReport> entries;
    LedgerSummary summary;
}
