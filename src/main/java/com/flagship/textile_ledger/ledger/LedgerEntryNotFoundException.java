package com.flagship.textile_ledger.ledger;

import lombok.Getter;

@Getter
public class LedgerEntryNotFoundException extends RuntimeException {

    private final transient EntryId entryId;

    public LedgerEntryNotFoundException(EntryId entryId) {
        super("Ledger entry not found: " + entryId);
        this.entryId = entryId;
    }
}
