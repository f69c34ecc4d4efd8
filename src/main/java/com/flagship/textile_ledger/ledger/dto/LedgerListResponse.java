package com.flagship.textile_ledger.ledger.dto;

import com.flagship.textile_ledger.ledger.LedgerListing;
import com.flagship.textile_ledger.ledger.LedgerSummary;
import lombok.Value;

import java.util.List;

@Value
public class LedgerListResponse {
    List<LedgerEntryResponse> entries;
    LedgerSummary summary;
    long repairedCount;

    public static LedgerListResponse from(LedgerListing listing) {
        List<LedgerEntryResponse> entries = listing.getEntries().stream()
            .map(LedgerEntryResponse::from)
            .toList();
        long repaired = listing.getEntries().stream().filter(r -> r.isRepaired()).count();
        return new LedgerListResponse(entries, listing.getSummary(), repaired);
    }
}
