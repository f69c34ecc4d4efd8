package com.flagship.textile_ledger.ledger;

import com.flagship.textile_ledger.money.Money;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;
import java.util.Map;

/**
 * Dashboard figures derived from a set of normalized, repaired entries.
 */
@Value
@Builder
public class LedgerSummary {
    LocalDate asOf;
    long entryCount;

    Money totalPayables;
    Money totalReceivables;

    long overdueCount;
    Money overdueAmount;

    long recentActivityCount;
    Map<EntryCategory, Long> recentActivity;

    long billCount;
    long paidBillCount;
    long chequeCount;
    long pendingChequeCount;
    long bankTransactionCount;
    Money bankBalance;
    long inventoryValuationCount;
    Money inventoryValuationTotal;
}
