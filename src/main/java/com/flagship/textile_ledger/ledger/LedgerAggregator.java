package com.flagship.textile_ledger.ledger;

import com.flagship.textile_ledger.money.Money;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Folds a collection of entries into a {@link LedgerSummary}.
 *
 * Every reducer is a commutative sum or count, so iteration order does not
 * affect the result.
 */
@Component
public class LedgerAggregator {

    static final int RECENT_WINDOW_DAYS = 7;

    public LedgerSummary summarize(Collection<LedgerEntry> entries, LocalDate asOf) {
        LocalDate windowStart = asOf.minusDays(RECENT_WINDOW_DAYS);

        Money payables = Money.ZERO;
        Money receivables = Money.ZERO;
        Money overdueAmount = Money.ZERO;
        Money bankBalance = Money.ZERO;
        Money inventoryValue = Money.ZERO;
        long overdueCount = 0;
        long recentCount = 0;
        long billCount = 0;
        long paidBillCount = 0;
        long chequeCount = 0;
        long pendingChequeCount = 0;
        long bankCount = 0;
        long valuationCount = 0;
        Map<EntryCategory, Long> recentByCategory = new EnumMap<>(EntryCategory.class);

        for (LedgerEntry entry : entries) {
            EntryStatus status = entry.getStatus();

            if (status != EntryStatus.CANCELLED) {
                if (entry.getCategory() == EntryCategory.PAYABLE) {
                    payables = payables.plus(entry.getRemainingAmount());
                } else if (entry.getCategory() == EntryCategory.RECEIVABLE) {
                    receivables = receivables.plus(entry.getRemainingAmount());
                }
            }

            if (isOverdue(entry, asOf)) {
                overdueCount++;
                overdueAmount = overdueAmount.plus(entry.getRemainingAmount());
            }

            if (entry.getEntryDate() != null && !entry.getEntryDate().isBefore(windowStart)
                    && !entry.getEntryDate().isAfter(asOf)) {
                recentCount++;
                recentByCategory.merge(entry.getCategory(), 1L, Long::sum);
            }

            switch (entry.getUnderlyingKind()) {
                case BILL -> {
                    billCount++;
                    if (status.isSettled()) {
                        paidBillCount++;
                    }
                }
                case CHEQUE -> {
                    chequeCount++;
                    if (status == EntryStatus.PENDING) {
                        pendingChequeCount++;
                    }
                }
                case BANK_TXN -> {
                    bankCount++;
                    bankBalance = bankBalance.plus(entry.getTotalAmount());
                }
                case INVENTORY_VALUATION -> {
                    valuationCount++;
                    inventoryValue = inventoryValue.plus(entry.getTotalAmount());
                }
                default -> {
                    // manual payables and receivables only feed the category totals
                }
            }
        }

        return LedgerSummary.builder()
            .asOf(asOf)
            .entryCount(entries.size())
            .totalPayables(payables)
            .totalReceivables(receivables)
            .overdueCount(overdueCount)
            .overdueAmount(overdueAmount)
            .recentActivityCount(recentCount)
            .recentActivity(Collections.unmodifiableMap(recentByCategory))
            .billCount(billCount)
            .paidBillCount(paidBillCount)
            .chequeCount(chequeCount)
            .pendingChequeCount(pendingChequeCount)
            .bankTransactionCount(bankCount)
            .bankBalance(bankBalance)
            .inventoryValuationCount(valuationCount)
            .inventoryValuationTotal(inventoryValue)
            .build();
    }

    static boolean isOverdue(LedgerEntry entry, LocalDate asOf) {
        return entry.isOpen()
            && entry.getDueDate() != null
            && entry.getDueDate().isBefore(asOf)
            && entry.getRemainingAmount().isAboveEpsilon();
    }
}
