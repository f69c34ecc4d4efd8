package com.flagship.textile_ledger.ledger;

import com.flagship.textile_ledger.money.Money;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.LocalDate;
import java.util.List;

/**
 * Canonical shape of every record shown in the unified ledger.
 *
 * Invariant: {@code 0 <= remainingAmount <= totalAmount} for balance-tracking entries.
 * Instances are immutable; repairs and payments produce new instances via {@code toBuilder()}.
 */
@Value
@Builder(toBuilder = true)
public class LedgerEntry {
    EntryId id;
    EntryCategory category;
    UnderlyingKind underlyingKind;
    BillDirection direction;
    String description;
    String reference;
    Money totalAmount;
    Money remainingAmount;
    EntryStatus status;
    String party;
    Long khataId;
    LocalDate entryDate;
    LocalDate dueDate;
    String notes;
    @Singular
    List<Payment> transactions;

    public boolean isBalanceTracking() {
        return underlyingKind.isBalanceTracking();
    }

    public Money getPaidAmount() {
        return totalAmount.minus(remainingAmount);
    }

    public boolean isOpen() {
        return isBalanceTracking() && !status.isClosed();
    }
}
