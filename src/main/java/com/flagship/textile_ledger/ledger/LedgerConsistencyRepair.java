package com.flagship.textile_ledger.ledger;

import com.flagship.textile_ledger.money.Money;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Validates and repairs balance invariants on entries read from the store.
 *
 * The store may hold rows written before the invariants were enforced, or rows
 * modified concurrently, so every balance-tracking entry passes through here
 * before it is served. Steps run in order:
 * <ol>
 *   <li>negative remaining is clamped to zero</li>
 *   <li>remaining above {@code total + ε} is clamped to total</li>
 *   <li>remaining below ε on an open entry marks it completed ({@code PAID} for bills)</li>
 *   <li>a settled status with remaining above ε is downgraded to PARTIAL or PENDING</li>
 * </ol>
 * Each step is idempotent, so {@code repair(repair(e)).equals(repair(e))}.
 * Repairs are logged at WARN and never fail the read.
 */
@Component
@Slf4j
public class LedgerConsistencyRepair {

    public LedgerEntry repair(LedgerEntry entry) {
        return inspect(entry).getEntry();
    }

    public RepairReport inspect(LedgerEntry entry) {
        if (!entry.isBalanceTracking()) {
            return new RepairReport(entry, List.of());
        }

        List<RepairAction> actions = new ArrayList<>();
        Money total = entry.getTotalAmount();
        Money remaining = entry.getRemainingAmount();
        EntryStatus status = entry.getStatus();

        if (remaining.isNegative()) {
            remaining = Money.ZERO;
            actions.add(RepairAction.CLAMPED_NEGATIVE_REMAINING);
        }

        // a negative total caps at zero, otherwise this step would undo the one above
        Money ceiling = total.isNegative() ? Money.ZERO : total;
        if (remaining.exceeds(ceiling)) {
            remaining = ceiling;
            actions.add(RepairAction.CLAMPED_REMAINING_TO_TOTAL);
        }

        if (remaining.isBelowEpsilon() && !status.isClosed()) {
            status = EntryStatus.completedFor(entry.getUnderlyingKind());
            actions.add(RepairAction.MARKED_COMPLETED);
        }

        if (status.isSettled() && remaining.isAboveEpsilon()) {
            status = statusForOutstanding(remaining, total);
            actions.add(RepairAction.DOWNGRADED_SETTLED_STATUS);
        }

        if (actions.isEmpty()) {
            return new RepairReport(entry, List.of());
        }

        log.warn("Repaired ledger entry {}: actions={}, total={}, remaining {} -> {}, status {} -> {}",
                entry.getId(), actions, total, entry.getRemainingAmount(), remaining,
                entry.getStatus(), status);

        LedgerEntry repaired = entry.toBuilder()
            .remainingAmount(remaining)
            .status(status)
            .build();
        return new RepairReport(repaired, List.copyOf(actions));
    }

    /**
     * Status for an entry that still has a balance above epsilon.
     */
    static EntryStatus statusForOutstanding(Money remaining, Money total) {
        return remaining.isLessThan(total) ? EntryStatus.PARTIAL : EntryStatus.PENDING;
    }
}
