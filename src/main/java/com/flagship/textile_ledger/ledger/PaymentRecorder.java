package com.flagship.textile_ledger.ledger;

import com.flagship.textile_ledger.money.Money;
import org.springframework.stereotype.Component;

/**
 * Applies a payment to a ledger entry.
 *
 * Preconditions, checked in this order:
 * <ol>
 *   <li>the entry tracks a balance</li>
 *   <li>the entry is not COMPLETED, PAID or CANCELLED</li>
 *   <li>the amount is positive</li>
 *   <li>the amount does not exceed the remaining balance by more than ε</li>
 *   <li>cheque payments carry a cheque number and a bank name</li>
 * </ol>
 *
 * This class is pure. The caller must run it inside a transaction that locked the
 * entry's balance row, otherwise two concurrent payments can both pass the
 * remaining-balance check against the same stale value.
 */
@Component
public class PaymentRecorder {

    /**
     * @return the entry with the payment appended and balance and status recomputed
     * @throws PaymentRejectedException if a precondition fails
     */
    public LedgerEntry apply(LedgerEntry entry, Payment payment) {
        Money remaining = entry.getRemainingAmount();

        if (!entry.isBalanceTracking()) {
            throw reject(entry, PaymentRejectionReason.NOT_BALANCE_TRACKED,
                String.format("%s entries do not accept payments", entry.getUnderlyingKind()));
        }
        if (entry.getStatus().isClosed()) {
            throw reject(entry, PaymentRejectionReason.ENTRY_CLOSED,
                String.format("Entry %s is %s and accepts no further payments", entry.getId(), entry.getStatus()));
        }
        if (payment.getAmount() == null || !payment.getAmount().isPositive()) {
            throw reject(entry, PaymentRejectionReason.INVALID_AMOUNT,
                "Payment amount must be greater than zero");
        }
        if (payment.getAmount().exceeds(remaining)) {
            throw reject(entry, PaymentRejectionReason.EXCEEDS_REMAINING_BALANCE,
                String.format("Payment of %s exceeds the remaining balance of %s", payment.getAmount(), remaining));
        }
        if (payment.isCheque() && isBlank(payment.getChequeNumber())) {
            throw reject(entry, PaymentRejectionReason.MISSING_CHEQUE_NUMBER,
                "Cheque number is required for cheque payments");
        }
        if (payment.isCheque() && isBlank(payment.getBankName())) {
            throw reject(entry, PaymentRejectionReason.MISSING_BANK_NAME,
                "Bank name is required for cheque payments");
        }

        Money newRemaining = remaining.minus(payment.getAmount());
        if (newRemaining.isNegligible() || newRemaining.isNegative()) {
            newRemaining = Money.ZERO;
        }

        return entry.toBuilder()
            .transaction(payment)
            .remainingAmount(newRemaining)
            .status(statusAfterPayment(entry, newRemaining))
            .build();
    }

    static EntryStatus statusAfterPayment(LedgerEntry entry, Money newRemaining) {
        if (newRemaining.isBelowEpsilon()) {
            return EntryStatus.completedFor(entry.getUnderlyingKind());
        }
        return LedgerConsistencyRepair.statusForOutstanding(newRemaining, entry.getTotalAmount());
    }

    private PaymentRejectedException reject(LedgerEntry entry, PaymentRejectionReason reason, String message) {
        return new PaymentRejectedException(entry.getId(), reason, entry.getRemainingAmount(), message);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
