package com.flagship.textile_ledger.ledger;

import com.flagship.textile_ledger.money.Money;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Payment preconditions and the balance/status arithmetic that follows a payment.
 */
class PaymentRecorderTest {

    private final PaymentRecorder recorder = new PaymentRecorder();

    private static LedgerEntry openBill(String total, String remaining, EntryStatus status) {
        return LedgerEntry.builder()
            .id(EntryId.of(UnderlyingKind.BILL, 7))
            .category(EntryCategory.PAYABLE)
            .underlyingKind(UnderlyingKind.BILL)
            .direction(BillDirection.PURCHASE)
            .totalAmount(Money.of(total))
            .remainingAmount(Money.of(remaining))
            .status(status)
            .party("Acme Textiles")
            .build();
    }

    private static Payment cash(String amount) {
        return Payment.builder()
            .amount(Money.of(amount))
            .paymentMode(PaymentMode.CASH)
            .transactionDate(LocalDate.of(2024, 3, 1))
            .build();
    }

    private static PaymentRejectionReason rejectionOf(LedgerEntry entry, Payment payment, PaymentRecorder recorder) {
        PaymentRejectedException e = assertThrows(PaymentRejectedException.class,
            () -> recorder.apply(entry, payment));
        assertEquals(entry.getId(), e.getEntryId());
        assertEquals(entry.getRemainingAmount(), e.getRemainingBalance());
        return e.getReason();
    }

    @Test
    @DisplayName("Partial payment reduces the balance and marks the entry PARTIAL")
    void partialPayment() {
        LedgerEntry updated = recorder.apply(openBill("100.00", "100.00", EntryStatus.PENDING), cash("40.00"));

        assertEquals(Money.of("60.00"), updated.getRemainingAmount());
        assertEquals(EntryStatus.PARTIAL, updated.getStatus());
        assertEquals(1, updated.getTransactions().size());
        assertEquals(Money.of("40.00"), updated.getPaidAmount());
    }

    @Test
    @DisplayName("Paying the full balance settles a bill as PAID")
    void fullPaymentOnBill() {
        LedgerEntry updated = recorder.apply(openBill("100.00", "60.00", EntryStatus.PARTIAL), cash("60.00"));

        assertEquals(Money.ZERO, updated.getRemainingAmount());
        assertEquals(EntryStatus.PAID, updated.getStatus());
    }

    @Test
    @DisplayName("Paying the full balance settles a manual entry as COMPLETED")
    void fullPaymentOnManualEntry() {
        LedgerEntry receivable = openBill("250.00", "250.00", EntryStatus.PENDING).toBuilder()
            .id(EntryId.of(UnderlyingKind.MANUAL_RECEIVABLE, 3))
            .underlyingKind(UnderlyingKind.MANUAL_RECEIVABLE)
            .category(EntryCategory.RECEIVABLE)
            .direction(null)
            .build();

        LedgerEntry updated = recorder.apply(receivable, cash("250.00"));

        assertEquals(EntryStatus.COMPLETED, updated.getStatus());
    }

    @Test
    @DisplayName("Existing transactions are kept and the new payment is appended")
    void appendsTransaction() {
        Payment earlier = cash("10.00").toBuilder().id(1L).build();
        LedgerEntry entry = openBill("100.00", "90.00", EntryStatus.PARTIAL).toBuilder().transaction(earlier).build();
        Payment next = cash("20.00");

        LedgerEntry updated = recorder.apply(entry, next);

        assertEquals(2, updated.getTransactions().size());
        assertSame(earlier, updated.getTransactions().get(0));
        assertSame(next, updated.getTransactions().get(1));
    }

    @Test
    @DisplayName("Amount over the remaining balance is rejected")
    void rejectsOverpayment() {
        assertEquals(PaymentRejectionReason.EXCEEDS_REMAINING_BALANCE,
            rejectionOf(openBill("100.00", "100.00", EntryStatus.PENDING), cash("100.01"), recorder));
    }

    @Test
    @DisplayName("Amount equal to the remaining balance is accepted")
    void acceptsExactBalance() {
        LedgerEntry updated = recorder.apply(openBill("100.00", "100.00", EntryStatus.PENDING), cash("100.00"));

        assertEquals(EntryStatus.PAID, updated.getStatus());
    }

    @Test
    @DisplayName("Zero and negative amounts are rejected")
    void rejectsNonPositiveAmount() {
        LedgerEntry entry = openBill("100.00", "100.00", EntryStatus.PENDING);

        assertEquals(PaymentRejectionReason.INVALID_AMOUNT, rejectionOf(entry, cash("0.00"), recorder));
        assertEquals(PaymentRejectionReason.INVALID_AMOUNT, rejectionOf(entry, cash("-5.00"), recorder));
    }

    @Test
    @DisplayName("Closed entries accept no further payments")
    void rejectsClosedEntry() {
        assertEquals(PaymentRejectionReason.ENTRY_CLOSED,
            rejectionOf(openBill("100.00", "0.00", EntryStatus.PAID), cash("1.00"), recorder));
        assertEquals(PaymentRejectionReason.ENTRY_CLOSED,
            rejectionOf(openBill("100.00", "100.00", EntryStatus.CANCELLED), cash("1.00"), recorder));
    }

    @Test
    @DisplayName("Cheque payments need a cheque number and a bank name")
    void chequeDetailsRequired() {
        LedgerEntry entry = openBill("100.00", "100.00", EntryStatus.PENDING);
        Payment noNumber = cash("50.00").toBuilder().paymentMode(PaymentMode.CHEQUE).bankName("HBL").build();
        Payment noBank = cash("50.00").toBuilder().paymentMode(PaymentMode.CHEQUE).chequeNumber("000451").build();
        Payment complete = noBank.toBuilder().bankName("HBL").build();

        assertEquals(PaymentRejectionReason.MISSING_CHEQUE_NUMBER, rejectionOf(entry, noNumber, recorder));
        assertEquals(PaymentRejectionReason.MISSING_BANK_NAME, rejectionOf(entry, noBank, recorder));
        assertEquals(EntryStatus.PARTIAL, recorder.apply(entry, complete).getStatus());
    }

    @Test
    @DisplayName("Entries without a balance do not accept payments")
    void rejectsNonBalanceKind() {
        LedgerEntry cheque = openBill("100.00", "0.00", EntryStatus.PENDING).toBuilder()
            .id(EntryId.of(UnderlyingKind.CHEQUE, 2))
            .underlyingKind(UnderlyingKind.CHEQUE)
            .category(EntryCategory.CHEQUE)
            .build();

        assertEquals(PaymentRejectionReason.NOT_BALANCE_TRACKED, rejectionOf(cheque, cash("10.00"), recorder));
    }

    @Test
    @DisplayName("Overpayment is checked before cheque details")
    void preconditionOrder() {
        Payment chequeWithoutDetails = cash("500.00").toBuilder().paymentMode(PaymentMode.CHEQUE).build();

        assertEquals(PaymentRejectionReason.EXCEEDS_REMAINING_BALANCE,
            rejectionOf(openBill("100.00", "100.00", EntryStatus.PENDING), chequeWithoutDetails, recorder));
    }
}
