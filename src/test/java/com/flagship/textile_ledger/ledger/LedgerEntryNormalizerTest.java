package com.flagship.textile_ledger.ledger;

import com.flagship.textile_ledger.money.Money;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;

class LedgerEntryNormalizerTest {

    private final LedgerEntryNormalizer normalizer = new LedgerEntryNormalizer();

    private static RawLedgerRecord.RawLedgerRecordBuilder bill(String direction) {
        return RawLedgerRecord.builder()
            .kind(UnderlyingKind.BILL)
            .rowId(12)
            .direction(direction)
            .reference("B-0012")
            .totalAmount(new BigDecimal("500.00"))
            .paidAmount(new BigDecimal("200.00"))
            .status("PARTIAL");
    }

    @Nested
    @DisplayName("Category derivation")
    class Category {

        @Test
        @DisplayName("SALE bill is a receivable")
        void saleBillIsReceivable() {
            assertEquals(EntryCategory.RECEIVABLE, normalizer.normalize(bill("SALE").build()).getCategory());
        }

        @Test
        @DisplayName("PURCHASE bill is a payable")
        void purchaseBillIsPayable() {
            assertEquals(EntryCategory.PAYABLE, normalizer.normalize(bill("purchase").build()).getCategory());
        }

        @Test
        @DisplayName("EXPENSE and unknown directions stay in the bill category")
        void otherDirectionsStayBills() {
            assertEquals(EntryCategory.BILL, normalizer.normalize(bill("EXPENSE").build()).getCategory());
            assertEquals(EntryCategory.BILL, normalizer.normalize(bill("barter").build()).getCategory());
            assertEquals(EntryCategory.BILL, normalizer.normalize(bill(null).build()).getCategory());
        }

        @Test
        @DisplayName("Every other kind maps to its own category")
        void fixedCategories() {
            assertEquals(EntryCategory.PAYABLE,
                LedgerEntryNormalizer.deriveCategory(UnderlyingKind.MANUAL_PAYABLE, null));
            assertEquals(EntryCategory.RECEIVABLE,
                LedgerEntryNormalizer.deriveCategory(UnderlyingKind.MANUAL_RECEIVABLE, null));
            assertEquals(EntryCategory.CHEQUE, LedgerEntryNormalizer.deriveCategory(UnderlyingKind.CHEQUE, null));
            assertEquals(EntryCategory.BANK, LedgerEntryNormalizer.deriveCategory(UnderlyingKind.BANK_TXN, null));
            assertEquals(EntryCategory.INVENTORY,
                LedgerEntryNormalizer.deriveCategory(UnderlyingKind.INVENTORY_VALUATION, null));
        }
    }

    @Nested
    @DisplayName("Amounts and status")
    class Amounts {

        @Test
        @DisplayName("Bill remaining is total minus paid")
        void billRemainingFromPaid() {
            LedgerEntry entry = normalizer.normalize(bill("SALE").build());

            assertEquals(Money.of("500.00"), entry.getTotalAmount());
            assertEquals(Money.of("300.00"), entry.getRemainingAmount());
            assertEquals(Money.of("200.00"), entry.getPaidAmount());
            assertEquals(EntryStatus.PARTIAL, entry.getStatus());
            assertEquals(EntryId.of(UnderlyingKind.BILL, 12), entry.getId());
        }

        @Test
        @DisplayName("Explicit remaining wins over the paid amount")
        void explicitRemaining() {
            LedgerEntry entry = normalizer.normalize(RawLedgerRecord.builder()
                .kind(UnderlyingKind.MANUAL_PAYABLE)
                .rowId(3)
                .totalAmount(new BigDecimal("80"))
                .remainingAmount(new BigDecimal("30"))
                .build());

            assertEquals(Money.of("30.00"), entry.getRemainingAmount());
        }

        @Test
        @DisplayName("Overpaid bill keeps its negative remaining for the repair step to report")
        void negativeRemainingIsLeftForRepair() {
            LedgerEntry entry = normalizer.normalize(bill("PURCHASE").paidAmount(new BigDecimal("650")).build());

            assertEquals(Money.of("-150.00"), entry.getRemainingAmount());
        }

        @Test
        @DisplayName("Unknown status text degrades to PENDING for balance-tracking kinds")
        void unknownStatusDegrades() {
            assertEquals(EntryStatus.PENDING, normalizer.normalize(bill("SALE").status("weird").build()).getStatus());
            assertEquals(EntryStatus.PENDING, normalizer.normalize(bill("SALE").status("CLEARED").build()).getStatus());
        }

        @Test
        @DisplayName("Non balance-tracking kinds carry no remaining balance")
        void bankTransactionHasNoBalance() {
            LedgerEntry entry = normalizer.normalize(RawLedgerRecord.builder()
                .kind(UnderlyingKind.BANK_TXN)
                .rowId(4)
                .totalAmount(new BigDecimal("1200"))
                .build());

            assertEquals(Money.ZERO, entry.getRemainingAmount());
            assertEquals(EntryStatus.COMPLETED, entry.getStatus());
            assertEquals("Bank transaction 4", entry.getDescription());
        }

        @Test
        @DisplayName("Missing amounts become zero instead of failing")
        void missingAmountsBecomeZero() {
            LedgerEntry entry = normalizer.normalize(RawLedgerRecord.builder()
                .kind(UnderlyingKind.CHEQUE)
                .rowId(9)
                .reference("000123")
                .build());

            assertEquals(Money.ZERO, entry.getTotalAmount());
            assertEquals(EntryStatus.PENDING, entry.getStatus());
            assertEquals("Cheque #000123", entry.getDescription());
            assertTrue(entry.getTransactions().isEmpty());
        }
    }

    @Nested
    @DisplayName("Party resolution")
    class Party {

        @Test
        @DisplayName("Linked party wins over everything else")
        void linkedPartyFirst() {
            LedgerEntry entry = normalizer.normalize(bill("PURCHASE")
                .linkedPartyName("Linked Co")
                .manualPartyName("Typed Co")
                .notes("Vendor: Noted Co")
                .build());

            assertEquals("Linked Co", entry.getParty());
        }

        @Test
        @DisplayName("Manual name is used when no party is linked")
        void manualPartySecond() {
            LedgerEntry entry = normalizer.normalize(bill("PURCHASE")
                .manualPartyName("  Typed Co ")
                .notes("Vendor: Noted Co")
                .build());

            assertEquals("Typed Co", entry.getParty());
        }

        @Test
        @DisplayName("Vendor label in the notes names the party of a payable")
        void vendorFromNotes() {
            LedgerEntry entry = normalizer.normalize(RawLedgerRecord.builder()
                .kind(UnderlyingKind.MANUAL_PAYABLE)
                .rowId(1)
                .totalAmount(new BigDecimal("100"))
                .notes("Vendor: Acme Textiles - khata:1")
                .build());

            assertEquals("Acme Textiles", entry.getParty());
        }

        @Test
        @DisplayName("Customer label in the reference names the party of a receivable")
        void customerFromReference() {
            LedgerEntry entry = normalizer.normalize(RawLedgerRecord.builder()
                .kind(UnderlyingKind.MANUAL_RECEIVABLE)
                .rowId(2)
                .totalAmount(new BigDecimal("100"))
                .reference("Customer: Zain Garments")
                .build());

            assertEquals("Zain Garments", entry.getParty());
        }

        @Test
        @DisplayName("Sentinels fill in when nothing names the party")
        void sentinels() {
            LedgerEntry payable = normalizer.normalize(RawLedgerRecord.builder()
                .kind(UnderlyingKind.MANUAL_PAYABLE).rowId(1).totalAmount(BigDecimal.TEN).build());
            LedgerEntry receivable = normalizer.normalize(RawLedgerRecord.builder()
                .kind(UnderlyingKind.MANUAL_RECEIVABLE).rowId(2).totalAmount(BigDecimal.TEN).build());
            LedgerEntry bank = normalizer.normalize(RawLedgerRecord.builder()
                .kind(UnderlyingKind.BANK_TXN).rowId(3).totalAmount(BigDecimal.TEN).build());

            assertEquals(LedgerEntryNormalizer.VENDOR_SENTINEL, payable.getParty());
            assertEquals(LedgerEntryNormalizer.CUSTOMER_SENTINEL, receivable.getParty());
            assertEquals(LedgerEntryNormalizer.UNKNOWN_PARTY, bank.getParty());
        }
    }

    @Nested
    @DisplayName("Sparse records")
    class Sparse {

        @ParameterizedTest
        @EnumSource(UnderlyingKind.class)
        @DisplayName("A record carrying only its identity still normalizes")
        void identityOnly(UnderlyingKind kind) {
            LedgerEntry entry = assertDoesNotThrow(() -> normalizer.normalize(RawLedgerRecord.builder()
                .kind(kind).rowId(9).build()));

            assertEquals(EntryId.of(kind, 9), entry.getId());
            assertNotNull(entry.getParty());
            assertNotNull(entry.getStatus());
            assertTrue(entry.getTransactions().isEmpty());
        }

        @Test
        @DisplayName("A record without row id or kind cannot be built")
        void identityIsRequired() {
            assertThrows(IllegalArgumentException.class, () -> RawLedgerRecord.builder()
                .kind(UnderlyingKind.MANUAL_PAYABLE).build());
            assertThrows(NullPointerException.class, () -> RawLedgerRecord.builder()
                .rowId(4).build());
        }
    }
}
