package com.flagship.textile_ledger.ledger;

import com.flagship.textile_ledger.money.Money;
import org.springframework.stereotype.Component;

import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Maps raw source rows of every kind onto the canonical {@link LedgerEntry}.
 *
 * Pure and total: missing or malformed fields degrade to defaults and sentinels,
 * never to an exception. Invariant violations in the amounts are left for
 * {@link LedgerConsistencyRepair} so they get logged.
 */
@Component
public class LedgerEntryNormalizer {

    public static final String VENDOR_SENTINEL = "Manual Vendor";
    public static final String CUSTOMER_SENTINEL = "Manual Customer";
    public static final String UNKNOWN_PARTY = "Unknown";

    private static final Set<EntryStatus> BALANCE_STATUSES = EnumSet.of(
        EntryStatus.PENDING, EntryStatus.PARTIAL, EntryStatus.COMPLETED,
        EntryStatus.PAID, EntryStatus.CANCELLED);

    private static final Set<EntryStatus> CHEQUE_STATUSES = EnumSet.of(
        EntryStatus.PENDING, EntryStatus.CLEARED, EntryStatus.BOUNCED,
        EntryStatus.REPLACED, EntryStatus.CANCELLED);

    public LedgerEntry normalize(RawLedgerRecord raw) {
        UnderlyingKind kind = raw.getKind();
        BillDirection direction = kind == UnderlyingKind.BILL ? BillDirection.parse(raw.getDirection()) : null;
        EntryCategory category = deriveCategory(kind, direction);
        Money total = Money.ofNullable(raw.getTotalAmount());

        return LedgerEntry.builder()
            .id(EntryId.of(kind, raw.getRowId()))
            .category(category)
            .underlyingKind(kind)
            .direction(direction)
            .description(describe(raw))
            .reference(raw.getReference())
            .totalAmount(total)
            .remainingAmount(deriveRemaining(kind, total, raw))
            .status(deriveStatus(kind, raw.getStatus()))
            .party(resolveParty(category, raw))
            .khataId(raw.getKhataId())
            .entryDate(raw.getEntryDate())
            .dueDate(raw.getDueDate())
            .notes(raw.getNotes())
            .transactions(raw.getPayments() == null ? List.of() : raw.getPayments())
            .build();
    }

    /**
     * Category rule: manual entries are fixed, bills follow their direction, anything
     * a bill direction does not decide passes the raw kind through.
     */
    static EntryCategory deriveCategory(UnderlyingKind kind, BillDirection direction) {
        return switch (kind) {
            case MANUAL_PAYABLE -> EntryCategory.PAYABLE;
            case MANUAL_RECEIVABLE -> EntryCategory.RECEIVABLE;
            case BILL -> switch (direction == null ? BillDirection.OTHER : direction) {
                case SALE -> EntryCategory.RECEIVABLE;
                case PURCHASE -> EntryCategory.PAYABLE;
                default -> EntryCategory.BILL;
            };
            case CHEQUE -> EntryCategory.CHEQUE;
            case BANK_TXN -> EntryCategory.BANK;
            case INVENTORY_VALUATION -> EntryCategory.INVENTORY;
        };
    }

    private Money deriveRemaining(UnderlyingKind kind, Money total, RawLedgerRecord raw) {
        if (!kind.isBalanceTracking()) {
            return Money.ZERO;
        }
        if (raw.getRemainingAmount() != null) {
            return Money.of(raw.getRemainingAmount());
        }
        return total.minus(Money.ofNullable(raw.getPaidAmount()));
    }

    private EntryStatus deriveStatus(UnderlyingKind kind, String rawStatus) {
        Optional<EntryStatus> parsed = EntryStatus.parse(rawStatus);
        if (kind.isBalanceTracking()) {
            return parsed.filter(BALANCE_STATUSES::contains).orElse(EntryStatus.PENDING);
        }
        if (kind == UnderlyingKind.CHEQUE) {
            return parsed.filter(CHEQUE_STATUSES::contains).orElse(EntryStatus.PENDING);
        }
        return parsed.orElse(EntryStatus.COMPLETED);
    }

    /**
     * Linked party, then the manually typed name, then a labelled token in the notes
     * or reference, then a sentinel for the entry's role.
     */
    String resolveParty(EntryCategory category, RawLedgerRecord raw) {
        if (hasText(raw.getLinkedPartyName())) {
            return raw.getLinkedPartyName().trim();
        }
        if (hasText(raw.getManualPartyName())) {
            return raw.getManualPartyName().trim();
        }
        return switch (category) {
            case PAYABLE -> fromText(raw, PartyNameExtractor.VENDOR_LABEL).orElse(VENDOR_SENTINEL);
            case RECEIVABLE -> fromText(raw, PartyNameExtractor.CUSTOMER_LABEL).orElse(CUSTOMER_SENTINEL);
            default -> fromText(raw, PartyNameExtractor.VENDOR_LABEL)
                .or(() -> fromText(raw, PartyNameExtractor.CUSTOMER_LABEL))
                .orElse(UNKNOWN_PARTY);
        };
    }

    private Optional<String> fromText(RawLedgerRecord raw, String label) {
        return PartyNameExtractor.extract(raw.getNotes(), label)
            .or(() -> PartyNameExtractor.extract(raw.getReference(), label));
    }

    private String describe(RawLedgerRecord raw) {
        if (hasText(raw.getDescription())) {
            return raw.getDescription();
        }
        String reference = hasText(raw.getReference()) ? raw.getReference() : String.valueOf(raw.getRowId());
        return switch (raw.getKind()) {
            case BILL -> "Bill #" + reference;
            case MANUAL_PAYABLE -> "Payable " + reference;
            case MANUAL_RECEIVABLE -> "Receivable " + reference;
            case CHEQUE -> "Cheque #" + reference;
            case BANK_TXN -> "Bank transaction " + reference;
            case INVENTORY_VALUATION -> "Inventory valuation " + reference;
        };
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
