package com.flagship.textile_ledger.ledger;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * The record type a ledger entry originates from.
 * The tag is the prefix used in the textual form of an {@link EntryId}.
 */
public enum UnderlyingKind {
    BILL("bill", true),
    MANUAL_PAYABLE("payable", true),
    MANUAL_RECEIVABLE("receivable", true),
    CHEQUE("cheque", false),
    BANK_TXN("bank", false),
    INVENTORY_VALUATION("inventory", false);

    private final String tag;
    private final boolean balanceTracking;

    UnderlyingKind(String tag, boolean balanceTracking) {
        this.tag = tag;
        this.balanceTracking = balanceTracking;
    }

    public String tag() {
        return tag;
    }

    /**
     * Whether entries of this kind carry a remaining balance that payments reduce.
     */
    public boolean isBalanceTracking() {
        return balanceTracking;
    }

    public static Optional<UnderlyingKind> fromTag(String tag) {
        if (tag == null) {
            return Optional.empty();
        }
        String normalized = tag.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
            .filter(kind -> kind.tag.equals(normalized))
            .findFirst();
    }
}
