package com.flagship.textile_ledger.ledger;

import java.util.Locale;

/**
 * Direction of the trade a bill records.
 */
public enum BillDirection {
    PURCHASE,
    SALE,
    EXPENSE,
    INCOME,
    OTHER;

    /**
     * Lenient parse used on store data. Unknown or missing text maps to OTHER.
     */
    public static BillDirection parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return OTHER;
        }
        try {
            return valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return OTHER;
        }
    }
}
