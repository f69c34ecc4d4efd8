package com.flagship.textile_ledger.ledger;

import java.util.Locale;
import java.util.Optional;

/**
 * Status of a ledger entry.
 *
 * Balance-tracking entries use PENDING, PARTIAL, COMPLETED (PAID for bills) and CANCELLED.
 * Cheques use PENDING, CLEARED, BOUNCED, REPLACED and CANCELLED.
 */
public enum EntryStatus {
    PENDING,
    PARTIAL,
    COMPLETED,
    PAID,
    CANCELLED,
    CLEARED,
    BOUNCED,
    REPLACED;

    /**
     * COMPLETED or its bill label PAID.
     */
    public boolean isSettled() {
        return this == COMPLETED || this == PAID;
    }

    /**
     * Terminal for balance tracking: no further payment may be applied.
     */
    public boolean isClosed() {
        return isSettled() || this == CANCELLED;
    }

    /**
     * The completed label used by entries of the given kind.
     */
    public static EntryStatus completedFor(UnderlyingKind kind) {
        return kind == UnderlyingKind.BILL ? PAID : COMPLETED;
    }

    public static Optional<EntryStatus> parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(valueOf(raw.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
