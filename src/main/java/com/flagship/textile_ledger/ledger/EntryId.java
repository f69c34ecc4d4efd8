package com.flagship.textile_ledger.ledger;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Value;

import java.util.Objects;

/**
 * Identifier of a ledger entry: the originating record kind plus its row id.
 *
 * The textual {@code kind:rowId} form (e.g. {@code bill:123}) exists only at the
 * HTTP edge; everything behind it works with the typed pair.
 */
@Value
public class EntryId {
    UnderlyingKind kind;
    long rowId;

    private EntryId(UnderlyingKind kind, long rowId) {
        this.kind = Objects.requireNonNull(kind, "kind");
        if (rowId <= 0) {
            throw new IllegalArgumentException("Row id must be positive: " + rowId);
        }
        this.rowId = rowId;
    }

    public static EntryId of(UnderlyingKind kind, long rowId) {
        return new EntryId(kind, rowId);
    }

    /**
     * Parses the {@code kind:rowId} form.
     *
     * @throws IllegalArgumentException if the text is not a well-formed entry id
     */
    public static EntryId parse(String text) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("Entry id is required");
        }
        int separator = text.indexOf(':');
        if (separator <= 0 || separator != text.lastIndexOf(':') || separator == text.length() - 1) {
            throw new IllegalArgumentException("Malformed entry id: " + text);
        }
        UnderlyingKind kind = UnderlyingKind.fromTag(text.substring(0, separator))
            .orElseThrow(() -> new IllegalArgumentException("Unknown entry kind in id: " + text));
        long rowId;
        try {
            rowId = Long.parseLong(text.substring(separator + 1).trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Malformed entry id: " + text, e);
        }
        return new EntryId(kind, rowId);
    }

    @JsonValue
    @Override
    public String toString() {
        return kind.tag() + ":" + rowId;
    }
}
