package com.flagship.textile_ledger.ledger;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

class EntryIdTest {

    @Test
    @DisplayName("Parses kind tag and row id")
    void parsesTextForm() {
        EntryId id = EntryId.parse("bill:123");

        assertEquals(UnderlyingKind.BILL, id.getKind());
        assertEquals(123L, id.getRowId());
        assertEquals("bill:123", id.toString());
        assertEquals(EntryId.of(UnderlyingKind.MANUAL_PAYABLE, 4), EntryId.parse("Payable:4"));
    }

    @ParameterizedTest
    @DisplayName("Malformed ids are rejected")
    @ValueSource(strings = {"", "bill", "bill:", ":12", "bill:12:3", "invoice:12", "bill:abc", "bill:0", "bill:-4"})
    void rejectsMalformed(String text) {
        assertThrows(IllegalArgumentException.class, () -> EntryId.parse(text));
    }
}
