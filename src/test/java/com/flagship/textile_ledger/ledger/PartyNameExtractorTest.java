package com.flagship.textile_ledger.ledger;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class PartyNameExtractorTest {

    @Test
    @DisplayName("Vendor name stops at the dash")
    void extractsVendorBeforeDash() {
        assertEquals(Optional.of("Acme Textiles"),
            PartyNameExtractor.extract("Vendor: Acme Textiles - khata:1", PartyNameExtractor.VENDOR_LABEL));
    }

    @Test
    @DisplayName("Customer name stops at a newline")
    void extractsCustomerBeforeNewline() {
        assertEquals(Optional.of("Bilal Traders"),
            PartyNameExtractor.extract("Customer: Bilal Traders\nsecond line", PartyNameExtractor.CUSTOMER_LABEL));
    }

    @Test
    @DisplayName("Name runs to the end of the text when nothing terminates it")
    void extractsToEnd() {
        assertEquals(Optional.of("Noor Mills"),
            PartyNameExtractor.extract("Opening balance. Vendor:   Noor Mills  ", PartyNameExtractor.VENDOR_LABEL));
    }

    @Test
    @DisplayName("Missing label, empty value and null text yield nothing")
    void emptyCases() {
        assertTrue(PartyNameExtractor.extract("no label here", PartyNameExtractor.VENDOR_LABEL).isEmpty());
        assertTrue(PartyNameExtractor.extract("Vendor:  - khata:2", PartyNameExtractor.VENDOR_LABEL).isEmpty());
        assertTrue(PartyNameExtractor.extract(null, PartyNameExtractor.VENDOR_LABEL).isEmpty());
        assertTrue(PartyNameExtractor.extract("Vendor: Acme", PartyNameExtractor.CUSTOMER_LABEL).isEmpty());
    }
}
