package com.flagship.textile_ledger.ledger;

import java.util.Optional;

/**
 * Best-effort extraction of a counter-party name from free-text notes.
 *
 * Manual entries written before parties were linked stored the name inline as
 * {@code "Vendor: Acme Textiles - khata:1"}. This parser recovers it. It is a
 * workaround for that data, not a substitute for a party reference.
 *
 * The value after the label runs until a hyphen, a line break, or the end of the
 * text. Whitespace does not terminate it because names contain spaces.
 */
public final class PartyNameExtractor {

    public static final String VENDOR_LABEL = "Vendor:";
    public static final String CUSTOMER_LABEL = "Customer:";

    private PartyNameExtractor() {
    }

    /**
     * Finds the value following {@code label} in {@code text}.
     *
     * @return the trimmed name, or empty if the label is absent or has no value
     */
    public static Optional<String> extract(String text, String label) {
        if (text == null || label == null || text.isEmpty()) {
            return Optional.empty();
        }
        int labelStart = text.indexOf(label);
        if (labelStart < 0) {
            return Optional.empty();
        }
        int valueStart = labelStart + label.length();
        int valueEnd = text.length();
        for (int i = valueStart; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '-' || c == '\n' || c == '\r') {
                valueEnd = i;
                break;
            }
        }
        String value = text.substring(valueStart, valueEnd).trim();
        return value.isEmpty() ? Optional.empty() : Optional.of(value);
    }
}
