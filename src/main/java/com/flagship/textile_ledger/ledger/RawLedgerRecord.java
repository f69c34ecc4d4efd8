package com.flagship.textile_ledger.ledger;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Objects;

/**
 * A source row as read from the store, before normalization.
 *
 * Fields are as loose as the tables they come from: any of them may be null.
 * Bills carry {@code paidAmount}; manual entries carry {@code remainingAmount}.
 * The exceptions are {@code kind} and {@code rowId}: they identify the row, and a
 * record without them cannot be built.
 */
@Value
public class RawLedgerRecord {
    UnderlyingKind kind;
    long rowId;
    String direction;
    String description;
    String reference;
    BigDecimal totalAmount;
    BigDecimal paidAmount;
    BigDecimal remainingAmount;
    String status;
    String linkedPartyName;
    String manualPartyName;
    String notes;
    Long khataId;
    LocalDate entryDate;
    LocalDate dueDate;
    List<Payment> payments;

    @Builder(toBuilder = true)
    private RawLedgerRecord(UnderlyingKind kind, long rowId, String direction, String description,
                            String reference, BigDecimal totalAmount, BigDecimal paidAmount,
                            BigDecimal remainingAmount, String status, String linkedPartyName,
                            String manualPartyName, String notes, Long khataId, LocalDate entryDate,
                            LocalDate dueDate, List<Payment> payments) {
        this.kind = Objects.requireNonNull(kind, "kind");
        if (rowId <= 0) {
            throw new IllegalArgumentException("Row id must be positive: " + rowId);
        }
        this.rowId = rowId;
        this.direction = direction;
        this.description = description;
        this.reference = reference;
        this.totalAmount = totalAmount;
        this.paidAmount = paidAmount;
        this.remainingAmount = remainingAmount;
        this.status = status;
        this.linkedPartyName = linkedPartyName;
        this.manualPartyName = manualPartyName;
        this.notes = notes;
        this.khataId = khataId;
        this.entryDate = entryDate;
        this.dueDate = dueDate;
        this.payments = payments;
    }
}
