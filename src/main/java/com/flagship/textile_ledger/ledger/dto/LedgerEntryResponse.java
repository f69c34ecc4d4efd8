package com.flagship.textile_ledger.ledger.dto;

import com.flagship.textile_ledger.ledger.BillDirection;
import com.flagship.textile_ledger.ledger.EntryCategory;
import com.flagship.textile_ledger.ledger.EntryStatus;
import com.flagship.textile_ledger.ledger.LedgerEntry;
import com.flagship.textile_ledger.ledger.RepairAction;
import com.flagship.textile_ledger.ledger.RepairReport;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

@Value
@Builder
public class LedgerEntryResponse {
    String id;
    EntryCategory category;
    String underlyingKind;
    BillDirection direction;
    String description;
    String reference;
    BigDecimal totalAmount;
    BigDecimal paidAmount;
    BigDecimal remainingAmount;
    EntryStatus status;
    String party;
    Long khataId;
    LocalDate entryDate;
    LocalDate dueDate;
    String notes;
    List<PaymentResponse> transactions;
    /** Corrections applied when the entry was read; empty when the stored row was consistent. */
    List<RepairAction> repairs;

    public static LedgerEntryResponse from(RepairReport report) {
        return from(report.getEntry(), report.getActions());
    }

    public static LedgerEntryResponse from(LedgerEntry entry, List<RepairAction> repairs) {
        return LedgerEntryResponse.builder()
            .id(entry.getId().toString())
            .category(entry.getCategory())
            .underlyingKind(entry.getUnderlyingKind().tag())
            .direction(entry.getDirection())
            .description(entry.getDescription())
            .reference(entry.getReference())
            .totalAmount(entry.getTotalAmount().toBigDecimal())
            .paidAmount(entry.isBalanceTracking() ? entry.getPaidAmount().toBigDecimal() : null)
            .remainingAmount(entry.getRemainingAmount().toBigDecimal())
            .status(entry.getStatus())
            .party(entry.getParty())
            .khataId(entry.getKhataId())
            .entryDate(entry.getEntryDate())
            .dueDate(entry.getDueDate())
            .notes(entry.getNotes())
            .transactions(entry.getTransactions().stream().map(PaymentResponse::from).toList())
            .repairs(repairs)
            .build();
    }
}
