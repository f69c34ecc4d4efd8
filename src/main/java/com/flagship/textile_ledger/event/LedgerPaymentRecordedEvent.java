package com.flagship.textile_ledger.event;

import com.flagship.textile_ledger.ledger.LedgerEntry;
import com.flagship.textile_ledger.ledger.Payment;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * Published when a payment has been applied to a payable, receivable or bill.
 */
@Value
public class LedgerPaymentRecordedEvent implements LedgerEvent {
    UUID eventId;
    String entryId;
    String category;
    String party;
    Long paymentId;
    BigDecimal amount;
    String paymentMode;
    LocalDate transactionDate;
    BigDecimal remainingAmount;
    String status;
    Instant occurredAt;

    public static final String EVENT_TYPE = "LedgerPaymentRecorded";
    public static final String AGGREGATE_TYPE = "LedgerEntry";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    @Override
    public String getAggregateType() {
        return AGGREGATE_TYPE;
    }

    @Override
    public String getAggregateId() {
        return entryId;
    }

    public static LedgerPaymentRecordedEvent of(LedgerEntry updated, Payment payment) {
        return new LedgerPaymentRecordedEvent(
            UUID.randomUUID(),
            updated.getId().toString(),
            updated.getCategory().name(),
            updated.getParty(),
            payment.getId(),
            payment.getAmount().toBigDecimal(),
            payment.getPaymentMode().name(),
            payment.getTransactionDate(),
            updated.getRemainingAmount().toBigDecimal(),
            updated.getStatus().name(),
            Instant.now()
        );
    }
}
