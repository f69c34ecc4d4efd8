package com.flagship.textile_ledger.ledger.dto;

import com.flagship.textile_ledger.ledger.Payment;
import com.flagship.textile_ledger.ledger.PaymentMode;
import com.flagship.textile_ledger.money.Money;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Body of {@code POST /api/ledger/{id}/payments}.
 *
 * Amount sign and cheque details are checked by the domain so that their
 * rejections carry a reason and the remaining balance.
 */
@Value
@Builder
@Jacksonized
public class RecordPaymentRequest {

    @NotNull(message = "Amount is required")
    BigDecimal amount;

    @NotNull(message = "Payment mode is required")
    PaymentMode paymentMode;

    @Size(max = 50)
    String chequeNumber;

    @Size(max = 100)
    String bankName;

    LocalDate transactionDate;

    @Size(max = 100)
    String referenceNumber;

    String notes;

    public Payment toPayment(LocalDate today) {
        return Payment.builder()
            .amount(Money.of(amount))
            .paymentMode(paymentMode)
            .chequeNumber(chequeNumber)
            .bankName(bankName)
            .transactionDate(transactionDate != null ? transactionDate : today)
            .referenceNumber(referenceNumber)
            .notes(notes)
            .build();
    }
}
