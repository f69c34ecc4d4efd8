package com.flagship.textile_ledger.ledger.dto;

import com.flagship.textile_ledger.ledger.Payment;
import com.flagship.textile_ledger.ledger.PaymentMode;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;

@Value
@Builder
public class PaymentResponse {
    Long id;
    BigDecimal amount;
    PaymentMode paymentMode;
    String chequeNumber;
    String bankName;
    LocalDate transactionDate;
    String referenceNumber;
    String notes;

    public static PaymentResponse from(Payment payment) {
        return PaymentResponse.builder()
            .id(payment.getId())
            .amount(payment.getAmount().toBigDecimal())
            .paymentMode(payment.getPaymentMode())
            .chequeNumber(payment.getChequeNumber())
            .bankName(payment.getBankName())
            .transactionDate(payment.getTransactionDate())
            .referenceNumber(payment.getReferenceNumber())
            .notes(payment.getNotes())
            .build();
    }
}
