package com.flagship.textile_ledger.ledger;

import com.flagship.textile_ledger.event.LedgerPaymentRecordedEvent;
import com.flagship.textile_ledger.observability.CorrelationContext;
import com.flagship.textile_ledger.observability.LedgerMetrics;
import com.flagship.textile_ledger.outbox.OutboxService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

/**
 * Records payments against payables, receivables and bills.
 *
 * One transaction covers: row lock on the entry, the idempotency-key check,
 * normalize and repair, {@link PaymentRecorder#apply}, the balance update, the payment row and the
 * outbox event. Concurrent payments against the same entry queue on the lock, so
 * the remaining-balance check always sees the latest committed balance.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LedgerPaymentService {

    private final LedgerRecordStore store;
    private final LedgerEntryNormalizer normalizer;
    private final LedgerConsistencyRepair repair;
    private final PaymentRecorder recorder;
    private final IdempotencyService idempotencyService;
    private final OutboxService outboxService;
    private final LedgerMetrics metrics;

    /**
     * @param idempotencyKey optional; a key seen before returns the entry as it is now
     * @throws LedgerEntryNotFoundException if the entry does not exist
     * @throws PaymentRejectedException     if a payment precondition fails
     * @throws IllegalStateException        if the key was used for another entry
     */
    @Transactional
    public PaymentOutcome recordPayment(EntryId entryId, Payment payment, String idempotencyKey) {
        MDC.put(CorrelationContext.ENTRY_ID_MDC_KEY, entryId.toString());
        try {
            LedgerEntry current = store.lockForPayment(entryId)
                .map(normalizer::normalize)
                .map(repair::repair)
                .orElseThrow(() -> new LedgerEntryNotFoundException(entryId));

            // Looked up under the row lock: a concurrent request with the same key
            // has committed its payment row by the time this one gets the lock.
            if (idempotencyKey != null) {
                Optional<EntryId> previous = idempotencyService.findEntryForKey(idempotencyKey);
                if (previous.isPresent()) {
                    return replay(entryId, previous.get(), idempotencyKey, current);
                }
            }

            LedgerEntry applied;
            try {
                applied = recorder.apply(current, payment);
            } catch (PaymentRejectedException e) {
                metrics.recordPaymentRejected(e.getReason().name());
                log.info("Payment rejected: reason={}, amount={}, remaining={}",
                        e.getReason(), payment.getAmount(), e.getRemainingBalance());
                throw e;
            }

            Payment stored = store.insertPayment(entryId, payment, idempotencyKey);
            store.updateBalance(applied);
            LedgerEntry updated = applied.toBuilder()
                .clearTransactions()
                .transactions(current.getTransactions())
                .transaction(stored)
                .build();

            outboxService.saveEvent(LedgerPaymentRecordedEvent.of(updated, stored));
            if (idempotencyKey != null) {
                idempotencyService.remember(idempotencyKey, entryId);
            }

            metrics.recordPaymentRecorded(payment.getPaymentMode().name());
            log.info("Payment recorded: amount={}, mode={}, remaining {} -> {}, status {} -> {}",
                    payment.getAmount(), payment.getPaymentMode(),
                    current.getRemainingAmount(), updated.getRemainingAmount(),
                    current.getStatus(), updated.getStatus());
            return new PaymentOutcome(updated, false);
        } finally {
            MDC.remove(CorrelationContext.ENTRY_ID_MDC_KEY);
        }
    }

    private PaymentOutcome replay(EntryId requested, EntryId previous, String idempotencyKey,
                                  LedgerEntry current) {
        if (!previous.equals(requested)) {
            throw new IllegalStateException(
                "Idempotency key " + idempotencyKey + " was already used for " + previous);
        }
        metrics.recordPaymentReplayed();
        log.info("Idempotency key {} already used, returning current state", idempotencyKey);
        return new PaymentOutcome(current, true);
    }
}
