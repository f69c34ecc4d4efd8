package com.flagship.textile_ledger.ledger;

import com.flagship.textile_ledger.ledger.dto.LedgerEntryResponse;
import com.flagship.textile_ledger.ledger.dto.LedgerListResponse;
import com.flagship.textile_ledger.ledger.dto.RecordPaymentRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;
import java.util.List;

/**
 * Unified ledger over bills, manual payables and receivables, cheques, bank
 * transactions and inventory valuations.
 *
 * Entry ids travel as {@code kind:rowId}, e.g. {@code bill:12}.
 */
@RestController
@RequestMapping("/api/ledger")
@RequiredArgsConstructor
@Slf4j
public class LedgerController {

    private static final String IDEMPOTENCY_KEY_HEADER = "Idempotency-Key";

    private final LedgerQueryService queryService;
    private final LedgerPaymentService paymentService;

    @GetMapping
    public LedgerListResponse list(
            @RequestParam(value = "khataId", required = false) Long khataId,
            @RequestParam(value = "category", required = false) EntryCategory category,
            @RequestParam(value = "asOf", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate asOf) {
        return LedgerListResponse.from(queryService.list(khataId, category, asOf != null ? asOf : LocalDate.now()));
    }

    @GetMapping("/summary")
    public LedgerSummary summary(
            @RequestParam(value = "khataId", required = false) Long khataId,
            @RequestParam(value = "asOf", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate asOf) {
        return queryService.summarize(khataId, asOf != null ? asOf : LocalDate.now());
    }

    @GetMapping("/{id}")
    public LedgerEntryResponse get(@PathVariable("id") String id) {
        return LedgerEntryResponse.from(queryService.get(EntryId.parse(id)));
    }

    /**
     * Records a payment. Returns 201 when applied, 200 when the idempotency key had
     * already been used.
     */
    @PostMapping("/{id}/payments")
    public ResponseEntity<LedgerEntryResponse> recordPayment(
            @PathVariable("id") String id,
            @Valid @RequestBody RecordPaymentRequest request,
            @RequestHeader(value = IDEMPOTENCY_KEY_HEADER, required = false) String idempotencyKey) {
        EntryId entryId = EntryId.parse(id);
        log.info("Received payment request: entry={}, amount={}, mode={}, idempotencyKey={}",
                entryId, request.getAmount(), request.getPaymentMode(), idempotencyKey);

        PaymentOutcome outcome = paymentService.recordPayment(
            entryId, request.toPayment(LocalDate.now()), idempotencyKey);

        LedgerEntryResponse body = LedgerEntryResponse.from(outcome.getEntry(), List.of());
        return ResponseEntity.status(outcome.isReplayed() ? HttpStatus.OK : HttpStatus.CREATED).body(body);
    }
}
