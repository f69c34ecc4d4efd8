package com.flagship.textile_ledger.ledger;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.textile_ledger.event.LedgerPaymentRecordedEvent;
import com.flagship.textile_ledger.money.Money;
import com.flagship.textile_ledger.outbox.OutboxEvent;
import com.flagship.textile_ledger.outbox.OutboxService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Payments against stored bills and manual entries: balance persistence, rejection,
 * idempotent replay, outbox events and row locking.
 */
@SpringBootTest
@Testcontainers(disabledWithoutDocker = true)
class LedgerPaymentServiceTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16")
            .withDatabaseName("textile_ledger_test")
            .withUsername("test")
            .withPassword("test");

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
        // Kafka and the outbox publisher stay off for these tests
        registry.add("spring.kafka.bootstrap-servers", () -> "localhost:9999");
        registry.add("consumer.enabled", () -> "false");
        registry.add("outbox.publisher.enabled", () -> "false");
    }

    @Autowired
    private LedgerPaymentService paymentService;

    @Autowired
    private LedgerQueryService queryService;

    @Autowired
    private OutboxService outboxService;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @Autowired
    private ObjectMapper objectMapper;

    private EntryId billId;
    private EntryId receivableId;

    @BeforeEach
    void setUp() {
        Long vendorId = jdbcTemplate.queryForObject(
            "INSERT INTO parties (name, party_type) VALUES ('Acme Textiles', 'VENDOR') RETURNING id", Long.class);
        long bill = jdbcTemplate.queryForObject(
            "INSERT INTO bills (bill_number, party_id, bill_type, amount, paid_amount, status, bill_date, due_date) " +
            "VALUES ('B-100', ?, 'PURCHASE', 100.00, 0, 'PENDING', ?, ?) RETURNING id",
            Long.class, vendorId, LocalDate.now().minusDays(10), LocalDate.now().plusDays(20));
        long receivable = jdbcTemplate.queryForObject(
            "INSERT INTO manual_ledger_entries (entry_type, amount, remaining_amount, status, notes, entry_date) " +
            "VALUES ('RECEIVABLE', 250.00, 250.00, 'PENDING', 'Customer: Zain Garments', ?) RETURNING id",
            Long.class, LocalDate.now());
        billId = EntryId.of(UnderlyingKind.BILL, bill);
        receivableId = EntryId.of(UnderlyingKind.MANUAL_RECEIVABLE, receivable);
    }

    private static Payment cash(String amount) {
        return Payment.builder()
            .amount(Money.of(amount))
            .paymentMode(PaymentMode.CASH)
            .transactionDate(LocalDate.now())
            .build();
    }

    @Test
    @DisplayName("Partial then full payment settles a bill and persists the paid amount")
    void partialThenFullPayment() {
        PaymentOutcome first = paymentService.recordPayment(billId, cash("40.00"), null);

        assertFalse(first.isReplayed());
        assertEquals(Money.of("60.00"), first.getEntry().getRemainingAmount());
        assertEquals(EntryStatus.PARTIAL, first.getEntry().getStatus());
        assertNotNull(first.getEntry().getTransactions().get(0).getId());

        PaymentOutcome second = paymentService.recordPayment(billId, cash("60.00"), null);

        assertEquals(EntryStatus.PAID, second.getEntry().getStatus());
        assertEquals(2, second.getEntry().getTransactions().size());

        BigDecimal paid = jdbcTemplate.queryForObject(
            "SELECT paid_amount FROM bills WHERE id = ?", BigDecimal.class, billId.getRowId());
        assertEquals(0, new BigDecimal("100.00").compareTo(paid));
        assertEquals("PAID", jdbcTemplate.queryForObject(
            "SELECT status FROM bills WHERE id = ?", String.class, billId.getRowId()));

        LedgerEntry reloaded = queryService.get(billId).getEntry();
        assertEquals(Money.ZERO, reloaded.getRemainingAmount());
        assertEquals("Acme Textiles", reloaded.getParty());
        assertEquals(2, reloaded.getTransactions().size());
    }

    @Test
    @DisplayName("Manual receivable stores its remaining amount")
    void manualReceivable() {
        PaymentOutcome outcome = paymentService.recordPayment(receivableId, cash("250.00"), null);

        assertEquals(EntryStatus.COMPLETED, outcome.getEntry().getStatus());
        assertEquals("Zain Garments", outcome.getEntry().getParty());
        BigDecimal remaining = jdbcTemplate.queryForObject(
            "SELECT remaining_amount FROM manual_ledger_entries WHERE id = ?", BigDecimal.class,
            receivableId.getRowId());
        assertEquals(0, BigDecimal.ZERO.compareTo(remaining));
    }

    @Test
    @DisplayName("Overpayment is rejected and nothing is written")
    void overpaymentRejected() {
        PaymentRejectedException e = assertThrows(PaymentRejectedException.class,
            () -> paymentService.recordPayment(billId, cash("100.01"), "overpay-" + UUID.randomUUID()));

        assertEquals(PaymentRejectionReason.EXCEEDS_REMAINING_BALANCE, e.getReason());
        assertEquals(Money.of("100.00"), e.getRemainingBalance());
        assertEquals(0, countPayments(billId));
        assertTrue(outboxService.getEventsForAggregate(
            LedgerPaymentRecordedEvent.AGGREGATE_TYPE, billId.toString()).isEmpty());
    }

    @Test
    @DisplayName("Same idempotency key records the payment once")
    void idempotentReplay() {
        String key = "pay-" + UUID.randomUUID();

        PaymentOutcome first = paymentService.recordPayment(billId, cash("30.00"), key);
        PaymentOutcome replay = paymentService.recordPayment(billId, cash("30.00"), key);

        assertFalse(first.isReplayed());
        assertTrue(replay.isReplayed());
        assertEquals(Money.of("70.00"), replay.getEntry().getRemainingAmount());
        assertEquals(1, countPayments(billId));
    }

    @Test
    @DisplayName("Idempotency key reused for another entry is refused")
    void keyReusedForOtherEntry() {
        String key = "pay-" + UUID.randomUUID();
        paymentService.recordPayment(billId, cash("10.00"), key);

        assertThrows(IllegalStateException.class,
            () -> paymentService.recordPayment(receivableId, cash("10.00"), key));
        assertEquals(0, countPayments(receivableId));
    }

    @Test
    @DisplayName("Recorded payment writes one outbox event for the entry")
    void writesOutboxEvent() throws Exception {
        paymentService.recordPayment(billId, cash("25.00"), null);

        List<OutboxEvent> events = outboxService.getEventsForAggregate(
            LedgerPaymentRecordedEvent.AGGREGATE_TYPE, billId.toString());
        assertEquals(1, events.size());
        assertEquals(LedgerPaymentRecordedEvent.EVENT_TYPE, events.get(0).getEventType());
        JsonNode payload = objectMapper.readTree(events.get(0).getPayload());
        assertEquals(billId.toString(), payload.get("entryId").asText());
        assertEquals(0, new BigDecimal("75.00").compareTo(payload.get("remainingAmount").decimalValue()));
        assertEquals("PARTIAL", payload.get("status").asText());
        assertFalse(events.get(0).isPublished());
    }

    @Test
    @DisplayName("Cheque payment without a bank name is rejected")
    void chequeNeedsBank() {
        Payment cheque = cash("10.00").toBuilder().paymentMode(PaymentMode.CHEQUE).chequeNumber("000777").build();

        PaymentRejectedException e = assertThrows(PaymentRejectedException.class,
            () -> paymentService.recordPayment(billId, cheque, null));

        assertEquals(PaymentRejectionReason.MISSING_BANK_NAME, e.getReason());
    }

    @Test
    @DisplayName("Unknown entry is reported as not found")
    void unknownEntry() {
        assertThrows(LedgerEntryNotFoundException.class,
            () -> paymentService.recordPayment(EntryId.of(UnderlyingKind.BILL, 999_999), cash("1.00"), null));
    }

    @Test
    @DisplayName("Overpaid row is repaired before the next payment is checked")
    void repairsBeforePayment() {
        jdbcTemplate.update("UPDATE bills SET paid_amount = 120.00, status = 'PARTIAL' WHERE id = ?", billId.getRowId());

        PaymentRejectedException e = assertThrows(PaymentRejectedException.class,
            () -> paymentService.recordPayment(billId, cash("1.00"), null));

        assertEquals(PaymentRejectionReason.ENTRY_CLOSED, e.getReason());
        assertEquals(EntryStatus.PAID, queryService.get(billId).getEntry().getStatus());
    }

    @Test
    @DisplayName("Concurrent payments never drive the balance below zero")
    void concurrentPaymentsSerialize() throws InterruptedException {
        int threads = 5;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        AtomicInteger accepted = new AtomicInteger();
        AtomicInteger rejected = new AtomicInteger();

        for (int i = 0; i < threads; i++) {
            executor.submit(() -> {
                try {
                    start.await();
                    paymentService.recordPayment(billId, cash("30.00"), null);
                    accepted.incrementAndGet();
                } catch (PaymentRejectedException e) {
                    rejected.incrementAndGet();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            });
        }
        start.countDown();
        executor.shutdown();
        assertTrue(executor.awaitTermination(30, TimeUnit.SECONDS));

        assertEquals(3, accepted.get());
        assertEquals(2, rejected.get());
        assertEquals(Money.of("10.00"), queryService.get(billId).getEntry().getRemainingAmount());
    }

    @Test
    @DisplayName("Concurrent requests sharing an idempotency key apply the payment once")
    void concurrentSameKeyAppliesOnce() throws InterruptedException {
        String key = "pay-" + UUID.randomUUID();
        int threads = 5;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        AtomicInteger applied = new AtomicInteger();
        AtomicInteger replayed = new AtomicInteger();
        List<Throwable> errors = new CopyOnWriteArrayList<>();

        for (int i = 0; i < threads; i++) {
            executor.submit(() -> {
                try {
                    start.await();
                    PaymentOutcome outcome = paymentService.recordPayment(billId, cash("30.00"), key);
                    (outcome.isReplayed() ? replayed : applied).incrementAndGet();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } catch (RuntimeException e) {
                    errors.add(e);
                }
            });
        }
        start.countDown();
        executor.shutdown();
        assertTrue(executor.awaitTermination(30, TimeUnit.SECONDS));

        assertEquals(List.of(), errors);
        assertEquals(1, applied.get());
        assertEquals(threads - 1, replayed.get());
        assertEquals(1, countPayments(billId));
        assertEquals(Money.of("70.00"), queryService.get(billId).getEntry().getRemainingAmount());
    }

    private int countPayments(EntryId id) {
        Integer count = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM ledger_payments WHERE entry_kind = ? AND entry_row_id = ?",
            Integer.class, id.getKind().name(), id.getRowId());
        return count == null ? 0 : count;
    }
}
