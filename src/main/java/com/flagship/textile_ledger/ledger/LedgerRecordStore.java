package com.flagship.textile_ledger.ledger;

import com.flagship.textile_ledger.money.Money;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;

import java.sql.Date;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * JDBC access to the ledger's source tables.
 *
 * Each underlying kind lives in its own table with its own column names; this
 * class maps them all onto {@link RawLedgerRecord}. Payments against
 * balance-tracking entries live in {@code ledger_payments}, keyed by
 * {@code (entry_kind, entry_row_id)}.
 */
@Repository
public class LedgerRecordStore {

    private static final Map<UnderlyingKind, String> SELECTS = new EnumMap<>(UnderlyingKind.class);

    static {
        SELECTS.put(UnderlyingKind.BILL,
            "SELECT b.id, b.bill_type AS direction, b.description, b.bill_number AS reference, " +
            "b.amount AS total_amount, b.paid_amount, NULL AS remaining_amount, b.status, " +
            "p.name AS linked_party, NULL AS manual_party, b.description AS notes, b.khata_id, " +
            "b.bill_date AS entry_date, b.due_date " +
            "FROM bills b LEFT JOIN parties p ON p.id = b.party_id");
        SELECTS.put(UnderlyingKind.MANUAL_PAYABLE, manualSelect("PAYABLE"));
        SELECTS.put(UnderlyingKind.MANUAL_RECEIVABLE, manualSelect("RECEIVABLE"));
        SELECTS.put(UnderlyingKind.CHEQUE,
            "SELECT c.id, NULL AS direction, NULL AS description, c.cheque_number AS reference, " +
            "c.amount AS total_amount, NULL AS paid_amount, NULL AS remaining_amount, c.status, " +
            "p.name AS linked_party, NULL AS manual_party, c.notes, c.khata_id, " +
            "c.issue_date AS entry_date, c.clearance_date AS due_date " +
            "FROM cheques c LEFT JOIN parties p ON p.id = c.party_id");
        SELECTS.put(UnderlyingKind.BANK_TXN,
            "SELECT t.id, NULL AS direction, t.description, t.reference, " +
            "t.amount AS total_amount, NULL AS paid_amount, NULL AS remaining_amount, NULL AS status, " +
            "NULL AS linked_party, t.account_name AS manual_party, t.description AS notes, t.khata_id, " +
            "t.transaction_date AS entry_date, NULL AS due_date " +
            "FROM bank_transactions t");
        SELECTS.put(UnderlyingKind.INVENTORY_VALUATION,
            "SELECT v.id, NULL AS direction, v.description, NULL AS reference, " +
            "v.value AS total_amount, NULL AS paid_amount, NULL AS remaining_amount, NULL AS status, " +
            "NULL AS linked_party, NULL AS manual_party, v.description AS notes, v.khata_id, " +
            "v.valuation_date AS entry_date, NULL AS due_date " +
            "FROM inventory_valuations v");
    }

    private static final Map<UnderlyingKind, String> ALIASES = Map.of(
        UnderlyingKind.BILL, "b",
        UnderlyingKind.MANUAL_PAYABLE, "m",
        UnderlyingKind.MANUAL_RECEIVABLE, "m",
        UnderlyingKind.CHEQUE, "c",
        UnderlyingKind.BANK_TXN, "t",
        UnderlyingKind.INVENTORY_VALUATION, "v"
    );

    private final JdbcTemplate jdbcTemplate;

    public LedgerRecordStore(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    private static String manualSelect(String entryType) {
        return "SELECT m.id, NULL AS direction, m.description, m.reference, " +
            "m.amount AS total_amount, NULL AS paid_amount, m.remaining_amount, m.status, " +
            "p.name AS linked_party, m.party_name AS manual_party, m.notes, m.khata_id, " +
            "m.entry_date, m.due_date " +
            "FROM manual_ledger_entries m LEFT JOIN parties p ON p.id = m.party_id " +
            "WHERE m.entry_type = '" + entryType + "'";
    }

    /**
     * Loads every record of every kind, optionally scoped to one khata.
     */
    public List<RawLedgerRecord> findAll(Long khataId) {
        Map<EntryId, List<Payment>> payments = findPayments();
        List<RawLedgerRecord> records = new ArrayList<>();
        for (UnderlyingKind kind : UnderlyingKind.values()) {
            String sql = SELECTS.get(kind);
            List<Object> args = new ArrayList<>();
            if (khataId != null) {
                sql += (sql.contains(" WHERE ") ? " AND " : " WHERE ") + ALIASES.get(kind) + ".khata_id = ?";
                args.add(khataId);
            }
            sql += " ORDER BY " + ALIASES.get(kind) + ".id";
            records.addAll(jdbcTemplate.query(sql, rowMapper(kind, payments), args.toArray()));
        }
        return records;
    }

    public Optional<RawLedgerRecord> findById(EntryId id) {
        return queryOne(id, false);
    }

    /**
     * Loads the record and takes a row lock on it for the rest of the current
     * transaction. Concurrent payments against the same entry serialize here.
     */
    public Optional<RawLedgerRecord> lockForPayment(EntryId id) {
        return queryOne(id, true);
    }

    /**
     * Persists a new balance and status. Bills store the paid amount, manual entries
     * store the remaining amount.
     */
    public void updateBalance(LedgerEntry entry) {
        EntryId id = entry.getId();
        int updated = switch (id.getKind()) {
            case BILL -> jdbcTemplate.update(
                "UPDATE bills SET paid_amount = ?, status = ?, updated_at = CURRENT_TIMESTAMP WHERE id = ?",
                entry.getPaidAmount().toBigDecimal(), entry.getStatus().name(), id.getRowId());
            case MANUAL_PAYABLE, MANUAL_RECEIVABLE -> jdbcTemplate.update(
                "UPDATE manual_ledger_entries SET remaining_amount = ?, status = ?, updated_at = CURRENT_TIMESTAMP " +
                "WHERE id = ?",
                entry.getRemainingAmount().toBigDecimal(), entry.getStatus().name(), id.getRowId());
            default -> throw new IllegalArgumentException(id.getKind() + " entries have no balance to update");
        };
        if (updated != 1) {
            throw new IllegalStateException("Balance update touched " + updated + " rows for " + id);
        }
    }

    public Payment insertPayment(EntryId entryId, Payment payment, String idempotencyKey) {
        KeyHolder keyHolder = new GeneratedKeyHolder();
        jdbcTemplate.update(connection -> {
            PreparedStatement ps = connection.prepareStatement(
                "INSERT INTO ledger_payments (entry_kind, entry_row_id, amount, payment_mode, cheque_number, " +
                "bank_name, transaction_date, reference_number, notes, idempotency_key, created_at) " +
                "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, CURRENT_TIMESTAMP)",
                new String[] {"id"});
            ps.setString(1, entryId.getKind().name());
            ps.setLong(2, entryId.getRowId());
            ps.setBigDecimal(3, payment.getAmount().toBigDecimal());
            ps.setString(4, payment.getPaymentMode().name());
            ps.setString(5, payment.getChequeNumber());
            ps.setString(6, payment.getBankName());
            ps.setDate(7, Date.valueOf(payment.getTransactionDate()));
            ps.setString(8, payment.getReferenceNumber());
            ps.setString(9, payment.getNotes());
            ps.setString(10, idempotencyKey);
            return ps;
        }, keyHolder);
        Number key = keyHolder.getKey();
        return payment.toBuilder().id(key == null ? null : key.longValue()).build();
    }

    /**
     * Finds the entry a payment with this idempotency key was recorded against.
     */
    public Optional<EntryId> findEntryByIdempotencyKey(String idempotencyKey) {
        List<EntryId> ids = jdbcTemplate.query(
            "SELECT entry_kind, entry_row_id FROM ledger_payments WHERE idempotency_key = ?",
            (rs, rowNum) -> EntryId.of(UnderlyingKind.valueOf(rs.getString("entry_kind")), rs.getLong("entry_row_id")),
            idempotencyKey);
        return ids.stream().findFirst();
    }

    private Optional<RawLedgerRecord> queryOne(EntryId id, boolean lock) {
        UnderlyingKind kind = id.getKind();
        String sql = SELECTS.get(kind);
        sql += (sql.contains(" WHERE ") ? " AND " : " WHERE ") + ALIASES.get(kind) + ".id = ?";
        if (lock) {
            sql += " FOR UPDATE OF " + ALIASES.get(kind);
        }
        Optional<RawLedgerRecord> record = jdbcTemplate.query(sql, rowMapper(kind, Map.of()), id.getRowId())
            .stream().findFirst();
        // payments are read after the row lock so a queued payer sees the rows its predecessor committed
        if (!kind.isBalanceTracking()) {
            return record;
        }
        return record.map(found -> found.toBuilder().payments(findPaymentsFor(id)).build());
    }

    private List<Payment> findPaymentsFor(EntryId id) {
        return jdbcTemplate.query(
            "SELECT * FROM ledger_payments WHERE entry_kind = ? AND entry_row_id = ? ORDER BY id",
            (rs, rowNum) -> mapPayment(rs),
            id.getKind().name(), id.getRowId());
    }

    private Map<EntryId, List<Payment>> findPayments() {
        Map<EntryId, List<Payment>> byEntry = new HashMap<>();
        jdbcTemplate.query("SELECT * FROM ledger_payments ORDER BY id", rs -> {
            EntryId entryId = EntryId.of(UnderlyingKind.valueOf(rs.getString("entry_kind")), rs.getLong("entry_row_id"));
            byEntry.computeIfAbsent(entryId, key -> new ArrayList<>()).add(mapPayment(rs));
        });
        return byEntry;
    }

    private RowMapper<RawLedgerRecord> rowMapper(UnderlyingKind kind, Map<EntryId, List<Payment>> payments) {
        return (rs, rowNum) -> {
            long rowId = rs.getLong("id");
            return RawLedgerRecord.builder()
                .kind(kind)
                .rowId(rowId)
                .direction(rs.getString("direction"))
                .description(rs.getString("description"))
                .reference(rs.getString("reference"))
                .totalAmount(rs.getBigDecimal("total_amount"))
                .paidAmount(rs.getBigDecimal("paid_amount"))
                .remainingAmount(rs.getBigDecimal("remaining_amount"))
                .status(rs.getString("status"))
                .linkedPartyName(rs.getString("linked_party"))
                .manualPartyName(rs.getString("manual_party"))
                .notes(rs.getString("notes"))
                .khataId(nullableLong(rs, "khata_id"))
                .entryDate(localDate(rs, "entry_date"))
                .dueDate(localDate(rs, "due_date"))
                .payments(payments.getOrDefault(EntryId.of(kind, rowId), List.of()))
                .build();
        };
    }

    private static Payment mapPayment(ResultSet rs) throws SQLException {
        return Payment.builder()
            .id(rs.getLong("id"))
            .amount(Money.of(rs.getBigDecimal("amount")))
            .paymentMode(PaymentMode.valueOf(rs.getString("payment_mode")))
            .chequeNumber(rs.getString("cheque_number"))
            .bankName(rs.getString("bank_name"))
            .transactionDate(localDate(rs, "transaction_date"))
            .referenceNumber(rs.getString("reference_number"))
            .notes(rs.getString("notes"))
            .build();
    }

    private static LocalDate localDate(ResultSet rs, String column) throws SQLException {
        Date date = rs.getDate(column);
        return date == null ? null : date.toLocalDate();
    }

    private static Long nullableLong(ResultSet rs, String column) throws SQLException {
        long value = rs.getLong(column);
        return rs.wasNull() ? null : value;
    }
}
