package com.flagship.textile_ledger.inventory;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;

/**
 * Append-only: every column is {@code updatable = false}.
 */
@Entity
@Table(name = "inventory_transactions")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class InventoryTransactionEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "inventory_item_id", nullable = false, updatable = false)
    private Long inventoryItemId;

    @Enumerated(EnumType.STRING)
    @Column(name = "transaction_type", nullable = false, updatable = false, length = 20)
    private InventoryTransactionType transactionType;

    @Column(name = "quantity", nullable = false, updatable = false, precision = 19, scale = 3)
    private BigDecimal quantityDelta;

    @Column(name = "remaining_quantity", nullable = false, updatable = false, precision = 19, scale = 3)
    private BigDecimal remainingQuantityAfter;

    @Column(name = "unit_cost", updatable = false, precision = 19, scale = 2)
    private BigDecimal unitCost;

    @Column(name = "total_cost", updatable = false, precision = 19, scale = 2)
    private BigDecimal totalCost;

    @Column(name = "thread_purchase_id", updatable = false)
    private Long threadPurchaseId;

    @Column(name = "dyeing_process_id", updatable = false)
    private Long dyeingProcessId;

    @Column(name = "fabric_production_id", updatable = false)
    private Long fabricProductionId;

    @Column(name = "sales_order_id", updatable = false)
    private Long salesOrderId;

    @Column(name = "transaction_date", nullable = false, updatable = false)
    private LocalDate transactionDate;

    @Column(name = "notes", updatable = false, columnDefinition = "TEXT")
    private String notes;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    void onCreate() {
        this.createdAt = Instant.now();
    }

    static InventoryTransactionEntity fromDomain(InventoryTransaction transaction) {
        return new InventoryTransactionEntity(
            null,
            transaction.getInventoryItemId(),
            transaction.getTransactionType(),
            transaction.getQuantityDelta(),
            transaction.getRemainingQuantityAfter(),
            transaction.getUnitCost(),
            transaction.getTotalCost(),
            transaction.getThreadPurchaseId(),
            transaction.getDyeingProcessId(),
            transaction.getFabricProductionId(),
            transaction.getSalesOrderId(),
            transaction.getTransactionDate(),
            transaction.getNotes(),
            null
        );
    }

    public InventoryTransaction toDomain() {
        return InventoryTransaction.builder()
            .id(id)
            .inventoryItemId(inventoryItemId)
            .transactionType(transactionType)
            .quantityDelta(quantityDelta)
            .remainingQuantityAfter(remainingQuantityAfter)
            .unitCost(unitCost)
            .totalCost(totalCost)
            .threadPurchaseId(threadPurchaseId)
            .dyeingProcessId(dyeingProcessId)
            .fabricProductionId(fabricProductionId)
            .salesOrderId(salesOrderId)
            .transactionDate(transactionDate)
            .notes(notes)
            .build();
    }
}
