package com.flagship.textile_ledger.inventory;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Optional;

/**
 * One movement of stock. Append-only.
 *
 * A transaction references at most one upstream record (thread purchase, dyeing
 * process, fabric production or sales order). The constructor rejects anything
 * else, and the {@code inventory_transactions} table repeats the rule as a CHECK
 * constraint.
 */
@Value
public class InventoryTransaction {
    Long id;
    Long inventoryItemId;
    InventoryTransactionType transactionType;
    BigDecimal quantityDelta;
    BigDecimal remainingQuantityAfter;
    BigDecimal unitCost;
    BigDecimal totalCost;
    Long threadPurchaseId;
    Long dyeingProcessId;
    Long fabricProductionId;
    Long salesOrderId;
    LocalDate transactionDate;
    String notes;

    @Builder
    private InventoryTransaction(Long id, Long inventoryItemId, InventoryTransactionType transactionType,
                                 BigDecimal quantityDelta, BigDecimal remainingQuantityAfter,
                                 BigDecimal unitCost, BigDecimal totalCost,
                                 Long threadPurchaseId, Long dyeingProcessId, Long fabricProductionId,
                                 Long salesOrderId, LocalDate transactionDate, String notes) {
        int references = count(threadPurchaseId) + count(dyeingProcessId)
                + count(fabricProductionId) + count(salesOrderId);
        if (references > 1) {
            throw new IllegalArgumentException(
                "An inventory transaction references at most one upstream record, got " + references);
        }
        this.id = id;
        this.inventoryItemId = inventoryItemId;
        this.transactionType = transactionType;
        this.quantityDelta = quantityDelta;
        this.remainingQuantityAfter = remainingQuantityAfter;
        this.unitCost = unitCost;
        this.totalCost = totalCost;
        this.threadPurchaseId = threadPurchaseId;
        this.dyeingProcessId = dyeingProcessId;
        this.fabricProductionId = fabricProductionId;
        this.salesOrderId = salesOrderId;
        this.transactionDate = transactionDate;
        this.notes = notes;
    }

    /**
     * Builder preset with the single back-reference for {@code source}.
     */
    public static InventoryTransactionBuilder absorbing(SourceKey source) {
        InventoryTransactionBuilder builder = builder().transactionType(source.getSourceKind().transactionType());
        return switch (source.getSourceKind()) {
            case THREAD_PURCHASE -> builder.threadPurchaseId(source.getSourceId());
            case DYEING_PROCESS -> builder.dyeingProcessId(source.getSourceId());
            case FABRIC_PRODUCTION -> builder.fabricProductionId(source.getSourceId());
        };
    }

    /**
     * The production record this transaction absorbed, if any.
     */
    public Optional<SourceKey> getSourceKey() {
        if (threadPurchaseId != null) {
            return Optional.of(SourceKey.of(SourceKind.THREAD_PURCHASE, threadPurchaseId));
        }
        if (dyeingProcessId != null) {
            return Optional.of(SourceKey.of(SourceKind.DYEING_PROCESS, dyeingProcessId));
        }
        if (fabricProductionId != null) {
            return Optional.of(SourceKey.of(SourceKind.FABRIC_PRODUCTION, fabricProductionId));
        }
        return Optional.empty();
    }

    private static int count(Long reference) {
        return reference == null ? 0 : 1;
    }
}
