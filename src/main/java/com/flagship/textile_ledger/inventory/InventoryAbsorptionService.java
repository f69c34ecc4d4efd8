package com.flagship.textile_ledger.inventory;

import com.flagship.textile_ledger.event.InventoryItemAbsorbedEvent;
import com.flagship.textile_ledger.outbox.OutboxService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.security.SecureRandom;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * Absorbs one production record per transaction.
 *
 * Within that transaction it locks the upstream row, re-checks eligibility,
 * creates the stock item and its single back-referencing transaction, flags the
 * upstream record {@code ADDED} and writes an {@code InventoryItemAbsorbed}
 * outbox event. The unique index on each back-reference column catches a
 * concurrent import that slips past the existence check.
 */
@Service
@Slf4j
public class InventoryAbsorptionService implements InventoryAbsorber {

    private static final String CODE_ALPHABET = "ABCDEFGHJKLMNPQRSTUVWXYZ23456789";
    private static final int CODE_SUFFIX_LENGTH = 4;
    private static final BigDecimal MIN_STOCK_RATIO = new BigDecimal("0.1");

    private final ThreadPurchaseRepository threadPurchases;
    private final DyeingProcessRepository dyeingProcesses;
    private final FabricProductionRepository fabricProductions;
    private final InventoryItemRepository items;
    private final InventoryTransactionRepository transactions;
    private final OutboxService outboxService;
    private final BigDecimal markup;
    private final String location;
    private final SecureRandom random = new SecureRandom();

    public InventoryAbsorptionService(ThreadPurchaseRepository threadPurchases,
                                      DyeingProcessRepository dyeingProcesses,
                                      FabricProductionRepository fabricProductions,
                                      InventoryItemRepository items,
                                      InventoryTransactionRepository transactions,
                                      OutboxService outboxService,
                                      @Value("${inventory.absorption.default-markup:0.25}") BigDecimal markup,
                                      @Value("${inventory.absorption.default-location:Main Warehouse}") String location) {
        this.threadPurchases = threadPurchases;
        this.dyeingProcesses = dyeingProcesses;
        this.fabricProductions = fabricProductions;
        this.items = items;
        this.transactions = transactions;
        this.outboxService = outboxService;
        this.markup = markup;
        this.location = location;
    }

    @Override
    @Transactional
    public ImportedItem absorb(PendingItem item) {
        SourceKey key = item.getKey();
        if (isAbsorbed(key)) {
            throw new DuplicateAbsorptionException(key);
        }

        Absorbable source = lockEligible(key);
        if (source.quantity().signum() <= 0) {
            throw new IllegalStateException(key + " has no positive quantity to absorb");
        }

        BigDecimal unitCost = source.totalCost().divide(source.quantity(), 2, RoundingMode.HALF_UP);
        InventoryItemEntity stock = items.save(InventoryItemEntity.fromDomain(InventoryItem.builder()
            .itemCode(itemCode(key))
            .description(source.pending().getName())
            .productKind(key.getSourceKind().productKind())
            .currentQuantity(source.quantity())
            .unitOfMeasure(source.pending().getUnitOfMeasure())
            .costPerUnit(unitCost)
            .salePrice(salePrice(unitCost))
            .minStockLevel(minStockLevel(source.quantity()))
            .location(location)
            .build()));

        InventoryTransaction transaction = InventoryTransaction.absorbing(key)
            .inventoryItemId(stock.getId())
            .quantityDelta(source.quantity())
            .remainingQuantityAfter(source.quantity())
            .unitCost(unitCost)
            .totalCost(source.totalCost())
            .transactionDate(LocalDate.now())
            .notes("Absorbed from " + key)
            .build();
        InventoryTransactionEntity saved = transactions.save(InventoryTransactionEntity.fromDomain(transaction));

        source.markAdded().run();

        outboxService.saveEvent(new InventoryItemAbsorbedEvent(
            UUID.randomUUID(),
            key.getSourceKind().name(),
            key.getSourceId(),
            stock.getId(),
            saved.getId(),
            stock.getItemCode(),
            source.quantity(),
            Instant.now()));

        log.debug("Absorbed {} as item {} (transaction {})", key, stock.getItemCode(), saved.getId());
        return new ImportedItem(key, stock.getId(), saved.getId(), stock.getItemCode());
    }

    private boolean isAbsorbed(SourceKey key) {
        return switch (key.getSourceKind()) {
            case THREAD_PURCHASE -> transactions.existsByThreadPurchaseId(key.getSourceId());
            case DYEING_PROCESS -> transactions.existsByDyeingProcessId(key.getSourceId());
            case FABRIC_PRODUCTION -> transactions.existsByFabricProductionId(key.getSourceId());
        };
    }

    private Absorbable lockEligible(SourceKey key) {
        long id = key.getSourceId();
        switch (key.getSourceKind()) {
            case THREAD_PURCHASE: {
                ThreadPurchaseEntity entity = threadPurchases.findByIdForUpdate(id)
                    .orElseThrow(() -> notFound(key));
                ThreadPurchase purchase = entity.toDomain();
                requireEligible(key, InventorySourceScanner.isEligible(purchase));
                return new Absorbable(PendingItemReconciler.fromThread(purchase), entity::markAddedToInventory);
            }
            case DYEING_PROCESS: {
                DyeingProcessEntity entity = dyeingProcesses.findByIdForUpdate(id)
                    .orElseThrow(() -> notFound(key));
                DyeingProcess process = entity.toDomain();
                requireEligible(key, InventorySourceScanner.isEligible(process));
                return new Absorbable(PendingItemReconciler.fromDyeing(process), entity::markAddedToInventory);
            }
            case FABRIC_PRODUCTION: {
                FabricProductionEntity entity = fabricProductions.findByIdForUpdate(id)
                    .orElseThrow(() -> notFound(key));
                FabricProduction production = entity.toDomain();
                requireEligible(key, InventorySourceScanner.isEligible(production));
                return new Absorbable(PendingItemReconciler.fromFabric(production), entity::markAddedToInventory);
            }
            default:
                throw new IllegalArgumentException("Unsupported source kind: " + key.getSourceKind());
        }
    }

    private static void requireEligible(SourceKey key, boolean eligible) {
        if (!eligible) {
            throw new IllegalStateException(key + " is not complete or is already flagged as added");
        }
    }

    private static IllegalArgumentException notFound(SourceKey key) {
        return new IllegalArgumentException(key + " does not exist");
    }

    BigDecimal salePrice(BigDecimal unitCost) {
        return unitCost.multiply(BigDecimal.ONE.add(markup)).setScale(2, RoundingMode.HALF_UP);
    }

    static BigDecimal minStockLevel(BigDecimal quantity) {
        return quantity.multiply(MIN_STOCK_RATIO).setScale(0, RoundingMode.CEILING);
    }

    private String itemCode(SourceKey key) {
        StringBuilder code = new StringBuilder()
            .append(key.getSourceKind().itemCodePrefix())
            .append('-')
            .append(key.getSourceId())
            .append('-');
        for (int i = 0; i < CODE_SUFFIX_LENGTH; i++) {
            code.append(CODE_ALPHABET.charAt(random.nextInt(CODE_ALPHABET.length())));
        }
        return code.toString();
    }

    private record Absorbable(PendingItem pending, Runnable markAdded) {
        BigDecimal quantity() {
            return pending.getQuantity();
        }

        BigDecimal totalCost() {
            return pending.getTotalCost();
        }
    }
}
