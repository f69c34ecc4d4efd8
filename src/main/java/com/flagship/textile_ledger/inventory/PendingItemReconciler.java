package com.flagship.textile_ledger.inventory;

import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Computes the pending set: eligible production records with no absorbing
 * inventory transaction.
 *
 * Transaction back-references are authoritative here. A record whose
 * {@code inventory_status} flag lags behind is still excluded once its
 * transaction exists. The result lists threads, then dyeing processes, then
 * fabrics, and holds each {@link SourceKey} once.
 */
@Component
public class PendingItemReconciler {

    static final String DYED_THREAD_UNIT = "meters";
    static final String RAW_COLOR = "Raw";
    static final String UNKNOWN_COLOR = "Unknown";

    public List<PendingItem> reconcile(EligibleSources eligible, Collection<InventoryTransaction> transactions) {
        return reconcile(eligible.getThreadPurchases(), eligible.getDyeingProcesses(),
            eligible.getFabricProductions(), transactions);
    }

    public List<PendingItem> reconcile(List<ThreadPurchase> threads,
                                       List<DyeingProcess> dyed,
                                       List<FabricProduction> fabrics,
                                       Collection<InventoryTransaction> transactions) {
        Map<SourceKind, Set<Long>> imported = importedIds(transactions);

        List<PendingItem> candidates = new ArrayList<>();
        for (ThreadPurchase thread : threads) {
            if (!imported.get(SourceKind.THREAD_PURCHASE).contains(thread.getId())) {
                candidates.add(fromThread(thread));
            }
        }
        for (DyeingProcess process : dyed) {
            if (!imported.get(SourceKind.DYEING_PROCESS).contains(process.getId())) {
                candidates.add(fromDyeing(process));
            }
        }
        for (FabricProduction fabric : fabrics) {
            if (!imported.get(SourceKind.FABRIC_PRODUCTION).contains(fabric.getId())) {
                candidates.add(fromFabric(fabric));
            }
        }

        Map<SourceKey, PendingItem> unique = new LinkedHashMap<>();
        for (PendingItem candidate : candidates) {
            unique.putIfAbsent(candidate.getKey(), candidate);
        }
        return List.copyOf(unique.values());
    }

    static Map<SourceKind, Set<Long>> importedIds(Collection<InventoryTransaction> transactions) {
        Map<SourceKind, Set<Long>> imported = new EnumMap<>(SourceKind.class);
        for (SourceKind kind : SourceKind.values()) {
            imported.put(kind, new HashSet<>());
        }
        for (InventoryTransaction transaction : transactions) {
            transaction.getSourceKey()
                .ifPresent(key -> imported.get(key.getSourceKind()).add(key.getSourceId()));
        }
        return imported;
    }

    static PendingItem fromThread(ThreadPurchase thread) {
        String color = isBlank(thread.getColor()) ? RAW_COLOR : thread.getColor();
        return PendingItem.builder()
            .sourceKind(SourceKind.THREAD_PURCHASE)
            .sourceId(thread.getId())
            .productKind(SourceKind.THREAD_PURCHASE.productKind())
            .name(thread.getThreadType() + " " + color)
            .quantity(orZero(thread.getQuantity()))
            .unitOfMeasure(thread.getUnitOfMeasure())
            .totalCost(orZero(thread.getTotalCost()))
            .build();
    }

    static PendingItem fromDyeing(DyeingProcess process) {
        String color = !isBlank(process.getColorName()) ? process.getColorName()
            : !isBlank(process.getColorCode()) ? process.getColorCode()
            : UNKNOWN_COLOR;
        return PendingItem.builder()
            .sourceKind(SourceKind.DYEING_PROCESS)
            .sourceId(process.getId())
            .productKind(SourceKind.DYEING_PROCESS.productKind())
            .name("Dyed Thread " + color)
            .quantity(orZero(process.getOutputQuantity()))
            .unitOfMeasure(DYED_THREAD_UNIT)
            .totalCost(orZero(process.getTotalCost()))
            .build();
    }

    static PendingItem fromFabric(FabricProduction fabric) {
        String name = isBlank(fabric.getDimensions())
            ? fabric.getFabricType()
            : fabric.getFabricType() + " " + fabric.getDimensions();
        return PendingItem.builder()
            .sourceKind(SourceKind.FABRIC_PRODUCTION)
            .sourceId(fabric.getId())
            .productKind(SourceKind.FABRIC_PRODUCTION.productKind())
            .name(name)
            .quantity(orZero(fabric.getQuantityProduced()))
            .unitOfMeasure(fabric.getUnitOfMeasure())
            .totalCost(orZero(fabric.getTotalCost()))
            .build();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private static BigDecimal orZero(BigDecimal value) {
        return value == null ? BigDecimal.ZERO : value;
    }
}
