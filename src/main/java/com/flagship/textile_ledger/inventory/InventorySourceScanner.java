package com.flagship.textile_ledger.inventory;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Finds production records that are ready to enter inventory.
 *
 * <ul>
 *   <li>thread purchases once received</li>
 *   <li>dyeing processes whose result is {@code SUCCESS}</li>
 *   <li>fabric productions whose status is {@code COMPLETED}</li>
 * </ul>
 * Records already flagged {@code ADDED} are skipped. The flag is only a hint:
 * {@link PendingItemReconciler} checks transaction back-references as well.
 */
@Component
@RequiredArgsConstructor
public class InventorySourceScanner {

    public static final String ADDED = "ADDED";
    static final String DYEING_SUCCESS = "SUCCESS";
    static final String FABRIC_COMPLETED = "COMPLETED";

    private final ProductionSources sources;

    public EligibleSources scan() {
        return new EligibleSources(
            sources.findThreadPurchases().stream().filter(InventorySourceScanner::isEligible).toList(),
            sources.findDyeingProcesses().stream().filter(InventorySourceScanner::isEligible).toList(),
            sources.findFabricProductions().stream().filter(InventorySourceScanner::isEligible).toList());
    }

    public static boolean isEligible(ThreadPurchase purchase) {
        return purchase.isReceived() && !isAdded(purchase.getInventoryStatus());
    }

    public static boolean isEligible(DyeingProcess process) {
        return DYEING_SUCCESS.equalsIgnoreCase(process.getResultStatus())
            && !isAdded(process.getInventoryStatus());
    }

    public static boolean isEligible(FabricProduction production) {
        return FABRIC_COMPLETED.equalsIgnoreCase(production.getStatus())
            && !isAdded(production.getInventoryStatus());
    }

    private static boolean isAdded(String inventoryStatus) {
        return ADDED.equalsIgnoreCase(inventoryStatus);
    }
}
