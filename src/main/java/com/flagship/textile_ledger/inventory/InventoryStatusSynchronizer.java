package com.flagship.textile_ledger.inventory;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * Re-asserts the upstream {@code inventory_status = ADDED} flag for a record that
 * has an absorbing transaction. Used when replaying absorption events, e.g. after
 * an upstream domain overwrote the flag.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class InventoryStatusSynchronizer {

    private final ThreadPurchaseRepository threadPurchases;
    private final DyeingProcessRepository dyeingProcesses;
    private final FabricProductionRepository fabricProductions;

    /**
     * @return true if the flag had to be changed
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public boolean markAdded(SourceKey key) {
        boolean changed = switch (key.getSourceKind()) {
            case THREAD_PURCHASE -> threadPurchases.findById(key.getSourceId())
                .filter(e -> !InventorySourceScanner.ADDED.equals(e.getInventoryStatus()))
                .map(e -> { e.markAddedToInventory(); return true; })
                .orElse(false);
            case DYEING_PROCESS -> dyeingProcesses.findById(key.getSourceId())
                .filter(e -> !InventorySourceScanner.ADDED.equals(e.getInventoryStatus()))
                .map(e -> { e.markAddedToInventory(); return true; })
                .orElse(false);
            case FABRIC_PRODUCTION -> fabricProductions.findById(key.getSourceId())
                .filter(e -> !InventorySourceScanner.ADDED.equals(e.getInventoryStatus()))
                .map(e -> { e.markAddedToInventory(); return true; })
                .orElse(false);
        };
        if (changed) {
            log.info("Re-flagged {} as added to inventory", key);
        }
        return changed;
    }
}
