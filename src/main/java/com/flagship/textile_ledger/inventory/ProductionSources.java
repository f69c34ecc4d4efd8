package com.flagship.textile_ledger.inventory;

import java.util.List;

/**
 * Read access to the upstream production domains and to the inventory
 * transaction back-references.
 */
public interface ProductionSources {

    List<ThreadPurchase> findThreadPurchases();

    List<DyeingProcess> findDyeingProcesses();

    List<FabricProduction> findFabricProductions();

    /**
     * Every inventory transaction that carries an upstream back-reference.
     */
    List<InventoryTransaction> findAbsorbingTransactions();
}
