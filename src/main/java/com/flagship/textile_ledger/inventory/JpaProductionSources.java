package com.flagship.textile_ledger.inventory;

import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Component
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class JpaProductionSources implements ProductionSources {

    private static final Sort BY_ID = Sort.by("id");

    private final ThreadPurchaseRepository threadPurchases;
    private final DyeingProcessRepository dyeingProcesses;
    private final FabricProductionRepository fabricProductions;
    private final InventoryTransactionRepository transactions;

    @Override
    public List<ThreadPurchase> findThreadPurchases() {
        return threadPurchases.findAll(BY_ID).stream().map(ThreadPurchaseEntity::toDomain).toList();
    }

    @Override
    public List<DyeingProcess> findDyeingProcesses() {
        return dyeingProcesses.findAll(BY_ID).stream().map(DyeingProcessEntity::toDomain).toList();
    }

    @Override
    public List<FabricProduction> findFabricProductions() {
        return fabricProductions.findAll(BY_ID).stream().map(FabricProductionEntity::toDomain).toList();
    }

    @Override
    public List<InventoryTransaction> findAbsorbingTransactions() {
        return transactions.findAbsorbing().stream().map(InventoryTransactionEntity::toDomain).toList();
    }
}
