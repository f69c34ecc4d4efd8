package com.flagship.textile_ledger.inventory;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface InventoryTransactionRepository extends JpaRepository<InventoryTransactionEntity, Long> {

    boolean existsByThreadPurchaseId(Long threadPurchaseId);

    boolean existsByDyeingProcessId(Long dyeingProcessId);

    boolean existsByFabricProductionId(Long fabricProductionId);

    @Query("""
        SELECT t FROM InventoryTransactionEntity t
        WHERE t.threadPurchaseId IS NOT NULL
           OR t.dyeingProcessId IS NOT NULL
           OR t.fabricProductionId IS NOT NULL
        """)
    List<InventoryTransactionEntity> findAbsorbing();

    List<InventoryTransactionEntity> findByInventoryItemIdOrderByIdAsc(Long inventoryItemId);
}
