package com.flagship.textile_ledger.inventory;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class InventoryTransactionTest {

    @Test
    @DisplayName("Absorbing builder sets the one back-reference and the transaction type")
    void absorbingSetsSingleReference() {
        InventoryTransaction dyed = InventoryTransaction.absorbing(SourceKey.of(SourceKind.DYEING_PROCESS, 12)).build();

        assertEquals(12L, dyed.getDyeingProcessId());
        assertNull(dyed.getThreadPurchaseId());
        assertNull(dyed.getFabricProductionId());
        assertEquals(InventoryTransactionType.PRODUCTION, dyed.getTransactionType());
        assertEquals(Optional.of(SourceKey.of(SourceKind.DYEING_PROCESS, 12)), dyed.getSourceKey());
    }

    @Test
    @DisplayName("Thread purchases are absorbed as purchases")
    void threadIsPurchase() {
        InventoryTransaction thread = InventoryTransaction.absorbing(SourceKey.of(SourceKind.THREAD_PURCHASE, 1)).build();

        assertEquals(InventoryTransactionType.PURCHASE, thread.getTransactionType());
    }

    @Test
    @DisplayName("Two back-references on one transaction are rejected")
    void rejectsSecondReference() {
        assertThrows(IllegalArgumentException.class, () ->
            InventoryTransaction.absorbing(SourceKey.of(SourceKind.DYEING_PROCESS, 12))
                .threadPurchaseId(3L)
                .build());
        assertThrows(IllegalArgumentException.class, () ->
            InventoryTransaction.builder().fabricProductionId(1L).salesOrderId(2L).build());
    }

    @Test
    @DisplayName("Sales and adjustments carry no production source")
    void noSourceKey() {
        assertTrue(InventoryTransaction.builder().salesOrderId(4L).build().getSourceKey().isEmpty());
        assertTrue(InventoryTransaction.builder().build().getSourceKey().isEmpty());
    }
}
