package com.flagship.textile_ledger.inventory;

/**
 * Absorbs one production record into inventory: creates the stock item, the
 * back-referencing transaction and flags the upstream record.
 */
public interface InventoryAbsorber {

    /**
     * @throws DuplicateAbsorptionException if the record already has an absorbing transaction
     * @throws RuntimeException for any other reason the record cannot be absorbed
     */
    ImportedItem absorb(PendingItem item);
}
