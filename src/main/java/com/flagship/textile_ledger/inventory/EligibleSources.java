package com.flagship.textile_ledger.inventory;

import lombok.Value;

import java.util.List;

/**
 * Production records that are complete and not yet flagged as absorbed.
 */
@Value
public class EligibleSources {
    List<ThreadPurchase> threadPurchases;
    List<DyeingProcess> dyeingProcesses;
    List<FabricProduction> fabricProductions;
}
