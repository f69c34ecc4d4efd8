package com.flagship.textile_ledger.inventory;

import com.flagship.textile_ledger.observability.LedgerMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Entry point of the inventory import cycle: list the pending set, import a
 * selection from it, list it again.
 *
 * Deliberately not transactional. Each absorption commits on its own inside
 * {@link InventoryAbsorptionService}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class InventoryReconciliationService {

    private final InventorySourceScanner scanner;
    private final ProductionSources sources;
    private final PendingItemReconciler reconciler;
    private final InventoryImportPipeline pipeline;
    private final LedgerMetrics metrics;

    public List<PendingItem> findPending() {
        return metrics.timeOperation("inventory.pending",
            () -> reconciler.reconcile(scanner.scan(), sources.findAbsorbingTransactions()));
    }

    /**
     * Imports the selected keys and returns the fresh pending set.
     *
     * Keys that are not in the current pending set (unknown, incomplete or already
     * imported) are reported as failures without touching the store.
     */
    public ImportOutcome importAndReconcile(List<SourceKey> selection) {
        Map<SourceKey, PendingItem> pendingByKey = findPending().stream()
            .collect(Collectors.toMap(PendingItem::getKey, Function.identity()));

        List<PendingItem> toImport = new ArrayList<>();
        List<AbsorptionFailure> notPending = new ArrayList<>();
        for (SourceKey key : selection.stream().distinct().toList()) {
            PendingItem item = pendingByKey.get(key);
            if (item == null) {
                notPending.add(AbsorptionFailure.notPending(key));
            } else {
                toImport.add(item);
            }
        }

        ImportResult result = metrics.timeOperation("inventory.import", () -> pipeline.importItems(toImport))
            .withFailures(notPending);
        if (result.hasFailures()) {
            log.warn("Inventory import completed with {} failure(s): {}",
                result.getFailures().size(), result.getFailures());
        }
        return new ImportOutcome(result, findPending());
    }
}
