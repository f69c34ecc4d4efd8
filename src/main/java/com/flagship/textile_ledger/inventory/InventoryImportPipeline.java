package com.flagship.textile_ledger.inventory;

import com.flagship.textile_ledger.observability.CorrelationContext;
import com.flagship.textile_ledger.observability.LedgerMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Imports a user selection of pending items, one at a time.
 *
 * Each item is absorbed in its own transaction, so item N+1 sees the committed
 * result of item N. A failing item is recorded and the batch moves on; nothing
 * is thrown to the caller. Selecting the same key twice imports it once.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class InventoryImportPipeline {

    private final InventoryAbsorber absorber;
    private final LedgerMetrics metrics;

    public ImportResult importItems(List<PendingItem> selected) {
        Map<SourceKey, PendingItem> unique = new LinkedHashMap<>();
        for (PendingItem item : selected) {
            unique.putIfAbsent(item.getKey(), item);
        }

        List<ImportedItem> imported = new ArrayList<>();
        List<AbsorptionFailure> failures = new ArrayList<>();

        for (PendingItem item : unique.values()) {
            MDC.put(CorrelationContext.SOURCE_KEY_MDC_KEY, item.getKey().toString());
            try {
                imported.add(absorber.absorb(item));
                metrics.recordAbsorption(item.getSourceKind().name(), true);
                log.info("Imported {} ({}) into inventory", item.getKey(), item.getName());
            } catch (RuntimeException e) {
                failures.add(AbsorptionFailure.of(item.getKey(), e));
                metrics.recordAbsorption(item.getSourceKind().name(), false);
                log.warn("Failed to import {} into inventory: {}", item.getKey(), e.getMessage());
            } finally {
                MDC.remove(CorrelationContext.SOURCE_KEY_MDC_KEY);
            }
        }

        log.info("Inventory import finished: selected={}, imported={}, failed={}",
                unique.size(), imported.size(), failures.size());
        return new ImportResult(List.copyOf(imported), List.copyOf(failures));
    }
}
