package com.flagship.textile_ledger.inventory;

import lombok.Value;

import java.util.ArrayList;
import java.util.List;

@Value
public class ImportResult {
    List<ImportedItem> imported;
    List<AbsorptionFailure> failures;

    public boolean hasFailures() {
        return !failures.isEmpty();
    }

    /**
     * Same imports, with {@code extra} failures listed first.
     */
    public ImportResult withFailures(List<AbsorptionFailure> extra) {
        if (extra.isEmpty()) {
            return this;
        }
        List<AbsorptionFailure> all = new ArrayList<>(extra);
        all.addAll(failures);
        return new ImportResult(imported, List.copyOf(all));
    }
}
