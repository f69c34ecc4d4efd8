package com.flagship.textile_ledger.ledger;

import com.flagship.textile_ledger.observability.LedgerMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.util.List;

/**
 * Read side of the unified ledger. Every entry leaves here normalized and repaired.
 */
@Service
@RequiredArgsConstructor
@Slf4j
@Transactional(readOnly = true)
public class LedgerQueryService {

    private final LedgerRecordStore store;
    private final LedgerEntryNormalizer normalizer;
    private final LedgerConsistencyRepair repair;
    private final LedgerAggregator aggregator;
    private final LedgerMetrics metrics;

    /**
     * @param khataId  optional khata scope
     * @param category optional category filter; the summary ignores it
     */
    public LedgerListing list(Long khataId, EntryCategory category, LocalDate asOf) {
        return metrics.timeOperation("ledger.list", () -> {
            List<RepairReport> reports = store.findAll(khataId).stream()
                .map(this::read)
                .toList();
            LedgerSummary summary = aggregator.summarize(
                reports.stream().map(RepairReport::getEntry).toList(), asOf);
            List<RepairReport> visible = category == null
                ? reports
                : reports.stream().filter(r -> r.getEntry().getCategory() == category).toList();
            log.debug("Listed {} of {} ledger entries (khata={}, category={})",
                visible.size(), reports.size(), khataId, category);
            return new LedgerListing(visible, summary);
        });
    }

    public RepairReport get(EntryId id) {
        return store.findById(id)
            .map(this::read)
            .orElseThrow(() -> new LedgerEntryNotFoundException(id));
    }

    public LedgerSummary summarize(Long khataId, LocalDate asOf) {
        return aggregator.summarize(
            store.findAll(khataId).stream().map(this::read).map(RepairReport::getEntry).toList(), asOf);
    }

    private RepairReport read(RawLedgerRecord raw) {
        RepairReport report = repair.inspect(normalizer.normalize(raw));
        report.getActions().forEach(action -> metrics.recordRepair(action.name()));
        return report;
    }
}
