package com.flagship.textile_ledger.inventory.dto;

import com.flagship.textile_ledger.inventory.AbsorptionFailure;
import com.flagship.textile_ledger.inventory.ImportOutcome;
import com.flagship.textile_ledger.inventory.ImportedItem;
import com.flagship.textile_ledger.inventory.SourceKind;
import lombok.Value;

import java.util.List;

@Value
public class ImportResponse {
    List<Imported> imported;
    List<Failure> failures;
    List<PendingItemResponse> pending;

    public static ImportResponse from(ImportOutcome outcome) {
        return new ImportResponse(
            outcome.getResult().getImported().stream().map(Imported::from).toList(),
            outcome.getResult().getFailures().stream().map(Failure::from).toList(),
            outcome.getPending().stream().map(PendingItemResponse::from).toList());
    }

    @Value
    public static class Imported {
        SourceKind sourceKind;
        long sourceId;
        long inventoryItemId;
        long inventoryTransactionId;
        String itemCode;

        static Imported from(ImportedItem item) {
            return new Imported(item.getSource().getSourceKind(), item.getSource().getSourceId(),
                item.getInventoryItemId(), item.getInventoryTransactionId(), item.getItemCode());
        }
    }

    @Value
    public static class Failure {
        SourceKind sourceKind;
        long sourceId;
        String error;
        String message;

        static Failure from(AbsorptionFailure failure) {
            return new Failure(failure.getSource().getSourceKind(), failure.getSource().getSourceId(),
                failure.getErrorType(), failure.getMessage());
        }
    }
}
