package com.flagship.textile_ledger.inventory.dto;

import com.flagship.textile_ledger.inventory.SourceKey;
import com.flagship.textile_ledger.inventory.SourceKind;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * Body of {@code POST /api/inventory/import}: the pending items the user ticked.
 */
@Value
@Builder
@Jacksonized
public class ImportRequest {

    @NotEmpty(message = "Select at least one item")
    @Valid
    List<Selection> items;

    public List<SourceKey> toSourceKeys() {
        return items.stream().map(s -> SourceKey.of(s.getSourceKind(), s.getSourceId())).toList();
    }

    @Value
    @Builder
    @Jacksonized
    public static class Selection {
        @NotNull(message = "Source kind is required")
        SourceKind sourceKind;

        @NotNull(message = "Source id is required")
        @Positive
        Long sourceId;
    }
}
