package com.flagship.textile_ledger.inventory;

import lombok.Value;

import java.util.Objects;

/**
 * Identity of a production record: at most one pending item and at most one
 * absorbing inventory transaction exist per key.
 */
@Value
public class SourceKey {
    SourceKind sourceKind;
    long sourceId;

    private SourceKey(SourceKind sourceKind, long sourceId) {
        this.sourceKind = Objects.requireNonNull(sourceKind, "sourceKind");
        this.sourceId = sourceId;
    }

    public static SourceKey of(SourceKind sourceKind, long sourceId) {
        return new SourceKey(sourceKind, sourceId);
    }

    @Override
    public String toString() {
        return sourceKind + ":" + sourceId;
    }
}
