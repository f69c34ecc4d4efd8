package com.flagship.textile_ledger.inventory;

import lombok.Getter;

/**
 * The production record already has an inventory transaction pointing at it.
 */
@Getter
public class DuplicateAbsorptionException extends RuntimeException {

    private final transient SourceKey source;

    public DuplicateAbsorptionException(SourceKey source) {
        super(source + " has already been absorbed into inventory");
        this.source = source;
    }
}
