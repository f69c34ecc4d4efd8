package com.flagship.textile_ledger.inventory;

import lombok.Value;

/**
 * Why one selected item was not imported. The rest of the batch is unaffected.
 */
@Value
public class AbsorptionFailure {
    SourceKey source;
    String errorType;
    String message;

    public static AbsorptionFailure of(SourceKey source, Exception cause) {
        String message = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
        return new AbsorptionFailure(source, cause.getClass().getSimpleName(), message);
    }

    public static AbsorptionFailure notPending(SourceKey source) {
        return new AbsorptionFailure(source, "NotPending",
            source + " is not pending: it is unknown, incomplete or already in inventory");
    }
}
