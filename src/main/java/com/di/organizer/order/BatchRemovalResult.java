package com.di.organizer.order;

import lombok.Value;

/**
 * Outcome of a batch removal by production order number.
 */
@Value
public class BatchRemovalResult {

    /** True only when the table was written and at least one order was removed. */
    boolean success;
    /** Orders actually removed. */
    int removed;
    /** Distinct non-blank order numbers requested. */
    int requested;

    public static BatchRemovalResult nothingRequested() {
        return new BatchRemovalResult(false, 0, 0);
    }
}
