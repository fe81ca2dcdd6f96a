package com.tradeledger.costbasis.store;

/**
 * Result of committing one transition.
 */
public enum CommitOutcome {
    /** History row inserted and position written. */
    APPLIED,
    /** History row for this event uid already existed; nothing was written. */
    DUPLICATE
}
