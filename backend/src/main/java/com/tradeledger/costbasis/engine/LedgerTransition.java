package com.tradeledger.costbasis.engine;

import com.tradeledger.domain.HistoryRecord;
import com.tradeledger.domain.OpenPosition;
import com.tradeledger.domain.PositionChange;

/**
 * Result of applying one domain event: the position write (if any), the history row, and an optional PnL divergence.
 *
 * @param newState   position to upsert when change is UPSERT; null otherwise
 * @param change     position write to perform
 * @param tokenKey   token the transition belongs to
 * @param history    history row to insert (always present)
 * @param divergence non-null when the reported PnL differs from the computed one
 */
public record LedgerTransition(
        OpenPosition newState,
        PositionChange change,
        String tokenKey,
        HistoryRecord history,
        PnlDivergence divergence
) {

    public boolean hasDivergence() {
        return divergence != null;
    }
}
