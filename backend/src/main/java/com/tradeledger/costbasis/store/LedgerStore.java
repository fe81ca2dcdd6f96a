package com.tradeledger.costbasis.store;

import com.tradeledger.costbasis.engine.LedgerTransition;
import com.tradeledger.domain.HistoryRecord;
import com.tradeledger.domain.OpenPosition;
import com.tradeledger.domain.PositionChange;

import java.util.Optional;

/**
 * Row store for the two ledger collections: open positions keyed by token, history keyed by unique event uid.
 * Implementations throw {@link LedgerPersistenceException} on any storage failure.
 */
public interface LedgerStore {

    Optional<OpenPosition> findOpenPosition(String tokenKey);

    void upsertOpenPosition(OpenPosition position);

    void deleteOpenPosition(String tokenKey);

    Optional<HistoryRecord> findHistory(String eventUid);

    default boolean historyExists(String eventUid) {
        return findHistory(eventUid).isPresent();
    }

    /**
     * Insert-or-ignore by eventUid.
     *
     * @return true when inserted, false when a row with the same eventUid already existed
     */
    boolean insertHistoryIfAbsent(HistoryRecord record);

    /** Persists the positionApplied flag (and cleared snapshot) of an already inserted history row. */
    void markPositionApplied(HistoryRecord record);

    /**
     * Writes one transition: history first, carrying the intended position write, then the position itself,
     * then the history row is marked applied. When the history row already exists the position is left untouched
     * so a redelivered event cannot realize PnL twice. A row left unmarked by a failed position write is finished
     * later through {@link #completePositionWrite(HistoryRecord)}.
     */
    default CommitOutcome commit(LedgerTransition transition) {
        HistoryRecord history = transition.history();
        history.setPositionChange(transition.change());
        history.setPendingPosition(transition.change() == PositionChange.UPSERT ? transition.newState() : null);
        history.setPositionApplied(transition.change() == PositionChange.NONE);
        if (!insertHistoryIfAbsent(history)) {
            return CommitOutcome.DUPLICATE;
        }
        if (transition.change() != PositionChange.NONE) {
            completePositionWrite(history);
        }
        return CommitOutcome.APPLIED;
    }

    /**
     * Performs the position write recorded on a history row and marks the row applied. Replaying it is safe:
     * the row holds the absolute post-event state, not a delta.
     */
    default void completePositionWrite(HistoryRecord history) {
        switch (history.getPositionChange()) {
            case UPSERT -> upsertOpenPosition(history.getPendingPosition());
            case DELETE -> deleteOpenPosition(history.getTokenKey());
            case NONE -> { }
        }
        history.setPositionApplied(true);
        history.setPendingPosition(null);
        markPositionApplied(history);
    }
}
