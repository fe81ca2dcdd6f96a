package com.tradeledger.costbasis.engine;

import com.tradeledger.costbasis.store.CommitOutcome;
import com.tradeledger.costbasis.store.LedgerStore;
import com.tradeledger.domain.DomainEvent;
import com.tradeledger.domain.HistoryRecord;
import com.tradeledger.domain.OpenPosition;
import com.tradeledger.notification.Alert;
import com.tradeledger.notification.AlertNotifier;
import com.tradeledger.notification.AlertSeverity;
import com.tradeledger.notification.AlertType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Materializes one domain event: skip if its history row exists, otherwise load the token's position,
 * run {@link LedgerEngine} and commit the transition through {@link LedgerStore}. A history row whose position
 * write never landed is finished from the row instead of being treated as a duplicate.
 * Callers must feed events in chain order, one at a time per contract.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LedgerEventApplier {

    private final LedgerEngine ledgerEngine;
    private final LedgerStore ledgerStore;
    private final AlertNotifier alertNotifier;

    /**
     * @throws com.tradeledger.costbasis.store.LedgerPersistenceException when the store is unavailable
     */
    public CommitOutcome apply(DomainEvent event) {
        Optional<HistoryRecord> existing = ledgerStore.findHistory(event.eventUid());
        if (existing.isPresent()) {
            HistoryRecord row = existing.get();
            if (row.positionWritePending()) {
                log.warn("Event {} ({} block {} idx {}) has history but no position write; replaying {} for {}",
                        event.eventUid(), event.eventName(), event.blockNumber(), event.eventIndex(),
                        row.getPositionChange(), row.getTokenKey());
                ledgerStore.completePositionWrite(row);
                return CommitOutcome.APPLIED;
            }
            log.debug("Event {} ({} block {} idx {}) already materialized", event.eventUid(),
                    event.eventName(), event.blockNumber(), event.eventIndex());
            return CommitOutcome.DUPLICATE;
        }
        OpenPosition current = ledgerStore.findOpenPosition(event.tokenKey()).orElse(null);
        LedgerTransition transition = ledgerEngine.apply(current, event);
        CommitOutcome outcome = ledgerStore.commit(transition);
        if (outcome == CommitOutcome.APPLIED && transition.hasDivergence()) {
            raiseDivergence(transition.divergence());
        }
        return outcome;
    }

    private void raiseDivergence(PnlDivergence divergence) {
        alertNotifier.notify(Alert.builder()
                .type(AlertType.PNL_DIVERGENCE)
                .severity(AlertSeverity.WARNING)
                .title("Reported PnL differs from computed PnL")
                .message("token=" + divergence.tokenKey()
                        + " event=" + divergence.eventUid()
                        + " reported=" + divergence.reportedPnl().toPlainString()
                        + " computed=" + divergence.computedPnl().toPlainString()
                        + " diff=" + divergence.difference().toPlainString())
                .build());
    }
}
