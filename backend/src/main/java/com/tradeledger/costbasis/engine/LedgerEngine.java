package com.tradeledger.costbasis.engine;

import com.tradeledger.domain.DomainEvent;
import com.tradeledger.domain.HistoryRecord;
import com.tradeledger.domain.OpenPosition;
import com.tradeledger.domain.PositionChange;
import com.tradeledger.domain.TradeAction;
import com.tradeledger.domain.TradeClosedEvent;
import com.tradeledger.domain.TradeOpenedEvent;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Instant;

/**
 * Per-token weighted-average cost engine. Pure transition: (current position, event) -&gt; (new position, history row).
 * Holds no state between calls; redelivery protection lives in the store's unique event uid.
 * <ul>
 *   <li>BUY opens a position or merges into the live one; the opening tradeIdOnchain is kept.</li>
 *   <li>SELL realizes (exit - avgEntry) * sellAmount on min(requested, open); avgEntry is unchanged by sells.</li>
 *   <li>SELL with no live position is a zero-effect row (amount 0, pnl null).</li>
 * </ul>
 */
public class LedgerEngine {

    static final int SCALE = 18;
    private static final RoundingMode ROUNDING = RoundingMode.HALF_UP;

    private final BigDecimal pnlTolerance;
    private final Clock clock;

    /**
     * @param pnlTolerance max absolute difference between reported and computed PnL before a divergence is flagged
     * @param clock        source for updatedAt / recordedAt
     */
    public LedgerEngine(BigDecimal pnlTolerance, Clock clock) {
        this.pnlTolerance = pnlTolerance != null ? pnlTolerance.abs() : BigDecimal.ZERO;
        this.clock = clock;
    }

    public LedgerTransition apply(OpenPosition state, DomainEvent event) {
        if (event instanceof TradeOpenedEvent opened) {
            if (opened.action() == TradeAction.SELL) {
                return sell(state, event, opened.amount(), null, opened.strategy());
            }
            return buy(state, opened);
        }
        if (event instanceof TradeClosedEvent closed) {
            return sell(state, event, closed.amount(), closed.reportedPnl(), null);
        }
        throw new IllegalArgumentException("Unsupported domain event type: " + event.getClass().getName());
    }

    private LedgerTransition buy(OpenPosition state, TradeOpenedEvent event) {
        Instant now = clock.instant();
        HistoryRecord history = baseHistory(event, TradeAction.BUY, now);
        history.setAmount(event.amount());
        history.setStrategy(event.strategy());

        if (state == null || !state.isLive()) {
            history.setAvgEntryPrice(event.price());
            BigDecimal amount = quantize(event.amount(), event.tokenDecimals());
            if (amount.signum() <= 0) {
                // Nothing to hold; drop a stale zero row if one is lying around.
                PositionChange change = state != null ? PositionChange.DELETE : PositionChange.NONE;
                return new LedgerTransition(null, change, event.tokenKey(), history, null);
            }
            OpenPosition opened = new OpenPosition();
            opened.setTokenKey(event.tokenKey());
            opened.setTradeIdOnchain(event.tradeId());
            opened.setAvgEntryPrice(event.price());
            opened.setAmount(event.amount());
            opened.setStrategy(event.strategy());
            opened.setTrader(event.trader());
            touch(opened, event, now);
            return new LedgerTransition(opened, PositionChange.UPSERT, event.tokenKey(), history, null);
        }

        BigDecimal oldAmount = state.getAmount();
        BigDecimal oldAvg = state.getAvgEntryPrice() != null ? state.getAvgEntryPrice() : BigDecimal.ZERO;
        BigDecimal newAmount = oldAmount.add(event.amount());
        BigDecimal newAvg = newAmount.signum() == 0
                ? event.price()
                : oldAvg.multiply(oldAmount).add(event.price().multiply(event.amount())).divide(newAmount, SCALE, ROUNDING);

        OpenPosition merged = state.copy();
        merged.setAvgEntryPrice(newAvg);
        merged.setAmount(newAmount);
        merged.setStrategy(firstNonBlank(event.strategy(), state.getStrategy()));
        merged.setTrader(event.trader());
        touch(merged, event, now);
        history.setAvgEntryPrice(newAvg);
        return new LedgerTransition(merged, PositionChange.UPSERT, event.tokenKey(), history, null);
    }

    private LedgerTransition sell(OpenPosition state, DomainEvent event, BigDecimal requested,
                                  BigDecimal reportedPnl, String strategyHint) {
        Instant now = clock.instant();
        HistoryRecord history = baseHistory(event, TradeAction.SELL, now);
        history.setAvgExitPrice(event.price());

        if (state == null || !state.isLive()) {
            history.setAmount(BigDecimal.ZERO);
            history.setPnl(null);
            history.setStrategy(strategyHint);
            return new LedgerTransition(null, PositionChange.NONE, event.tokenKey(), history, null);
        }

        BigDecimal openAmount = state.getAmount();
        BigDecimal avgEntry = state.getAvgEntryPrice() != null ? state.getAvgEntryPrice() : BigDecimal.ZERO;
        BigDecimal sellAmount = requested != null ? requested.min(openAmount) : openAmount;
        BigDecimal realized = event.price().subtract(avgEntry).multiply(sellAmount).setScale(SCALE, ROUNDING);
        BigDecimal remaining = quantize(openAmount.subtract(sellAmount), event.tokenDecimals());

        history.setAvgEntryPrice(avgEntry);
        history.setAmount(sellAmount);
        history.setPnl(reportedPnl != null ? reportedPnl : realized);
        history.setStrategy(firstNonBlank(strategyHint, state.getStrategy()));

        PnlDivergence divergence = null;
        if (reportedPnl != null && reportedPnl.subtract(realized).abs().compareTo(pnlTolerance) > 0) {
            divergence = new PnlDivergence(event.eventUid(), event.tokenKey(), reportedPnl, realized);
        }

        if (remaining.signum() == 0) {
            return new LedgerTransition(null, PositionChange.DELETE, event.tokenKey(), history, divergence);
        }
        OpenPosition reduced = state.copy();
        reduced.setAmount(remaining);
        reduced.setStrategy(firstNonBlank(strategyHint, state.getStrategy()));
        reduced.setTrader(event.trader() != null ? event.trader() : state.getTrader());
        touch(reduced, event, now);
        return new LedgerTransition(reduced, PositionChange.UPSERT, event.tokenKey(), history, divergence);
    }

    private static HistoryRecord baseHistory(DomainEvent event, TradeAction action, Instant now) {
        HistoryRecord h = new HistoryRecord();
        h.setEventUid(event.eventUid());
        h.setTradeIdOnchain(event.tradeId());
        h.setTokenKey(event.tokenKey());
        h.setAction(action);
        h.setPrice(event.price());
        h.setTrader(event.trader());
        h.setEventName(event.eventName());
        h.setTxId(event.txId());
        h.setBlockNumber(event.blockNumber());
        h.setEventIndex(event.eventIndex());
        h.setBlockTimestamp(event.blockTimestamp());
        h.setRecordedAt(now);
        return h;
    }

    private static void touch(OpenPosition position, DomainEvent event, Instant now) {
        position.setLastTxId(event.txId());
        position.setLastEventUid(event.eventUid());
        position.setUpdatedAt(now);
    }

    /** Round to the precision implied by the token's decimal count. */
    static BigDecimal quantize(BigDecimal amount, int tokenDecimals) {
        return amount.setScale(Math.max(0, tokenDecimals), ROUNDING);
    }

    private static String firstNonBlank(String preferred, String fallback) {
        return preferred != null && !preferred.isBlank() ? preferred : fallback;
    }
}
