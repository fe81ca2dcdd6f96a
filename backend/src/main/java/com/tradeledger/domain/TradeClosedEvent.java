package com.tradeledger.domain;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * TradeClosed contract event. amount is null for a full close; reportedPnl is the contract's own PnL, when emitted.
 */
public record TradeClosedEvent(
        String eventUid,
        String txId,
        long blockNumber,
        int eventIndex,
        Instant blockTimestamp,
        Long tradeId,
        String trader,
        String tokenKey,
        BigDecimal price,
        BigDecimal amount,
        BigDecimal reportedPnl,
        int tokenDecimals
) implements DomainEvent {

    public static final String EVENT_NAME = "TradeClosed";

    @Override
    public String eventName() {
        return EVENT_NAME;
    }
}
