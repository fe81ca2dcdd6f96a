package com.tradeledger.domain;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * TradeOpen contract event. action is BUY for position entries; SELL reduces an existing position by amount.
 */
public record TradeOpenedEvent(
        String eventUid,
        String txId,
        long blockNumber,
        int eventIndex,
        Instant blockTimestamp,
        Long tradeId,
        String trader,
        String tokenKey,
        String strategy,
        TradeAction action,
        BigDecimal price,
        BigDecimal amount,
        int tokenDecimals
) implements DomainEvent {

    public static final String EVENT_NAME = "TradeOpen";

    @Override
    public String eventName() {
        return EVENT_NAME;
    }
}
