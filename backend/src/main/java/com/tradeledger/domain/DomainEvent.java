package com.tradeledger.domain;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Typed contract event ready for the ledger. Implementations are immutable records built by the event parser.
 * Ordering across a contract is (blockNumber, eventIndex).
 */
public interface DomainEvent {

    String eventUid();

    String eventName();

    String txId();

    long blockNumber();

    int eventIndex();

    /** Nullable: not every envelope carries a block timestamp. */
    Instant blockTimestamp();

    Long tradeId();

    String trader();

    String tokenKey();

    BigDecimal price();

    /** Decimal count of the traded token, used to quantize remaining amounts. */
    int tokenDecimals();
}
