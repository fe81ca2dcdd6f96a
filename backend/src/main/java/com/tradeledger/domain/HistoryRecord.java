package com.tradeledger.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Append-only trade log entry, one per processed domain event. eventUid is the idempotency key (unique index);
 * a second insert with the same uid is rejected by the store. All monetary/quantity fields are BigDecimal.
 */
@Document(collection = "trade_history")
@CompoundIndex(name = "token_block_index", def = "{'tokenKey': 1, 'blockNumber': 1, 'eventIndex': 1}")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class HistoryRecord {

    @Id
    private String id;
    @Indexed(unique = true)
    @EqualsAndHashCode.Include
    private String eventUid;
    private Long tradeIdOnchain;
    private String tokenKey;
    private TradeAction action;
    private BigDecimal price;
    private BigDecimal amount;
    private BigDecimal avgEntryPrice;
    private BigDecimal avgExitPrice;
    private BigDecimal pnl;
    private String strategy;
    private String trader;
    private String eventName;
    private String txId;
    private long blockNumber;
    private int eventIndex;
    private Instant blockTimestamp;
    private Instant recordedAt;
    /** False while the position write below is outstanding; null on rows that predate the flag. */
    private Boolean positionApplied;
    private PositionChange positionChange;
    /** Post-event position to upsert; set only while an UPSERT is outstanding. */
    private OpenPosition pendingPosition;

    public boolean positionWritePending() {
        return Boolean.FALSE.equals(positionApplied) && positionChange != null;
    }
}
