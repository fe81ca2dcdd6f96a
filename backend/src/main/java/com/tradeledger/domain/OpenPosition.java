package com.tradeledger.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Live position per token. Exists iff amount &gt; 0. The document id is the canonical token key, so there is
 * at most one row per token. tradeIdOnchain belongs to the event that opened the position and survives merges.
 */
@Document(collection = "open_positions")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class OpenPosition {

    @Id
    @EqualsAndHashCode.Include
    private String tokenKey;
    private Long tradeIdOnchain;
    private BigDecimal avgEntryPrice;
    private BigDecimal amount;
    private String strategy;
    private String trader;
    private String lastTxId;
    private String lastEventUid;
    private Instant updatedAt;

    public OpenPosition copy() {
        OpenPosition c = new OpenPosition();
        c.setTokenKey(tokenKey);
        c.setTradeIdOnchain(tradeIdOnchain);
        c.setAvgEntryPrice(avgEntryPrice);
        c.setAmount(amount);
        c.setStrategy(strategy);
        c.setTrader(trader);
        c.setLastTxId(lastTxId);
        c.setLastEventUid(lastEventUid);
        c.setUpdatedAt(updatedAt);
        return c;
    }

    public boolean isLive() {
        return amount != null && amount.signum() > 0;
    }
}
