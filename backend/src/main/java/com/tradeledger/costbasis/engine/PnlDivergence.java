package com.tradeledger.costbasis.engine;

import java.math.BigDecimal;

/**
 * Upstream-reported PnL that disagrees with the locally computed realized PnL for the same close.
 * The reported value is the one recorded in history.
 */
public record PnlDivergence(String eventUid, String tokenKey, BigDecimal reportedPnl, BigDecimal computedPnl) {

    public BigDecimal difference() {
        return reportedPnl.subtract(computedPnl);
    }
}
