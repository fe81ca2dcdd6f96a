package com.tradeledger.domain;

/**
 * Direction of a ledger entry.
 */
public enum TradeAction {
    BUY,
    SELL;

    /**
     * Lenient parse for the contract's free-form action field; null or blank means BUY.
     */
    public static TradeAction fromContractValue(String value) {
        if (value == null || value.isBlank()) {
            return BUY;
        }
        return TradeAction.valueOf(value.strip().toUpperCase());
    }
}
