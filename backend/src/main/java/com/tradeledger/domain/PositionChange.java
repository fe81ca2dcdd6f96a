package com.tradeledger.domain;

/**
 * What a transition does to the open_positions row of its token.
 */
public enum PositionChange {
    UPSERT,
    DELETE,
    NONE
}
