package com.tradeledger.ingestion.source;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Comparator;

/**
 * One event envelope as delivered by the event source, before parsing.
 *
 * @param txId           transaction id
 * @param blockNumber    block the event was emitted in; 0 when the envelope omitted it
 * @param blockTimestamp block time in epoch millis, nullable
 * @param eventIndex     position of the event within its transaction
 * @param eventName      contract event name, e.g. TradeOpen
 * @param result         decoded event arguments as delivered (chain-native integers, often as strings)
 */
public record RawEvent(
        String txId,
        long blockNumber,
        Long blockTimestamp,
        int eventIndex,
        String eventName,
        JsonNode result
) {

    public static final Comparator<RawEvent> CHAIN_ORDER = Comparator
            .comparingLong(RawEvent::blockNumber)
            .thenComparingInt(RawEvent::eventIndex);
}
