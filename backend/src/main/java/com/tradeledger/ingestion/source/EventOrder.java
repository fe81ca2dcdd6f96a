package com.tradeledger.ingestion.source;

/**
 * Page ordering requested from the event source. Within a page the caller still sorts by chain position.
 */
public enum EventOrder {
    /** History walk for backfill: cursors move forward in chain time. */
    OLDEST_FIRST("block_timestamp,asc"),
    /** Source default; the first page holds the latest events. */
    NEWEST_FIRST("block_timestamp,desc");

    private final String queryValue;

    EventOrder(String queryValue) {
        this.queryValue = queryValue;
    }

    public String queryValue() {
        return queryValue;
    }
}
