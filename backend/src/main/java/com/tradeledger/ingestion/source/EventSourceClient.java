package com.tradeledger.ingestion.source;

/**
 * Paginated access to confirmed contract events.
 */
public interface EventSourceClient {

    /**
     * Fetch one page of confirmed events.
     *
     * @param contract contract address in either encoding
     * @param cursor   cursor returned by the previous page, or null for the first page
     * @param order    direction of the page walk
     * @return events (unsorted) and the next cursor, if any
     * @throws EventSourceException       on network failure, timeout or non-404 HTTP errors (retryable)
     * @throws ContractNotFoundException  when the source answers 404 for the contract (fatal)
     */
    EventPage fetchPage(String contract, String cursor, EventOrder order);

    /** Newest-first page, as the source serves by default. */
    default EventPage fetchPage(String contract, String cursor) {
        return fetchPage(contract, cursor, EventOrder.NEWEST_FIRST);
    }
}
