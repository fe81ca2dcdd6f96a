package com.tradeledger.ingestion.source;

import java.util.List;

/**
 * One page of events. Events are in delivery order, which is not chain order.
 *
 * @param events     page contents
 * @param nextCursor cursor for the following page; null when no more history is currently available
 */
public record EventPage(List<RawEvent> events, String nextCursor) {

    public EventPage {
        events = events != null ? List.copyOf(events) : List.of();
        nextCursor = nextCursor != null && !nextCursor.isBlank() ? nextCursor : null;
    }

    public boolean hasNext() {
        return nextCursor != null;
    }
}
