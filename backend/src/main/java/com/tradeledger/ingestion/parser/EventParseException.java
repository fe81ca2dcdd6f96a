package com.tradeledger.ingestion.parser;

/**
 * A single event could not be turned into a domain event. The event is skipped; the page continues.
 */
public class EventParseException extends RuntimeException {

    public EventParseException(String message) {
        super(message);
    }

    public EventParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
