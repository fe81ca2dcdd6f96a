package com.tradeledger.ingestion.source;

/**
 * Thrown when the event source is unreachable, times out, rate-limits or answers with an error.
 * Retryable: the caller decides whether to back off and try again.
 */
public class EventSourceException extends RuntimeException {

    public EventSourceException(String message) {
        super(message);
    }

    public EventSourceException(String message, Throwable cause) {
        super(message, cause);
    }
}
