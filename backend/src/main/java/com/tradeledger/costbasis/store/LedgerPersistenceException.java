package com.tradeledger.costbasis.store;

/**
 * Thrown when a ledger read or write did not reach the store. The event it belongs to must not be acknowledged.
 */
public class LedgerPersistenceException extends RuntimeException {

    public LedgerPersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
