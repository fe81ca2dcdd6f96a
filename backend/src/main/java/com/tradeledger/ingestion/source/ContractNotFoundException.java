package com.tradeledger.ingestion.source;

/**
 * The event source does not know the configured contract (HTTP 404). A configuration error: never retried.
 */
public class ContractNotFoundException extends RuntimeException {

    private final String contract;

    public ContractNotFoundException(String contract, String message, Throwable cause) {
        super(message, cause);
        this.contract = contract;
    }

    public String getContract() {
        return contract;
    }
}
