package com.tradeledger.common.address;

/**
 * Thrown when an address string is in neither supported encoding or fails its checksum.
 */
public class AddressDecodeException extends RuntimeException {

    public AddressDecodeException(String message) {
        super(message);
    }
}
