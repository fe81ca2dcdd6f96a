package com.tradeledger.common.address;

/**
 * Encoding used for persisted address keys.
 */
public enum AddressEncoding {
    HEX,
    BASE58;

    public String render(TronAddress address) {
        return this == BASE58 ? address.toBase58() : address.toHex();
    }
}
