package com.tradeledger.common.address;

/**
 * Maps an address in any supported encoding to the single key form used for persistence and lookups.
 */
public class AddressCanonicalizer {

    private final AddressEncoding encoding;

    public AddressCanonicalizer(AddressEncoding encoding) {
        this.encoding = encoding != null ? encoding : AddressEncoding.HEX;
    }

    /**
     * @throws AddressDecodeException when the input is not a valid TRON address
     */
    public String canonicalize(String address) {
        return encoding.render(TronAddress.parse(address));
    }

    public AddressEncoding getEncoding() {
        return encoding;
    }
}
