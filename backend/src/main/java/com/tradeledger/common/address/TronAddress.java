package com.tradeledger.common.address;

import java.util.Arrays;
import java.util.HexFormat;
import java.util.regex.Pattern;

/**
 * A TRON account or contract address: 21 bytes, version byte 0x41 followed by the 20-byte account id.
 * Parses either Base58Check ({@code T...}) or hex ({@code 41...}, optionally {@code 0x}-prefixed, or a bare 20-byte body).
 */
public final class TronAddress {

    public static final byte VERSION_BYTE = 0x41;
    static final int LENGTH = 21;

    private static final Pattern HEX_21 = Pattern.compile("^41[0-9a-fA-F]{40}$");
    private static final Pattern HEX_20 = Pattern.compile("^[0-9a-fA-F]{40}$");
    private static final HexFormat HEX = HexFormat.of();

    private final byte[] bytes;

    private TronAddress(byte[] bytes) {
        this.bytes = bytes;
    }

    public static TronAddress parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new AddressDecodeException("Address is empty");
        }
        String a = raw.strip();
        boolean prefixed = a.startsWith("0x") || a.startsWith("0X");
        String hex = prefixed ? a.substring(2) : a;
        if (HEX_21.matcher(hex).matches()) {
            return new TronAddress(HEX.parseHex(hex.toLowerCase()));
        }
        if (HEX_20.matcher(hex).matches()) {
            return new TronAddress(HEX.parseHex("41" + hex.toLowerCase()));
        }
        if (prefixed) {
            throw new AddressDecodeException("Malformed hex address: " + raw);
        }
        byte[] payload = Base58Check.decode(a);
        if (payload.length != LENGTH) {
            throw new AddressDecodeException("Base58 address must decode to " + LENGTH + " bytes, got " + payload.length);
        }
        if (payload[0] != VERSION_BYTE) {
            throw new AddressDecodeException("Unexpected address version byte: " + String.format("0x%02x", payload[0]));
        }
        return new TronAddress(payload);
    }

    /** Lowercase hex with the 41 version prefix, no 0x. */
    public String toHex() {
        return HEX.formatHex(bytes);
    }

    /** Base58Check form, starts with T. */
    public String toBase58() {
        return Base58Check.encode(bytes);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TronAddress)) return false;
        return Arrays.equals(bytes, ((TronAddress) o).bytes);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(bytes);
    }

    @Override
    public String toString() {
        return toBase58();
    }
}
