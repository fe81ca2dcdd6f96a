package com.tradeledger.common.address;

import java.math.BigInteger;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Arrays;

/**
 * Base58Check codec (Bitcoin alphabet) as used by TRON addresses: payload followed by the first
 * four bytes of SHA-256(SHA-256(payload)).
 */
final class Base58Check {

    private static final String ALPHABET = "123456789ABCDEFGHJKLMNPQRSTUVWXYZabcdefghijkmnopqrstuvwxyz";
    private static final BigInteger BASE = BigInteger.valueOf(58);
    private static final int CHECKSUM_LENGTH = 4;

    private Base58Check() {
    }

    static String encode(byte[] payload) {
        byte[] checksum = checksum(payload);
        byte[] full = Arrays.copyOf(payload, payload.length + CHECKSUM_LENGTH);
        System.arraycopy(checksum, 0, full, payload.length, CHECKSUM_LENGTH);

        StringBuilder sb = new StringBuilder();
        BigInteger num = new BigInteger(1, full);
        while (num.signum() > 0) {
            BigInteger[] qr = num.divideAndRemainder(BASE);
            sb.append(ALPHABET.charAt(qr[1].intValue()));
            num = qr[0];
        }
        for (int i = 0; i < full.length && full[i] == 0; i++) {
            sb.append(ALPHABET.charAt(0));
        }
        return sb.reverse().toString();
    }

    /**
     * Decodes and verifies the checksum. Returns the payload without the checksum.
     */
    static byte[] decode(String input) {
        BigInteger num = BigInteger.ZERO;
        for (int i = 0; i < input.length(); i++) {
            int digit = ALPHABET.indexOf(input.charAt(i));
            if (digit < 0) {
                throw new AddressDecodeException("Invalid base58 character '" + input.charAt(i) + "'");
            }
            num = num.multiply(BASE).add(BigInteger.valueOf(digit));
        }
        byte[] magnitude = num.signum() == 0 ? new byte[0] : stripSignByte(num.toByteArray());
        int leadingZeros = 0;
        while (leadingZeros < input.length() && input.charAt(leadingZeros) == ALPHABET.charAt(0)) {
            leadingZeros++;
        }
        byte[] full = new byte[leadingZeros + magnitude.length];
        System.arraycopy(magnitude, 0, full, leadingZeros, magnitude.length);
        if (full.length <= CHECKSUM_LENGTH) {
            throw new AddressDecodeException("Base58 string too short");
        }
        byte[] payload = Arrays.copyOfRange(full, 0, full.length - CHECKSUM_LENGTH);
        byte[] actual = Arrays.copyOfRange(full, full.length - CHECKSUM_LENGTH, full.length);
        if (!MessageDigest.isEqual(checksum(payload), actual)) {
            throw new AddressDecodeException("Invalid base58 checksum");
        }
        return payload;
    }

    private static byte[] stripSignByte(byte[] bytes) {
        if (bytes.length > 1 && bytes[0] == 0) {
            return Arrays.copyOfRange(bytes, 1, bytes.length);
        }
        return bytes;
    }

    private static byte[] checksum(byte[] payload) {
        try {
            MessageDigest sha256 = MessageDigest.getInstance("SHA-256");
            byte[] once = sha256.digest(payload);
            byte[] twice = sha256.digest(once);
            return Arrays.copyOf(twice, CHECKSUM_LENGTH);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
