package com.chainmirror.common;

/**
 * JSON-RPC quantity helpers ("0x"-prefixed hex).
 */
public final class HexQuantity {

    private HexQuantity() {
    }

    public static String encode(long value) {
        return "0x" + Long.toHexString(value);
    }

    /**
     * Parses a "0x" hex quantity. Returns null for null input.
     *
     * @throws IllegalArgumentException when the value is not a 0x-prefixed hex string
     */
    public static Long decode(String hex) {
        if (hex == null) {
            return null;
        }
        if (!hex.startsWith("0x") || hex.length() < 3) {
            throw new IllegalArgumentException("Invalid hex quantity: " + hex);
        }
        return Long.parseLong(hex.substring(2), 16);
    }
}
