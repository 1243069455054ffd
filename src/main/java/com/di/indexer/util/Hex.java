package com.di.indexer.util;

import java.util.HexFormat;

/**
 * {@code 0x}-prefixed lowercase hex helpers shared by the ledger and digest code.
 */
public final class Hex {

    private static final HexFormat HEX = HexFormat.of();

    private Hex() {
    }

    public static String encode(byte[] bytes) {
        return "0x" + HEX.formatHex(bytes);
    }

    /**
     * Decodes hex with or without a {@code 0x} prefix, case-insensitive.
     *
     * @throws IllegalArgumentException on odd length or non-hex characters
     */
    public static byte[] decode(String hex) {
        if (hex == null) {
            throw new IllegalArgumentException("hex value is null");
        }
        String s = strip0x(hex.trim());
        if (s.length() % 2 != 0) {
            throw new IllegalArgumentException("odd-length hex value: " + hex);
        }
        return HEX.parseHex(s.toLowerCase());
    }

    public static String strip0x(String hex) {
        return hex.startsWith("0x") || hex.startsWith("0X") ? hex.substring(2) : hex;
    }

    public static boolean isZero(byte[] bytes) {
        for (byte b : bytes) {
            if (b != 0) return false;
        }
        return true;
    }

    /** Quantity encoding used by JSON-RPC ({@code 0x1a}, no leading zeros). */
    public static String quantity(long value) {
        return "0x" + Long.toHexString(value);
    }

    public static long parseQuantity(String quantity) {
        if (quantity == null || quantity.isBlank()) {
            throw new IllegalArgumentException("empty quantity");
        }
        return Long.parseUnsignedLong(strip0x(quantity.trim()), 16);
    }
}
