package com.di.indexer.support;

import com.di.indexer.util.Hex;

import java.io.ByteArrayOutputStream;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Minimal ABI tuple encoder for building ledger payloads in tests.
 */
public final class AbiEncoder {

    private static final int WORD = 32;

    /** Static head words, or {@code null} where a dynamic value goes. */
    private final List<byte[]> head = new ArrayList<>();
    private final List<byte[]> dynamic = new ArrayList<>();

    public static AbiEncoder tuple() {
        return new AbiEncoder();
    }

    public AbiEncoder bytes32(String hex) {
        byte[] raw = hex == null || hex.isEmpty() ? new byte[0] : Hex.decode(hex);
        byte[] word = new byte[WORD];
        System.arraycopy(raw, 0, word, 0, Math.min(raw.length, WORD));
        return staticWord(word);
    }

    public AbiEncoder address(String hex) {
        byte[] raw = Hex.decode(hex);
        byte[] word = new byte[WORD];
        System.arraycopy(raw, 0, word, WORD - raw.length, raw.length);
        return staticWord(word);
    }

    public AbiEncoder uint(long value) {
        return staticWord(uintWord(BigInteger.valueOf(value)));
    }

    public AbiEncoder bool(boolean value) {
        return uint(value ? 1 : 0);
    }

    public AbiEncoder string(String value) {
        return bytes(value.getBytes(StandardCharsets.UTF_8));
    }

    public AbiEncoder bytes(byte[] value) {
        head.add(null);
        dynamic.add(value);
        return this;
    }

    public byte[] encode() {
        ByteArrayOutputStream headOut = new ByteArrayOutputStream();
        ByteArrayOutputStream tailOut = new ByteArrayOutputStream();
        int headSize = head.size() * WORD;
        int dyn = 0;
        for (byte[] word : head) {
            if (word != null) {
                headOut.writeBytes(word);
                continue;
            }
            byte[] value = dynamic.get(dyn++);
            headOut.writeBytes(uintWord(BigInteger.valueOf(headSize + tailOut.size())));
            tailOut.writeBytes(uintWord(BigInteger.valueOf(value.length)));
            tailOut.writeBytes(value);
            int pad = (WORD - value.length % WORD) % WORD;
            tailOut.writeBytes(new byte[pad]);
        }
        headOut.writeBytes(tailOut.toByteArray());
        return headOut.toByteArray();
    }

    public String encodeHex() {
        return Hex.encode(encode());
    }

    private AbiEncoder staticWord(byte[] word) {
        head.add(word);
        return this;
    }

    private static byte[] uintWord(BigInteger value) {
        byte[] raw = value.toByteArray();
        byte[] word = new byte[WORD];
        int len = Math.min(raw.length, WORD);
        System.arraycopy(raw, raw.length - len, word, WORD - len, len);
        return word;
    }

    /** {@code 0x} + 64 hex chars built from a repeated byte. */
    public static String word(int fill) {
        byte[] b = new byte[WORD];
        java.util.Arrays.fill(b, (byte) fill);
        return Hex.encode(b);
    }
}
