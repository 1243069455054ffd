package com.di.indexer.ledger;

import com.di.indexer.util.Hex;

import java.math.BigInteger;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * Reads Solidity ABI-encoded parameter lists (head/tail layout, 32-byte words).
 *
 * <p>Static values are read from head word {@code index}; dynamic values
 * ({@code bytes}, {@code string}) read their byte offset from the head word and
 * the length-prefixed payload from the tail.
 */
public final class AbiReader {

    public static final int WORD = 32;

    private final byte[] data;

    public AbiReader(byte[] data) {
        this.data = data == null ? new byte[0] : data;
    }

    public int wordCount() {
        return data.length / WORD;
    }

    public byte[] word(int index) {
        return wordAt((long) index * WORD);
    }

    /** {@code bytes32} as {@code 0x}-hex, or {@code ""} when the word is all zeros. */
    public String bytes32OrEmpty(int index) {
        byte[] w = word(index);
        return Hex.isZero(w) ? "" : Hex.encode(w);
    }

    public String bytes32(int index) {
        return Hex.encode(word(index));
    }

    public String address(int index) {
        byte[] w = word(index);
        for (int i = 0; i < 12; i++) {
            if (w[i] != 0) {
                throw new AbiDecodingException("word " + index + " is not a left-padded address");
            }
        }
        return Hex.encode(Arrays.copyOfRange(w, 12, WORD));
    }

    public long uint64(int index) {
        BigInteger v = new BigInteger(1, word(index));
        if (v.bitLength() > 63) {
            throw new AbiDecodingException("word " + index + " exceeds uint64 range handled here: " + v);
        }
        return v.longValue();
    }

    public boolean bool(int index) {
        long v = uint64(index);
        if (v > 1) {
            throw new AbiDecodingException("word " + index + " is not a bool: " + v);
        }
        return v == 1;
    }

    public byte[] dynamicBytes(int headIndex) {
        long offset = uint64(headIndex);
        BigInteger rawLength = new BigInteger(1, wordAt(offset));
        if (rawLength.bitLength() > 31) {
            throw new AbiDecodingException("dynamic value at head " + headIndex + " has length " + rawLength);
        }
        long length = rawLength.longValue();
        long start = offset + WORD;
        if (start + length > data.length) {
            throw new AbiDecodingException("dynamic value at head " + headIndex
                    + " overruns the payload (offset=" + offset + " length=" + length + ")");
        }
        return Arrays.copyOfRange(data, (int) start, (int) (start + length));
    }

    public String string(int headIndex) {
        byte[] raw = dynamicBytes(headIndex);
        try {
            return StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(raw))
                    .toString();
        } catch (CharacterCodingException e) {
            throw new AbiDecodingException("string at head " + headIndex + " is not valid UTF-8", e);
        }
    }

    private byte[] wordAt(long byteOffset) {
        if (byteOffset < 0 || byteOffset + WORD > data.length) {
            throw new AbiDecodingException("word at byte offset " + byteOffset
                    + " is out of bounds (payload " + data.length + " bytes)");
        }
        int from = (int) byteOffset;
        return Arrays.copyOfRange(data, from, from + WORD);
    }
}
