package com.di.indexer.bundle;

import com.di.indexer.util.Hex;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.List;

/**
 * Whole-stream digest of a scanprint record stream.
 *
 * <p>Canonical form: split on {@code \n}, strip each line, drop empty lines,
 * join with a single {@code \n} (no trailing newline), UTF-8. The digest is
 * SHA-256 of that form rendered as {@code 0x} + 64 lowercase hex chars. An
 * empty stream has the empty digest {@code ""}, which never matches.
 */
public final class ScanprintDigest {

    private ScanprintDigest() {
    }

    public static List<String> canonicalLines(String stream) {
        List<String> lines = new ArrayList<>();
        if (stream == null) {
            return lines;
        }
        for (String line : stream.split("\n", -1)) {
            String stripped = line.strip();
            if (!stripped.isEmpty()) {
                lines.add(stripped);
            }
        }
        return lines;
    }

    public static String compute(String stream) {
        List<String> lines = canonicalLines(stream);
        if (lines.isEmpty()) {
            return "";
        }
        return sha256Hex(String.join("\n", lines).getBytes(StandardCharsets.UTF_8));
    }

    public static String sha256Hex(byte[] bytes) {
        return Hex.encode(sha256(bytes));
    }

    /**
     * Byte-wise comparison of two hex digests (optional {@code 0x}, any case).
     * Blank or non-hex values never match.
     */
    public static boolean matches(String declared, String computed) {
        if (declared == null || declared.isBlank() || computed == null || computed.isBlank()) {
            return false;
        }
        try {
            return MessageDigest.isEqual(Hex.decode(declared), Hex.decode(computed));
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    private static byte[] sha256(byte[] bytes) {
        try {
            return MessageDigest.getInstance("SHA-256").digest(bytes);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
