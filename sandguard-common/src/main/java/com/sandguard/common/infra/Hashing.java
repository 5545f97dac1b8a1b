package com.sandguard.common.infra;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Content hashing for cache keys and generated file names.
 */
public final class Hashing {

    private Hashing() {
    }

    /**
     * SHA-256 of the UTF-8 bytes of {@code text}, as lowercase hex. Null hashes
     * like the empty string.
     */
    public static String sha256Hex(String text) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest((text != null ? text : "").getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
