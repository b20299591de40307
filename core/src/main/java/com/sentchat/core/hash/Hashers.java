package com.sentchat.core.hash;

import com.google.common.hash.Hashing;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

/**
 * Hash helpers for token signing.
 */
public final class Hashers {
    private Hashers() {
    }

    /**
     * Computes HMAC-SHA256 of a UTF-8 string.
     *
     * @param data   Signed content
     * @param secret Shared secret (must be the same across the cluster)
     * @return Lowercase hex signature
     */
    @SuppressWarnings("UnstableApiUsage")
    public static String hmacSha256Hex(String data, String secret) {
        return Hashing.hmacSha256(secret.getBytes(StandardCharsets.UTF_8))
            .hashString(data, StandardCharsets.UTF_8)
            .toString();
    }

    /**
     * Compares two strings in time independent of where they first differ.
     */
    public static boolean constantTimeEquals(String a, String b) {
        if (a == null || b == null) {
            return false;
        }
        return MessageDigest.isEqual(a.getBytes(StandardCharsets.UTF_8), b.getBytes(StandardCharsets.UTF_8));
    }
}
