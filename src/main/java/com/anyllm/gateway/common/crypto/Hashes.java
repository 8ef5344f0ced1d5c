package com.anyllm.gateway.common.crypto;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * 單向雜湊 + constant-time 比對。
 * api key / refresh token 只存 sha256 hex，明文不落地。
 */
public final class Hashes {

    private Hashes() {}

    public static String sha256Hex(String value) {
        if (value == null) throw new IllegalArgumentException("value is null");
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            return toHex(md.digest(value.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA256_UNAVAILABLE", e);
        }
    }

    /** 長度不同也走完整比對，不提早 return */
    public static boolean constantTimeEquals(String a, String b) {
        if (a == null || b == null) return false;
        return MessageDigest.isEqual(
                a.getBytes(StandardCharsets.UTF_8),
                b.getBytes(StandardCharsets.UTF_8)
        );
    }

    private static String toHex(byte[] bytes) {
        StringBuilder sb = new StringBuilder(bytes.length * 2);
        for (byte b : bytes) sb.append(String.format("%02x", b));
        return sb.toString();
    }
}
