package com.anyllm.gateway.auth.utils;

import java.security.SecureRandom;
import java.util.Base64;

public final class SecureToken {

    public static final String API_KEY_PREFIX = "gw-";

    private static final SecureRandom SR = new SecureRandom();

    private SecureToken() {}

    /** url-safe base64，不含 '.'，所以不會被誤判成 JWT */
    public static String newUrlSafe(int bytes) {
        byte[] buf = new byte[bytes];
        SR.nextBytes(buf);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(buf);
    }

    /** refresh token：48 bytes → 64 字元 */
    public static String newRefreshToken() {
        return newUrlSafe(48);
    }

    /** api key：gw- + 32 bytes */
    public static String newApiKey() {
        return API_KEY_PREFIX + newUrlSafe(32);
    }
}
