package com.anyllm.gateway.auth.verify;

import java.time.Instant;

/**
 * provider 驗證後的 profile。subject = provider 端穩定的使用者 id。
 */
public record VerifiedProfile(
        String provider,
        String subject,
        String email,
        String name,
        String avatarUrl,
        String role,
        Instant accessTokenExpiresAt
) {
    public static final String DEFAULT_ROLE = "user";

    /** provider 沒給的欄位才用請求帶來的值補 */
    public VerifiedProfile withHints(String emailHint, String nameHint, String avatarHint) {
        return new VerifiedProfile(
                provider,
                subject,
                blank(email) ? emailHint : email,
                blank(name) ? nameHint : name,
                blank(avatarUrl) ? avatarHint : avatarUrl,
                blank(role) ? DEFAULT_ROLE : role,
                accessTokenExpiresAt
        );
    }

    private static boolean blank(String s) {
        return s == null || s.isBlank();
    }
}
