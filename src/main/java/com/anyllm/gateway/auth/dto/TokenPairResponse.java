package com.anyllm.gateway.auth.dto;

import java.time.Instant;

public record TokenPairResponse(
        String accessToken,
        Instant accessTokenExpiresAt,
        String refreshToken,
        Instant refreshTokenExpiresAt,
        String tokenType              // 固定 "Bearer"
) {
    public TokenPairResponse(String accessToken, Instant accessTokenExpiresAt,
                             String refreshToken, Instant refreshTokenExpiresAt) {
        this(accessToken, accessTokenExpiresAt, refreshToken, refreshTokenExpiresAt, "Bearer");
    }
}
