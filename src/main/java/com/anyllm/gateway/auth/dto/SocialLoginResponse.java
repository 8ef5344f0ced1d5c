package com.anyllm.gateway.auth.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

public record SocialLoginResponse(
        @JsonProperty("is_new_user") boolean newUser,
        UserView user,
        BudgetView budget,
        @JsonInclude(JsonInclude.Include.NON_NULL) String apiKey,   // 只有新建 key 時才有明文
        String accessToken,
        Instant accessTokenExpiresAt,
        String refreshToken,
        Instant refreshTokenExpiresAt
) {}
