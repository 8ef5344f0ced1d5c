package com.anyllm.gateway.users.dto;

import com.anyllm.gateway.auth.entity.ApiKey;

import java.time.Instant;

/** 只有 metadata，永遠不含 hash 與明文 */
public record ApiKeyView(
        String id,
        String keyName,
        boolean isActive,
        Instant expiresAt,
        Instant createdAt,
        Instant lastUsedAt
) {
    public static ApiKeyView of(ApiKey k) {
        return new ApiKeyView(k.getId(), k.getKeyName(), k.isActive(),
                k.getExpiresAt(), k.getCreatedAt(), k.getLastUsedAt());
    }
}
