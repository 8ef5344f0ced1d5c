package com.anyllm.gateway.auth.dto;

import com.anyllm.gateway.auth.entity.GatewayUser;
import com.anyllm.gateway.auth.entity.ProviderIdentity;

import java.time.Instant;

public record UserView(
        String userId,
        String alias,
        String provider,
        String email,
        String name,
        String avatarUrl,
        String role,
        boolean blocked,
        Instant lastLoginAt,
        Instant createdAt
) {
    public static UserView of(GatewayUser u, ProviderIdentity identity) {
        if (identity == null) {
            return new UserView(u.getUserId(), u.getAlias(), null, null, null, null, null,
                    u.isBlocked(), null, u.getCreatedAt());
        }
        return new UserView(u.getUserId(), u.getAlias(), identity.getProvider(), identity.getEmail(),
                identity.getName(), identity.getAvatarUrl(), identity.getRole(),
                u.isBlocked(), identity.getLastLoginAt(), u.getCreatedAt());
    }
}
