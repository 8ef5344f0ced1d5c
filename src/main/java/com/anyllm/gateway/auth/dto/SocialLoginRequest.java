package com.anyllm.gateway.auth.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

import java.util.Map;

public record SocialLoginRequest(
        @NotBlank @Size(max = 32) String provider,
        @NotBlank String accessToken,   // provider 的 token（Google 為 ID token）
        @Size(max = 320) String email,  // 以下三個只在 provider 沒回傳時補用
        @Size(max = 120) String name,
        @Size(max = 1024) String avatarUrl,
        @Size(max = 32) String deviceType,
        @Size(max = 128) String deviceId,
        @Size(max = 64) String os,
        @Size(max = 32) String appVersion,
        @Size(max = 512) String userAgent,
        @Size(max = 64) String ip,
        Map<String, Object> metadata
) {
    public SessionMetadata sessionMetadata() {
        return new SessionMetadata(deviceType, deviceId, os, appVersion, userAgent, ip,
                metadata == null ? Map.of() : metadata);
    }
}
