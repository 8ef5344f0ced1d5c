package com.anyllm.gateway.auth.entity;

import com.anyllm.gateway.common.jpa.JsonMapConverter;
import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 一列 = 一把 refresh token（以及它對應的 access token jti）。
 * 旋轉時舊列只會被標記 revoked + replaced_by_jti，新 token 一律新增一列。
 * family_id 串起同一次登入的整條鏈，parent_id 指向上一列。
 */
@Getter
@Setter
@Entity
@Table(name = "session_tokens",
        uniqueConstraints = {
                @UniqueConstraint(name = "ux_session_tokens_jti", columnNames = "jti"),
                @UniqueConstraint(name = "ux_session_tokens_refresh_hash", columnNames = "refresh_token_hash")
        },
        indexes = {
                @Index(name = "ix_session_tokens_family", columnList = "family_id"),
                @Index(name = "ix_session_tokens_user_key", columnList = "user_id,api_key_id")
        })
public class SessionToken {

    /** 由 SessionTokenService 指定：登入鏈第一列的 id 同時是 family_id */
    @Id
    @Column(name = "id", length = 36)
    private String id;

    @Column(name = "jti", nullable = false, length = 36)
    private String jti;

    @Column(name = "family_id", nullable = false, length = 36)
    private String familyId;

    @Column(name = "parent_id", length = 36)
    private String parentId;

    @Column(name = "user_id", nullable = false, length = 36)
    private String userId;

    @Column(name = "api_key_id", nullable = false, length = 36)
    private String apiKeyId;

    @Column(name = "refresh_token_hash", nullable = false, length = 64)
    private String refreshTokenHash;

    @Column(name = "refresh_expires_at", nullable = false)
    private Instant refreshExpiresAt;

    @Column(name = "access_expires_at", nullable = false)
    private Instant accessExpiresAt;

    @Column(name = "revoked_at")
    private Instant revokedAt;

    @Enumerated(EnumType.STRING)
    @Column(name = "revoke_reason", length = 20)
    private RevokeReason revokeReason;

    @Column(name = "replaced_by_jti", length = 36)
    private String replacedByJti;

    @Column(name = "device_type", length = 32)
    private String deviceType;

    @Column(name = "device_id", length = 128)
    private String deviceId;

    @Column(name = "os", length = 64)
    private String os;

    @Column(name = "app_version", length = 32)
    private String appVersion;

    @Column(name = "user_agent", length = 512)
    private String userAgent;

    @Column(name = "ip", length = 64)
    private String ip;

    @Convert(converter = JsonMapConverter.class)
    @Column(name = "metadata", columnDefinition = "TEXT")
    private Map<String, Object> metadata = new LinkedHashMap<>();

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "last_used_at")
    private Instant lastUsedAt;

    public enum RevokeReason { ROTATED, LOGOUT, REUSE_DETECTED, ADMIN }

    public boolean isRevoked() {
        return revokedAt != null;
    }

    @PrePersist
    void onCreate() {
        if (createdAt == null) createdAt = Instant.now();
    }
}
