package com.anyllm.gateway.auth.entity;

import com.anyllm.gateway.common.jpa.JsonMapConverter;
import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * 社群登入身分（沿用 caret_users 表名）。
 * (provider, provider_user_id) 唯一：併發首次登入只會有一邊寫入成功。
 */
@Getter
@Setter
@Entity
@Table(name = "caret_users", uniqueConstraints = {
        @UniqueConstraint(name = ProviderIdentity.UX_PROVIDER_SUBJECT, columnNames = {"provider", "provider_user_id"}),
        @UniqueConstraint(name = "ux_caret_users_user", columnNames = {"user_id"})
})
public class ProviderIdentity {

    public static final String UX_PROVIDER_SUBJECT = "ux_caret_users_provider_subject";

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", length = 36)
    private String id;

    @Column(name = "user_id", nullable = false, length = 36)
    private String userId;

    @Column(name = "provider", nullable = false, length = 32)
    private String provider;

    @Column(name = "provider_user_id", nullable = false, length = 191)
    private String providerUserId;

    @Column(name = "role", length = 32)
    private String role;

    @Column(name = "email", length = 320)
    private String email;

    @Column(name = "name", length = 120)
    private String name;

    @Column(name = "avatar_url", length = 1024)
    private String avatarUrl;

    @Column(name = "access_token_expires_at")
    private Instant accessTokenExpiresAt;

    @Column(name = "last_login_at")
    private Instant lastLoginAt;

    @Convert(converter = JsonMapConverter.class)
    @Column(name = "metadata", columnDefinition = "TEXT")
    private Map<String, Object> metadata = new LinkedHashMap<>();

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    /** 統一小寫 */
    public void setEmail(String email) {
        this.email = (email == null) ? null : email.trim().toLowerCase(Locale.ROOT);
    }

    @PrePersist
    void onCreate() {
        if (createdAt == null) createdAt = Instant.now();
        if (updatedAt == null) updatedAt = createdAt;
    }

    @PreUpdate
    void onUpdate() {
        updatedAt = Instant.now();
    }
}
