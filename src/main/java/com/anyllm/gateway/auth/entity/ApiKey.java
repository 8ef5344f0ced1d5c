package com.anyllm.gateway.auth.entity;

import com.anyllm.gateway.common.jpa.JsonMapConverter;
import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

@Getter
@Setter
@Entity
@Table(name = "api_keys",
        uniqueConstraints = @UniqueConstraint(name = "ux_api_keys_hash", columnNames = "key_hash"),
        indexes = @Index(name = "ix_api_keys_user", columnList = "user_id"))
public class ApiKey {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", length = 36)
    private String id;

    /** sha256 hex，明文只在建立當下回傳一次 */
    @Column(name = "key_hash", nullable = false, length = 64)
    private String keyHash;

    @Column(name = "key_name", length = 120)
    private String keyName;

    @Column(name = "user_id", nullable = false, length = 36)
    private String userId;

    @Column(name = "expires_at")
    private Instant expiresAt;

    @Column(name = "is_active", nullable = false)
    private boolean active = true;

    @Convert(converter = JsonMapConverter.class)
    @Column(name = "metadata", columnDefinition = "TEXT")
    private Map<String, Object> metadata = new LinkedHashMap<>();

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "last_used_at")
    private Instant lastUsedAt;

    @PrePersist
    void onCreate() {
        if (createdAt == null) createdAt = Instant.now();
    }

    public boolean isUsableAt(Instant now) {
        return active && (expiresAt == null || expiresAt.isAfter(now));
    }
}
