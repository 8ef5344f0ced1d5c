package com.anyllm.gateway.usage.entity;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.math.BigDecimal;
import java.time.Instant;

@Getter
@Setter
@Entity
@Table(name = "usage_logs", indexes = {
        @Index(name = "ix_usage_logs_user_time", columnList = "user_id,logged_at")
})
public class UsageLog {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", length = 36)
    private String id;

    @Column(name = "user_id", nullable = false, length = 36)
    private String userId;

    @Column(name = "api_key_id", length = 36)
    private String apiKeyId;

    // TIMESTAMP 在 H2 是保留字
    @Column(name = "logged_at", nullable = false)
    private Instant timestamp;

    @Column(name = "model", length = 128)
    private String model;

    @Column(name = "provider", length = 64)
    private String provider;

    @Column(name = "endpoint", length = 255)
    private String endpoint;

    @Column(name = "prompt_tokens", nullable = false)
    private long promptTokens;

    @Column(name = "completion_tokens", nullable = false)
    private long completionTokens;

    @Column(name = "total_tokens", nullable = false)
    private long totalTokens;

    @Column(name = "cost", nullable = false, precision = 18, scale = 6)
    private BigDecimal cost = BigDecimal.ZERO;

    /** success / error */
    @Column(name = "status", nullable = false, length = 16)
    private String status;

    @Column(name = "error_message", length = 1024)
    private String errorMessage;
}
