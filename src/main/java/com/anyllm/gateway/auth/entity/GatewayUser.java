package com.anyllm.gateway.auth.entity;

import com.anyllm.gateway.common.jpa.JsonMapConverter;
import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

@Getter
@Setter
@Entity
@Table(name = "gateway_users", indexes = {
        @Index(name = "ix_gateway_users_next_reset", columnList = "next_budget_reset_at")
})
public class GatewayUser {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "user_id", length = 36)
    private String userId;

    @Column(name = "budget_id", nullable = false, length = 36)
    private String budgetId;

    @Column(name = "alias", length = 120)
    private String alias;

    /** 只會被 UsageLedger 以單一 UPDATE 累加，或到期時歸零 */
    @Column(name = "spend", nullable = false, precision = 18, scale = 6)
    private BigDecimal spend = BigDecimal.ZERO;

    @Column(name = "budget_started_at")
    private Instant budgetStartedAt;

    @Column(name = "next_budget_reset_at")
    private Instant nextBudgetResetAt;

    @Column(name = "blocked", nullable = false)
    private boolean blocked = false;

    @Convert(converter = JsonMapConverter.class)
    @Column(name = "metadata", columnDefinition = "TEXT")
    private Map<String, Object> metadata = new LinkedHashMap<>();

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    void onCreate() {
        if (createdAt == null) createdAt = Instant.now();
        if (updatedAt == null) updatedAt = createdAt;
        if (spend == null) spend = BigDecimal.ZERO;
    }

    @PreUpdate
    void onUpdate() {
        updatedAt = Instant.now();
    }
}
