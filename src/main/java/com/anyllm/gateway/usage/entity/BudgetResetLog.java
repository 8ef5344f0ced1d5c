package com.anyllm.gateway.usage.entity;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * 每次 spend 歸零留一列（lazy 與 BudgetResetJob 兩條路都會寫）。
 */
@Getter
@Setter
@Entity
@Table(name = "budget_reset_logs", indexes = {
        @Index(name = "ix_budget_reset_logs_user_time", columnList = "user_id,reset_at")
})
public class BudgetResetLog {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", length = 36)
    private String id;

    @Column(name = "user_id", nullable = false, length = 36)
    private String userId;

    @Column(name = "budget_id", nullable = false, length = 36)
    private String budgetId;

    /** 歸零前讀到的 spend */
    @Column(name = "previous_spend", nullable = false, precision = 18, scale = 6)
    private BigDecimal previousSpend;

    @Column(name = "reset_at", nullable = false)
    private Instant resetAt;

    /** null = 之後不再重置 */
    @Column(name = "next_reset_at")
    private Instant nextResetAt;
}
