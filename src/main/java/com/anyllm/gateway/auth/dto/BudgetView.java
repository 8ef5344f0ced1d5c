package com.anyllm.gateway.auth.dto;

import com.anyllm.gateway.auth.entity.Budget;
import com.anyllm.gateway.auth.entity.GatewayUser;

import java.math.BigDecimal;
import java.time.Instant;

public record BudgetView(
        String budgetId,
        BigDecimal maxBudget,
        Long budgetDurationSec,
        BigDecimal spend,
        Instant budgetStartedAt,
        Instant nextBudgetResetAt
) {
    public static BudgetView of(Budget b, GatewayUser u) {
        return new BudgetView(b.getBudgetId(), b.getMaxBudget(), b.getBudgetDurationSec(),
                u.getSpend(), u.getBudgetStartedAt(), u.getNextBudgetResetAt());
    }
}
