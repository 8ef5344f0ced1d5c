package com.anyllm.gateway.usage.dto;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * @param remaining maxBudget 為 null（無上限）時也是 null
 */
public record BudgetStatus(
        String userId,
        boolean allowed,
        BigDecimal spend,
        BigDecimal maxBudget,
        BigDecimal remaining,
        Instant nextBudgetResetAt
) {}
