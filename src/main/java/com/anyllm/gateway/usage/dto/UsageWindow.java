package com.anyllm.gateway.usage.dto;

import com.anyllm.gateway.usage.repo.UsageLogRepository.UsageTotals;

import java.math.BigDecimal;

public record UsageWindow(
        long requests,
        long promptTokens,
        long completionTokens,
        long totalTokens,
        BigDecimal cost
) {
    public static UsageWindow of(UsageTotals t) {
        if (t == null) return new UsageWindow(0, 0, 0, 0, BigDecimal.ZERO);
        return new UsageWindow(
                asLong(t.getRequests()),
                asLong(t.getPromptTokens()),
                asLong(t.getCompletionTokens()),
                asLong(t.getTotalTokens()),
                asDecimal(t.getCost())
        );
    }

    private static long asLong(Number n) {
        return n == null ? 0L : n.longValue();
    }

    private static BigDecimal asDecimal(Number n) {
        if (n == null) return BigDecimal.ZERO;
        if (n instanceof BigDecimal bd) return bd;
        return new BigDecimal(n.toString());
    }
}
