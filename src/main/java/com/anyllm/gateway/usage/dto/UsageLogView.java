package com.anyllm.gateway.usage.dto;

import com.anyllm.gateway.usage.entity.UsageLog;

import java.math.BigDecimal;
import java.time.Instant;

public record UsageLogView(
        String id,
        String apiKeyId,
        Instant timestamp,
        String model,
        String provider,
        String endpoint,
        long promptTokens,
        long completionTokens,
        long totalTokens,
        BigDecimal cost,
        String status,
        String errorMessage
) {
    public static UsageLogView of(UsageLog l) {
        return new UsageLogView(l.getId(), l.getApiKeyId(), l.getTimestamp(), l.getModel(), l.getProvider(),
                l.getEndpoint(), l.getPromptTokens(), l.getCompletionTokens(), l.getTotalTokens(),
                l.getCost(), l.getStatus(), l.getErrorMessage());
    }
}
