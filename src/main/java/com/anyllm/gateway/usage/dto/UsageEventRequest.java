package com.anyllm.gateway.usage.dto;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;

import java.math.BigDecimal;

/**
 * 下游回報的一次呼叫；cost 由呼叫端算好。
 */
public record UsageEventRequest(
        @NotBlank @Size(max = 128) String model,
        @Size(max = 64) String provider,
        @Size(max = 255) String endpoint,
        @PositiveOrZero Long promptTokens,
        @PositiveOrZero Long completionTokens,
        @PositiveOrZero Long totalTokens,       // 沒帶 = prompt + completion
        @NotNull @DecimalMin("0") BigDecimal cost,
        @Size(max = 16) String status,          // 預設 success
        @Size(max = 1024) String errorMessage
) {}
