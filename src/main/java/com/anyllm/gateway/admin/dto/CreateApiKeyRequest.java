package com.anyllm.gateway.admin.dto;

import jakarta.validation.constraints.Size;

import java.time.Instant;
import java.util.Map;

public record CreateApiKeyRequest(
        @Size(max = 120) String keyName,
        Instant expiresAt,          // null = 不過期
        Map<String, Object> metadata
) {}
