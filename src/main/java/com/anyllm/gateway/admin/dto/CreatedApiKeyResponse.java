package com.anyllm.gateway.admin.dto;

import com.anyllm.gateway.users.dto.ApiKeyView;

/** apiKey 明文只在這個回應出現一次 */
public record CreatedApiKeyResponse(ApiKeyView key, String apiKey) {}
