package com.anyllm.gateway.users.dto;

import com.anyllm.gateway.auth.security.CredentialKind;

public record MeResponse(
        String userId,
        String apiKeyId,
        CredentialKind credentialKind,
        String budgetId,
        boolean blocked
) {}
