package com.anyllm.gateway.auth.security;

/**
 * 一個請求解析出來的呼叫者。SecurityContext 只放這個，不放 JPA entity。
 * MASTER 沒有 userId / apiKeyId；sessionJti 只有 ACCESS_TOKEN 會有。
 */
public record Principal(CredentialKind kind, String userId, String apiKeyId, String sessionJti) {

    public static Principal master() {
        return new Principal(CredentialKind.MASTER, null, null, null);
    }

    public static Principal apiKey(String userId, String apiKeyId) {
        return new Principal(CredentialKind.API_KEY, userId, apiKeyId, null);
    }

    public static Principal accessToken(String userId, String apiKeyId, String jti) {
        return new Principal(CredentialKind.ACCESS_TOKEN, userId, apiKeyId, jti);
    }

    /** 只看憑證種類，provider 的 role 不參與授權 */
    public boolean isAdmin() {
        return kind == CredentialKind.MASTER;
    }
}
