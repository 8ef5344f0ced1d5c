package com.anyllm.gateway.auth.security;

import com.anyllm.gateway.auth.entity.ApiKey;
import com.anyllm.gateway.auth.entity.SessionToken;
import com.anyllm.gateway.auth.repo.ApiKeyRepo;
import com.anyllm.gateway.auth.service.AccessTokenSigner;
import com.anyllm.gateway.auth.service.SessionTokenService;
import com.anyllm.gateway.auth.web.AuthErrorCode;
import com.anyllm.gateway.auth.web.AuthException;
import com.anyllm.gateway.common.crypto.Hashes;
import com.anyllm.gateway.config.GatewayAuthProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;

/**
 * 把 "Bearer xxx" 解析成 Principal。
 * 順序：master key → access token（JWT）→ api key。
 */
@Slf4j
@Component
public class CredentialResolver {

    private static final String BEARER = "Bearer ";

    private final GatewayAuthProperties props;
    private final AccessTokenSigner signer;
    private final SessionTokenService sessions;
    private final ApiKeyRepo apiKeys;
    private final LastUsedTouchService touch;
    private final Clock clock;

    public CredentialResolver(GatewayAuthProperties props,
                              AccessTokenSigner signer,
                              SessionTokenService sessions,
                              ApiKeyRepo apiKeys,
                              LastUsedTouchService touch,
                              Clock clock) {
        this.props = props;
        this.signer = signer;
        this.sessions = sessions;
        this.apiKeys = apiKeys;
        this.touch = touch;
        this.clock = clock;
    }

    public Principal resolve(String headerValue) {
        String token = extractBearer(headerValue);

        // 1) master key
        String master = props.getMasterKey();
        if (master != null && !master.isBlank() && Hashes.constantTimeEquals(token, master)) {
            return Principal.master();
        }

        // 2) access token：結構像 JWT 才去驗簽，垃圾輸入不碰 DB
        boolean expiredJwt = false;
        if (AccessTokenSigner.looksLikeJwt(token)) {
            AccessTokenSigner.Result r = signer.verify(token);
            switch (r.status()) {
                case VALID -> {
                    return resolveSession(r.claims());
                }
                case EXPIRED -> expiredJwt = true;
                case INVALID -> { /* 交給 api key 判斷 */ }
            }
        }

        // 3) api key
        Instant now = clock.instant();
        Optional<ApiKey> key = apiKeys.findByKeyHash(Hashes.sha256Hex(token));
        if (key.isPresent() && key.get().isUsableAt(now)) {
            ApiKey k = key.get();
            touch.touchApiKey(k.getId(), now);
            return Principal.apiKey(k.getUserId(), k.getId());
        }

        if (expiredJwt) throw new AuthException(AuthErrorCode.EXPIRED_CREDENTIAL);
        throw new AuthException(AuthErrorCode.INVALID_CREDENTIAL);
    }

    private Principal resolveSession(AccessTokenSigner.AccessClaims claims) {
        SessionToken row = sessions.findLive(claims.jti()).orElse(null);
        if (row == null
                || !claims.userId().equals(row.getUserId())
                || !claims.apiKeyId().equals(row.getApiKeyId())) {
            log.debug("access token rejected: jti={} found={}", claims.jti(), row != null);
            throw new AuthException(AuthErrorCode.REVOKED_OR_UNKNOWN_SESSION);
        }
        touch.touchSession(row.getJti(), row.getApiKeyId(), clock.instant());
        return Principal.accessToken(row.getUserId(), row.getApiKeyId(), row.getJti());
    }

    static String extractBearer(String headerValue) {
        if (headerValue == null || !headerValue.startsWith(BEARER)) {
            throw new AuthException(AuthErrorCode.MALFORMED_CREDENTIAL);
        }
        String token = headerValue.substring(BEARER.length()).trim();
        if (token.isEmpty()) throw new AuthException(AuthErrorCode.MALFORMED_CREDENTIAL);
        return token;
    }
}
