package com.anyllm.gateway.auth.service;

import com.anyllm.gateway.auth.entity.ApiKey;
import com.anyllm.gateway.auth.repo.ApiKeyRepo;
import com.anyllm.gateway.auth.repo.GatewayUserRepo;
import com.anyllm.gateway.auth.utils.SecureToken;
import com.anyllm.gateway.auth.web.AuthErrorCode;
import com.anyllm.gateway.auth.web.AuthException;
import com.anyllm.gateway.common.crypto.Hashes;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Slf4j
@Service
@RequiredArgsConstructor
public class ApiKeyService {

    private final ApiKeyRepo apiKeys;
    private final GatewayUserRepo users;
    private final Clock clock;

    /** 明文只出現在回傳值裡，DB 只存 sha256 */
    public record IssuedApiKey(ApiKey key, String plaintext) {}

    @Transactional
    public IssuedApiKey create(String userId, String keyName, Instant expiresAt, Map<String, Object> metadata) {
        String plaintext = SecureToken.newApiKey();

        ApiKey k = new ApiKey();
        k.setKeyHash(Hashes.sha256Hex(plaintext));
        k.setKeyName(keyName);
        k.setUserId(userId);
        k.setExpiresAt(expiresAt);
        k.setActive(true);
        k.setMetadata(metadata == null ? new LinkedHashMap<>() : new LinkedHashMap<>(metadata));
        k.setCreatedAt(clock.instant());
        k = apiKeys.save(k);

        return new IssuedApiKey(k, plaintext);
    }

    /** admin 用：確認 user 存在才發 */
    @Transactional
    public IssuedApiKey createForExistingUser(String userId, String keyName, Instant expiresAt,
                                              Map<String, Object> metadata) {
        if (!users.existsById(userId)) throw new AuthException(AuthErrorCode.USER_NOT_FOUND);
        IssuedApiKey issued = create(userId, keyName, expiresAt, metadata);
        log.info("api key created: userId={} keyId={}", userId, issued.key().getId());
        return issued;
    }

    /** 停用不刪除；已停用再呼叫一次也算成功 */
    @Transactional
    public void deactivate(String keyId) {
        if (!apiKeys.existsById(keyId)) throw new AuthException(AuthErrorCode.API_KEY_NOT_FOUND);
        int n = apiKeys.deactivate(keyId);
        log.info("api key deactivated: keyId={} changed={}", keyId, n);
    }

    @Transactional(readOnly = true)
    public List<ApiKey> listForUser(String userId) {
        return apiKeys.findByUserIdOrderByCreatedAtAsc(userId);
    }

    /** 最早建立、仍可用的 key */
    @Transactional(readOnly = true)
    public Optional<ApiKey> findPrimaryUsable(String userId) {
        return apiKeys.findUsableByUserId(userId, clock.instant()).stream().findFirst();
    }
}
