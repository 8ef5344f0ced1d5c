package com.anyllm.gateway.auth.security;

import com.anyllm.gateway.auth.repo.ApiKeyRepo;
import com.anyllm.gateway.auth.repo.SessionTokenRepo;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.time.Instant;

/**
 * last_used_at 回寫：best-effort，失敗只記 WARN，不影響請求本身。
 * 這裡不開交易：每個 UPDATE 各自在 repository 的交易裡，失敗不會連帶讓另一筆 rollback。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LastUsedTouchService {

    private final ApiKeyRepo apiKeys;
    private final SessionTokenRepo sessions;

    @Async("touchExecutor")
    public void touchApiKey(String apiKeyId, Instant at) {
        try {
            apiKeys.touchLastUsed(apiKeyId, at);
        } catch (DataAccessException e) {
            log.warn("touch api key failed: apiKeyId={} err={}", apiKeyId, e.toString());
        }
    }

    @Async("touchExecutor")
    public void touchSession(String jti, String apiKeyId, Instant at) {
        try {
            sessions.touchLastUsed(jti, at);
        } catch (DataAccessException e) {
            log.warn("touch session failed: jti={} err={}", jti, e.toString());
        }
        touchApiKey(apiKeyId, at);
    }
}
