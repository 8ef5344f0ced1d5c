package com.anyllm.gateway.admin.service;

import com.anyllm.gateway.auth.repo.GatewayUserRepo;
import com.anyllm.gateway.auth.service.SessionTokenService;
import com.anyllm.gateway.auth.web.AuthErrorCode;
import com.anyllm.gateway.auth.web.AuthException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;

@Slf4j
@Service
@RequiredArgsConstructor
public class AdminUserService {

    private final GatewayUserRepo users;
    private final SessionTokenService sessions;
    private final Clock clock;

    /** 封鎖只擋新登入與預算檢查；既有 session 要另外撤銷 */
    @Transactional
    public void setBlocked(String userId, boolean blocked) {
        int n = users.updateBlocked(userId, blocked, clock.instant());
        if (n == 0) throw new AuthException(AuthErrorCode.USER_NOT_FOUND);
        log.info("user blocked flag changed: userId={} blocked={}", userId, blocked);
    }

    @Transactional
    public int revokeSessions(String userId) {
        if (!users.existsById(userId)) throw new AuthException(AuthErrorCode.USER_NOT_FOUND);
        return sessions.revokeAllForUser(userId);
    }
}
