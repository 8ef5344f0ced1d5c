package com.anyllm.gateway.auth.service;

import com.anyllm.gateway.auth.dto.BudgetView;
import com.anyllm.gateway.auth.dto.SocialLoginRequest;
import com.anyllm.gateway.auth.dto.SocialLoginResponse;
import com.anyllm.gateway.auth.dto.UserView;
import com.anyllm.gateway.auth.service.IdentityProvisioningService.ProvisionedIdentity;
import com.anyllm.gateway.auth.service.SessionTokenService.IssuedTokens;
import com.anyllm.gateway.auth.verify.VerifiedProfile;
import com.anyllm.gateway.auth.web.AuthErrorCode;
import com.anyllm.gateway.auth.web.AuthException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

/**
 * 1) provider 驗證 2) 建立或沿用身分（競態重試一次）3) 發 access/refresh token。
 * 本身不開交易：重試必須是一個全新的交易。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SocialLoginService {

    private static final int MAX_ATTEMPTS = 2;

    private final ProfileVerificationService verification;
    private final IdentityProvisioningService provisioning;
    private final SessionTokenService sessionTokens;

    public SocialLoginResponse login(SocialLoginRequest req, String requestIp, String requestUserAgent) {
        VerifiedProfile profile = verification.verify(req.provider(), req.accessToken())
                .withHints(req.email(), req.name(), req.avatarUrl());

        ProvisionedIdentity p = provisionWithRetry(profile);

        IssuedTokens tokens = sessionTokens.issue(
                p.user().getUserId(),
                p.apiKey().getId(),
                req.sessionMetadata().withFallback(requestUserAgent, requestIp)
        );

        log.info("social login: provider={} userId={} outcome={} familyId={}",
                profile.provider(), p.user().getUserId(), p.outcome(), tokens.familyId());

        return new SocialLoginResponse(
                p.isNewUser(),
                UserView.of(p.user(), p.identity()),
                BudgetView.of(p.budget(), p.user()),
                p.apiKeyPlaintext(),
                tokens.accessToken(),
                tokens.accessExpiresAt(),
                tokens.refreshToken(),
                tokens.refreshExpiresAt()
        );
    }

    private ProvisionedIdentity provisionWithRetry(VerifiedProfile profile) {
        for (int attempt = 1; ; attempt++) {
            try {
                return provisioning.resolveOrProvision(profile);
            } catch (AuthException e) {
                if (e.code() != AuthErrorCode.PROVISIONING_CONFLICT) throw e;
                onConflict(profile, attempt, e);
            } catch (DataIntegrityViolationException e) {
                // commit 時才浮出的身分衝突；其他完整性錯誤不是暫時性的，不重試
                if (!IdentityProvisioningService.isIdentityRace(e)) throw e;
                onConflict(profile, attempt, e);
            } catch (ConcurrencyFailureException e) {
                // lock timeout / deadlock
                onConflict(profile, attempt, e);
            }
        }
    }

    private static void onConflict(VerifiedProfile profile, int attempt, RuntimeException e) {
        if (attempt >= MAX_ATTEMPTS) {
            log.warn("provisioning failed after retry: provider={} subject={} err={}",
                    profile.provider(), profile.subject(), e.toString());
            throw new AuthException(AuthErrorCode.PROVISIONING_FAILED,
                    AuthErrorCode.PROVISIONING_FAILED.defaultMessage(), e);
        }
        log.info("provisioning conflict, retrying: provider={} subject={}", profile.provider(), profile.subject());
    }
}
