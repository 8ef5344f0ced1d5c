package com.anyllm.gateway.auth.service;

import com.anyllm.gateway.auth.dto.SessionMetadata;
import com.anyllm.gateway.auth.entity.SessionToken;
import com.anyllm.gateway.auth.entity.SessionToken.RevokeReason;
import com.anyllm.gateway.auth.repo.SessionTokenRepo;
import com.anyllm.gateway.auth.utils.SecureToken;
import com.anyllm.gateway.auth.web.AuthErrorCode;
import com.anyllm.gateway.auth.web.AuthException;
import com.anyllm.gateway.common.crypto.Hashes;
import com.anyllm.gateway.config.GatewayAuthProperties;
import com.anyllm.gateway.config.GatewayAuthProperties.ReuseRevocationScope;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * access token（JWT，jti 對到一列 session_tokens）+ refresh token（只存 sha256）。
 * 每次 refresh 都旋轉：舊列標記 ROTATED，新增一列接在同一個 family 後面。
 */
@Slf4j
@Service
public class SessionTokenService {

    private final SessionTokenRepo repo;
    private final AccessTokenSigner signer;
    private final Clock clock;
    private final Duration accessTtl;
    private final Duration refreshTtl;
    private final ReuseRevocationScope reuseScope;

    public SessionTokenService(SessionTokenRepo repo,
                               AccessTokenSigner signer,
                               Clock clock,
                               GatewayAuthProperties props) {
        this.repo = repo;
        this.signer = signer;
        this.clock = clock;
        this.accessTtl = props.getAccessTtl();
        this.refreshTtl = props.getRefreshTtl();
        this.reuseScope = props.getReuseRevocation();
    }

    /** 新的一條登入鏈 */
    @Transactional
    public IssuedTokens issue(String userId, String apiKeyId, SessionMetadata meta) {
        String id = UUID.randomUUID().toString();
        return insert(id, id, null, userId, apiKeyId, meta == null ? SessionMetadata.empty() : meta);
    }

    /**
     * 旋轉 refresh token。
     * 重放偵測時寫入的撤銷要 commit，所以 AuthException 不回滾。
     */
    @Transactional(noRollbackFor = AuthException.class)
    public IssuedTokens refresh(String refreshToken, SessionMetadata meta) {
        if (refreshToken == null || refreshToken.isBlank()) {
            throw new AuthException(AuthErrorCode.INVALID_REFRESH_TOKEN);
        }

        // 同一把 token 的併發請求在這裡排隊
        SessionToken row = repo.findByRefreshTokenHashForUpdate(Hashes.sha256Hex(refreshToken.trim()))
                .orElseThrow(() -> new AuthException(AuthErrorCode.INVALID_REFRESH_TOKEN));

        Instant now = clock.instant();

        if (row.isRevoked()) {
            throw reuseDetected(row, now);
        }
        if (!row.getRefreshExpiresAt().isAfter(now)) {
            throw new AuthException(AuthErrorCode.REFRESH_EXPIRED);
        }

        String successorId = UUID.randomUUID().toString();
        String successorJti = UUID.randomUUID().toString();

        // CAS：另一個交易先旋轉掉了 → 視同重放
        int changed = repo.markRotated(row.getId(), RevokeReason.ROTATED, successorJti, now);
        if (changed == 0) {
            throw reuseDetected(row, now);
        }

        SessionMetadata merged = metadataOf(row).overriddenBy(meta);
        return insert(successorId, row.getFamilyId(), row.getId(),
                row.getUserId(), row.getApiKeyId(), merged, successorJti);
    }

    /** logout 用；找不到或已撤銷都當成功 */
    @Transactional
    public boolean revokeByRefreshToken(String refreshToken) {
        if (refreshToken == null || refreshToken.isBlank()) return false;
        return repo.revokeByRefreshTokenHash(
                Hashes.sha256Hex(refreshToken.trim()), RevokeReason.LOGOUT, clock.instant()) > 0;
    }

    @Transactional
    public boolean revokeByJti(String jti) {
        if (jti == null || jti.isBlank()) return false;
        return repo.revokeByJti(jti, RevokeReason.LOGOUT, clock.instant()) > 0;
    }

    /** admin：踢掉某 user 的所有 session，api key 不受影響 */
    @Transactional
    public int revokeAllForUser(String userId) {
        int n = repo.revokeActiveByUser(userId, RevokeReason.ADMIN, clock.instant());
        log.info("sessions revoked by admin: userId={} count={}", userId, n);
        return n;
    }

    @Transactional(readOnly = true)
    public Optional<SessionToken> findLive(String jti) {
        return repo.findByJti(jti).filter(t -> !t.isRevoked());
    }

    private AuthException reuseDetected(SessionToken row, Instant now) {
        int revoked = switch (reuseScope) {
            case FAMILY -> repo.revokeActiveByFamily(row.getFamilyId(), RevokeReason.REUSE_DETECTED, now);
            case USER_KEY -> repo.revokeActiveByUserAndKey(
                    row.getUserId(), row.getApiKeyId(), RevokeReason.REUSE_DETECTED, now);
        };
        log.warn("REFRESH_REUSE userId={} apiKeyId={} familyId={} sessionId={} priorReason={} scope={} revoked={}",
                row.getUserId(), row.getApiKeyId(), row.getFamilyId(), row.getId(),
                row.getRevokeReason(), reuseScope, revoked);
        return new AuthException(AuthErrorCode.REFRESH_REUSE_DETECTED);
    }

    private IssuedTokens insert(String id, String familyId, String parentId,
                                String userId, String apiKeyId, SessionMetadata meta) {
        return insert(id, familyId, parentId, userId, apiKeyId, meta, UUID.randomUUID().toString());
    }

    private IssuedTokens insert(String id, String familyId, String parentId,
                                String userId, String apiKeyId, SessionMetadata meta, String jti) {
        // JWT 的 exp 只到秒
        Instant now = clock.instant().truncatedTo(ChronoUnit.SECONDS);
        Instant accessExp = now.plus(accessTtl);
        Instant refreshExp = now.plus(refreshTtl);
        String refreshPlain = SecureToken.newRefreshToken();

        SessionToken t = new SessionToken();
        t.setId(id);
        t.setJti(jti);
        t.setFamilyId(familyId);
        t.setParentId(parentId);
        t.setUserId(userId);
        t.setApiKeyId(apiKeyId);
        t.setRefreshTokenHash(Hashes.sha256Hex(refreshPlain));
        t.setAccessExpiresAt(accessExp);
        t.setRefreshExpiresAt(refreshExp);
        t.setDeviceType(meta.deviceType());
        t.setDeviceId(meta.deviceId());
        t.setOs(meta.os());
        t.setAppVersion(meta.appVersion());
        t.setUserAgent(meta.userAgent());
        t.setIp(meta.ip());
        t.setMetadata(meta.metadata() == null ? new LinkedHashMap<>() : new LinkedHashMap<>(meta.metadata()));
        t.setCreatedAt(now);
        repo.save(t);

        String access = signer.sign(userId, apiKeyId, jti, now, accessExp);
        return new IssuedTokens(access, accessExp, refreshPlain, refreshExp, jti, id, familyId);
    }

    private static SessionMetadata metadataOf(SessionToken row) {
        Map<String, Object> m = row.getMetadata() == null ? Map.of() : row.getMetadata();
        return new SessionMetadata(row.getDeviceType(), row.getDeviceId(), row.getOs(),
                row.getAppVersion(), row.getUserAgent(), row.getIp(), m);
    }

    public record IssuedTokens(
            String accessToken,
            Instant accessExpiresAt,
            String refreshToken,
            Instant refreshExpiresAt,
            String jti,
            String sessionId,
            String familyId
    ) {}
}
