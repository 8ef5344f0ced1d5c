package com.anyllm.gateway.auth.service;

import com.anyllm.gateway.config.GatewayAuthProperties;
import com.auth0.jwt.JWT;
import com.auth0.jwt.JWTVerifier;
import com.auth0.jwt.algorithms.Algorithm;
import com.auth0.jwt.exceptions.JWTVerificationException;
import com.auth0.jwt.exceptions.TokenExpiredException;
import com.auth0.jwt.interfaces.DecodedJWT;
import com.auth0.jwt.interfaces.Verification;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;

/**
 * HS256 access token：sub=user_id, api_key_id, jti, iat, exp。
 * 簽章只證明「發過」，是否仍有效要再看 session_tokens 的 jti。
 */
@Component
public class AccessTokenSigner {

    public static final String ISSUER = "anyllm-gateway";
    public static final String CLAIM_API_KEY_ID = "api_key_id";

    private final Algorithm algorithm;
    private final JWTVerifier verifier;

    public AccessTokenSigner(GatewayAuthProperties props, Clock clock) {
        this.algorithm = Algorithm.HMAC256(resolveSecret(props));
        Verification v = JWT.require(algorithm)
                .withIssuer(ISSUER)
                .withClaimPresence("sub")
                .withClaimPresence("jti")
                .withClaimPresence("exp")
                .withClaimPresence(CLAIM_API_KEY_ID);
        this.verifier = ((JWTVerifier.BaseVerification) v).build(clock);
    }

    public String sign(String userId, String apiKeyId, String jti, Instant issuedAt, Instant expiresAt) {
        return JWT.create()
                .withIssuer(ISSUER)
                .withSubject(userId)
                .withClaim(CLAIM_API_KEY_ID, apiKeyId)
                .withJWTId(jti)
                .withIssuedAt(issuedAt)
                .withExpiresAt(expiresAt)
                .sign(algorithm);
    }

    public Result verify(String token) {
        try {
            DecodedJWT jwt = verifier.verify(token);
            String apiKeyId = jwt.getClaim(CLAIM_API_KEY_ID).asString();
            if (isBlank(jwt.getSubject()) || isBlank(jwt.getId()) || isBlank(apiKeyId)) {
                return Result.invalid();
            }
            return Result.valid(new AccessClaims(jwt.getSubject(), apiKeyId, jwt.getId(), jwt.getExpiresAtAsInstant()));
        } catch (TokenExpiredException e) {
            // 簽章已通過，只是過期
            return Result.expired();
        } catch (JWTVerificationException e) {
            return Result.invalid();
        }
    }

    /** 便宜的結構檢查：三段、header 是 base64url 的 JSON 開頭 */
    public static boolean looksLikeJwt(String token) {
        if (token == null || !token.startsWith("eyJ")) return false;
        int first = token.indexOf('.');
        if (first < 0) return false;
        int second = token.indexOf('.', first + 1);
        return second > first + 1 && second < token.length() - 1 && token.indexOf('.', second + 1) < 0;
    }

    private static String resolveSecret(GatewayAuthProperties props) {
        if (!isBlank(props.getJwtSecret())) return props.getJwtSecret();
        if (!isBlank(props.getMasterKey())) return props.getMasterKey();
        throw new IllegalStateException(
                "Missing app.auth.jwt-secret (or app.auth.master-key). " +
                "Set env APP_AUTH_JWT_SECRET before starting the gateway."
        );
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }

    public record AccessClaims(String userId, String apiKeyId, String jti, Instant expiresAt) {}

    public enum Status { VALID, EXPIRED, INVALID }

    public record Result(Status status, AccessClaims claims) {
        static Result valid(AccessClaims c) { return new Result(Status.VALID, c); }
        static Result expired() { return new Result(Status.EXPIRED, null); }
        static Result invalid() { return new Result(Status.INVALID, null); }
    }
}
