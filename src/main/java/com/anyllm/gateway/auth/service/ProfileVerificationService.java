package com.anyllm.gateway.auth.service;

import com.anyllm.gateway.auth.verify.ProfileVerifier;
import com.anyllm.gateway.auth.verify.VerifiedProfile;
import com.anyllm.gateway.auth.web.AuthErrorCode;
import com.anyllm.gateway.auth.web.AuthException;
import com.anyllm.gateway.config.GatewayAuthProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * 依 provider 分派到 ProfileVerifier，並在 verification-timeout 內截斷。
 * 這一步失敗時還沒有任何寫入。
 */
@Slf4j
@Service
public class ProfileVerificationService {

    private final Map<String, ProfileVerifier> verifiers;
    private final Executor executor;
    private final Duration timeout;

    public ProfileVerificationService(List<ProfileVerifier> verifiers,
                                      @Qualifier("verificationExecutor") Executor executor,
                                      GatewayAuthProperties props) {
        // provider 重複 → toMap 直接丟 IllegalStateException，啟動失敗
        this.verifiers = verifiers.stream()
                .collect(Collectors.toMap(v -> normalize(v.provider()), Function.identity()));
        this.executor = executor;
        this.timeout = props.getVerificationTimeout();
        log.info("profile verifiers: {}", this.verifiers.keySet());
    }

    public VerifiedProfile verify(String provider, String accessToken) {
        String key = normalize(provider);
        ProfileVerifier verifier = verifiers.get(key);
        if (verifier == null) {
            throw new AuthException(AuthErrorCode.UNSUPPORTED_PROVIDER, "Unsupported provider: " + provider);
        }

        CompletableFuture<VerifiedProfile> future;
        try {
            future = CompletableFuture.supplyAsync(() -> {
                try {
                    return verifier.verify(accessToken);
                } catch (Exception e) {
                    throw new CompletionException(e);
                }
            }, executor);
        } catch (RejectedExecutionException e) {
            // verificationExecutor 滿了（TaskRejectedException 也是這個型別）
            log.warn("profile verification rejected: provider={} err={}", key, e.toString());
            throw new AuthException(AuthErrorCode.PROFILE_VERIFICATION_FAILED, "Profile verification unavailable", e);
        }

        VerifiedProfile profile;
        try {
            profile = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("profile verification timeout: provider={} timeout={}", key, timeout);
            throw new AuthException(AuthErrorCode.PROFILE_VERIFICATION_FAILED, "Profile verification timed out", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AuthException(AuthErrorCode.PROFILE_VERIFICATION_FAILED, "Profile verification interrupted", e);
        } catch (ExecutionException e) {
            Throwable cause = (e.getCause() != null) ? e.getCause() : e;
            log.info("profile verification failed: provider={} err={}", key, cause.toString());
            throw new AuthException(AuthErrorCode.PROFILE_VERIFICATION_FAILED,
                    AuthErrorCode.PROFILE_VERIFICATION_FAILED.defaultMessage(), cause);
        }

        if (profile == null || profile.subject() == null || profile.subject().isBlank()) {
            throw new AuthException(AuthErrorCode.PROFILE_VERIFICATION_FAILED);
        }
        if (!key.equals(normalize(profile.provider()))) {
            throw new AuthException(AuthErrorCode.PROFILE_VERIFICATION_FAILED, "Provider mismatch");
        }
        return profile;
    }

    private static String normalize(String provider) {
        return provider == null ? "" : provider.trim().toLowerCase(Locale.ROOT);
    }
}
