package com.anyllm.gateway.auth.service;

import com.anyllm.gateway.auth.verify.ProfileVerifier;
import com.anyllm.gateway.auth.verify.VerifiedProfile;
import com.anyllm.gateway.auth.web.AuthErrorCode;
import com.anyllm.gateway.auth.web.AuthException;
import com.anyllm.gateway.config.GatewayAuthProperties;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ProfileVerificationServiceTest {

    private final ExecutorService executor = Executors.newFixedThreadPool(2);

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private ProfileVerificationService service(ProfileVerifier... verifiers) {
        GatewayAuthProperties props = new GatewayAuthProperties();
        props.setVerificationTimeout(Duration.ofMillis(300));
        return new ProfileVerificationService(List.of(verifiers), executor, props);
    }

    private static ProfileVerifier verifier(String provider, ThrowingVerify fn) {
        return new ProfileVerifier() {
            @Override public String provider() { return provider; }
            @Override public VerifiedProfile verify(String token) throws Exception { return fn.apply(token); }
        };
    }

    interface ThrowingVerify {
        VerifiedProfile apply(String token) throws Exception;
    }

    @Test
    void dispatches_by_provider_case_insensitively() {
        var s = service(verifier("google", t -> new VerifiedProfile("google", "sub-" + t, null, null, null, null, null)));

        VerifiedProfile p = s.verify("Google", "abc");

        assertThat(p.subject()).isEqualTo("sub-abc");
    }

    @Test
    void unknown_provider_is_unsupported() {
        var s = service(verifier("google", t -> null));

        assertThatThrownBy(() -> s.verify("github", "x"))
                .isInstanceOf(AuthException.class)
                .extracting(e -> ((AuthException) e).code())
                .isEqualTo(AuthErrorCode.UNSUPPORTED_PROVIDER);
    }

    @Test
    void null_profile_or_verifier_exception_is_verification_failure() {
        var nullResult = service(verifier("google", t -> null));
        var throwing = service(verifier("google", t -> { throw new IllegalArgumentException("bad token"); }));

        assertThatThrownBy(() -> nullResult.verify("google", "x"))
                .extracting(e -> ((AuthException) e).code())
                .isEqualTo(AuthErrorCode.PROFILE_VERIFICATION_FAILED);
        assertThatThrownBy(() -> throwing.verify("google", "x"))
                .extracting(e -> ((AuthException) e).code())
                .isEqualTo(AuthErrorCode.PROFILE_VERIFICATION_FAILED);
    }

    @Test
    void slow_verifier_is_cut_off_at_timeout() {
        var s = service(verifier("google", t -> {
            Thread.sleep(5_000);
            return new VerifiedProfile("google", "late", null, null, null, null, null);
        }));

        long start = System.nanoTime();
        assertThatThrownBy(() -> s.verify("google", "x"))
                .extracting(e -> ((AuthException) e).code())
                .isEqualTo(AuthErrorCode.PROFILE_VERIFICATION_FAILED);
        assertThat(Duration.ofNanos(System.nanoTime() - start)).isLessThan(Duration.ofSeconds(3));
    }

    @Test
    void duplicate_provider_registration_fails_fast() {
        assertThatThrownBy(() -> service(verifier("google", t -> null), verifier("GOOGLE", t -> null)))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void saturated_executor_maps_to_verification_failed() {
        GatewayAuthProperties props = new GatewayAuthProperties();
        ThreadPoolTaskExecutor full = new ThreadPoolTaskExecutor();
        full.setCorePoolSize(1);
        full.setMaxPoolSize(1);
        full.setQueueCapacity(0);
        full.initialize();
        CountDownLatch release = new CountDownLatch(1);
        try {
            full.execute(() -> {
                try {
                    release.await();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            });
            var s = new ProfileVerificationService(
                    List.of(verifier("google", t -> new VerifiedProfile("google", "sub", null, null, null, null, null))),
                    full, props);

            assertThatThrownBy(() -> s.verify("google", "abc"))
                    .isInstanceOf(AuthException.class)
                    .extracting(e -> ((AuthException) e).code())
                    .isEqualTo(AuthErrorCode.PROFILE_VERIFICATION_FAILED);
        } finally {
            release.countDown();
            full.shutdown();
        }
    }
}
