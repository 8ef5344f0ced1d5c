package com.anyllm.gateway.auth.service;

import com.anyllm.gateway.auth.dto.SocialLoginRequest;
import com.anyllm.gateway.auth.repo.GatewayUserRepo;
import com.anyllm.gateway.auth.repo.ProviderIdentityRepo;
import com.anyllm.gateway.auth.web.AuthException;
import com.anyllm.gateway.testsupport.BaseSpringTest;
import com.anyllm.gateway.testsupport.TestGatewayConfig;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.test.context.bean.override.mockito.MockitoSpyBean;

import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

/**
 * provider 沒給 name 時用請求的 hint；hint 超過欄位長度不是競態，不能被當成 PROVISIONING_CONFLICT 重試。
 */
@SpringBootTest
@Import(TestGatewayConfig.class)
class SocialLoginHintOverflowTest extends BaseSpringTest {

    @Autowired SocialLoginService login;
    @Autowired ProviderIdentityRepo identities;
    @Autowired GatewayUserRepo users;

    @MockitoSpyBean IdentityProvisioningService provisioning;

    @Test
    void oversized_name_hint_propagates_without_retry_and_writes_nothing() {
        String subject = UUID.randomUUID().toString();
        long usersBefore = users.count();
        SocialLoginRequest req = new SocialLoginRequest("google", "anon-" + subject,
                null, "n".repeat(200), null,
                null, null, null, null, null, null, null);

        assertThatThrownBy(() -> login.login(req, "10.1.1.1", "ua/1"))
                .isInstanceOf(DataIntegrityViolationException.class)
                .isNotInstanceOf(AuthException.class);

        verify(provisioning, times(1)).resolveOrProvision(any());
        assertThat(identities.countByProviderAndProviderUserId("google", subject)).isZero();
        assertThat(users.count()).isEqualTo(usersBefore);
    }

    @Test
    void hints_within_limits_fill_missing_profile_fields() {
        String subject = UUID.randomUUID().toString();
        SocialLoginRequest req = new SocialLoginRequest("google", "anon-" + subject,
                "Hint@Example.com", "Hint Name", "https://img.example.com/h.png",
                null, null, null, null, null, null, null);

        var r = login.login(req, "10.1.1.1", "ua/1");

        assertThat(r.newUser()).isTrue();
        assertThat(r.user().email()).isEqualTo("hint@example.com");
        assertThat(r.user().name()).isEqualTo("Hint Name");
        assertThat(r.user().alias()).isEqualTo("Hint Name");
        assertThat(r.user().avatarUrl()).isEqualTo("https://img.example.com/h.png");
    }
}
