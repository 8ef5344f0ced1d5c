package com.anyllm.gateway.users.service;

import com.anyllm.gateway.auth.service.IdentityProvisioningService;
import com.anyllm.gateway.auth.verify.VerifiedProfile;
import com.anyllm.gateway.testsupport.BaseSpringTest;
import com.anyllm.gateway.testsupport.TestGatewayConfig;
import com.anyllm.gateway.usage.dto.UsageEventRequest;
import com.anyllm.gateway.usage.service.UsageLedger;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;

import java.math.BigDecimal;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(properties = "app.usage.default-recent-limit=2")
@Import(TestGatewayConfig.class)
class ProfileServiceRecentLimitTest extends BaseSpringTest {

    @Autowired ProfileService profiles;
    @Autowired IdentityProvisioningService provisioning;
    @Autowired UsageLedger ledger;

    private String userWithThreeEvents() {
        var p = provisioning.resolveOrProvision(new VerifiedProfile("google", UUID.randomUUID().toString(),
                null, "Recent", null, VerifiedProfile.DEFAULT_ROLE, null));
        String userId = p.user().getUserId();
        for (int i = 0; i < 3; i++) {
            ledger.recordUsage(userId, p.apiKey().getId(), new UsageEventRequest(
                    "gpt-4o", "openai", null, 1L, 1L, null, new BigDecimal("0.01"), null, null));
        }
        return userId;
    }

    @Test
    void missing_limit_uses_configured_default() {
        String userId = userWithThreeEvents();

        assertThat(profiles.profile(userId, null).recentUsage()).hasSize(2);
    }

    @Test
    void explicit_limit_wins_over_default() {
        String userId = userWithThreeEvents();

        assertThat(profiles.profile(userId, 3).recentUsage()).hasSize(3);
        assertThat(profiles.profile(userId, 0).recentUsage()).isEmpty();
    }
}
