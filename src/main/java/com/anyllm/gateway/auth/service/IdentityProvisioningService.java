package com.anyllm.gateway.auth.service;

import com.anyllm.gateway.auth.entity.ApiKey;
import com.anyllm.gateway.auth.entity.Budget;
import com.anyllm.gateway.auth.entity.GatewayUser;
import com.anyllm.gateway.auth.entity.ProviderIdentity;
import com.anyllm.gateway.auth.repo.BudgetRepo;
import com.anyllm.gateway.auth.repo.GatewayUserRepo;
import com.anyllm.gateway.auth.repo.ProviderIdentityRepo;
import com.anyllm.gateway.auth.verify.VerifiedProfile;
import com.anyllm.gateway.auth.web.AuthErrorCode;
import com.anyllm.gateway.auth.web.AuthException;
import com.anyllm.gateway.config.GatewayAuthProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * 社群登入的身分建立：Budget → User → ApiKey → ProviderIdentity，同一個交易，全有或全無。
 * (provider, provider_user_id) 的唯一索引負責擋併發首次登入，輸的一方整筆回滾。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class IdentityProvisioningService {

    private final ProviderIdentityRepo identities;
    private final GatewayUserRepo users;
    private final BudgetRepo budgets;
    private final ApiKeyService apiKeyService;
    private final GatewayAuthProperties props;
    private final Clock clock;

    public record ProvisionedIdentity(
            Outcome outcome,
            GatewayUser user,
            Budget budget,
            ProviderIdentity identity,
            ApiKey apiKey,
            String apiKeyPlaintext      // 只有這次新建 key 才有
    ) {
        public enum Outcome { CREATED, EXISTING }

        public boolean isNewUser() {
            return outcome == Outcome.CREATED;
        }
    }

    @Transactional
    public ProvisionedIdentity resolveOrProvision(VerifiedProfile profile) {
        Instant now = clock.instant();
        return identities.findByProviderAndProviderUserId(profile.provider(), profile.subject())
                .map(existing -> attachExisting(existing, profile, now))
                .orElseGet(() -> createNew(profile, now));
    }

    private ProvisionedIdentity attachExisting(ProviderIdentity identity, VerifiedProfile profile, Instant now) {
        GatewayUser user = users.findById(identity.getUserId())
                .orElseThrow(() -> new AuthException(AuthErrorCode.USER_NOT_FOUND));
        if (user.isBlocked()) {
            throw new AuthException(AuthErrorCode.USER_BLOCKED);
        }
        Budget budget = budgets.findById(user.getBudgetId())
                .orElseThrow(() -> new IllegalStateException("BUDGET_MISSING userId=" + user.getUserId()));

        // 有帶才更新，不會把既有值洗成 null
        if (notBlank(profile.email())) identity.setEmail(profile.email());
        if (notBlank(profile.name())) identity.setName(profile.name());
        if (notBlank(profile.avatarUrl())) identity.setAvatarUrl(profile.avatarUrl());
        if (notBlank(profile.role())) identity.setRole(profile.role());
        if (profile.accessTokenExpiresAt() != null) identity.setAccessTokenExpiresAt(profile.accessTokenExpiresAt());
        identity.setLastLoginAt(now);
        identities.save(identity);

        // 既有 key 的明文拿不回來；沒有可用的 key 才補一把新的
        ApiKey key = apiKeyService.findPrimaryUsable(user.getUserId()).orElse(null);
        String plaintext = null;
        if (key == null) {
            ApiKeyService.IssuedApiKey issued = apiKeyService.create(
                    user.getUserId(), props.getSocialKeyName(), null, sourceMeta(profile));
            key = issued.key();
            plaintext = issued.plaintext();
            log.info("replacement social key issued: userId={} keyId={}", user.getUserId(), key.getId());
        }

        return new ProvisionedIdentity(ProvisionedIdentity.Outcome.EXISTING,
                user, budget, identity, key, plaintext);
    }

    private ProvisionedIdentity createNew(VerifiedProfile profile, Instant now) {
        GatewayAuthProperties.DefaultBudget defaults = props.getDefaultBudget();

        Budget budget = new Budget();
        budget.setMaxBudget(defaults.getMaxBudget());
        budget.setBudgetDurationSec(defaults.getDurationSec());
        budget.setCreatedAt(now);
        budget.setUpdatedAt(now);
        budget = budgets.save(budget);

        GatewayUser user = new GatewayUser();
        user.setBudgetId(budget.getBudgetId());
        user.setAlias(notBlank(profile.name()) ? profile.name() : profile.email());
        user.setBudgetStartedAt(now);
        user.setNextBudgetResetAt(defaults.getDurationSec() == null ? null : now.plusSeconds(defaults.getDurationSec()));
        user.setBlocked(false);
        user.setMetadata(sourceMeta(profile));
        user.setCreatedAt(now);
        user.setUpdatedAt(now);
        user = users.save(user);

        ApiKeyService.IssuedApiKey issued = apiKeyService.create(
                user.getUserId(), props.getSocialKeyName(), null, sourceMeta(profile));

        ProviderIdentity identity = new ProviderIdentity();
        identity.setUserId(user.getUserId());
        identity.setProvider(profile.provider());
        identity.setProviderUserId(profile.subject());
        identity.setRole(profile.role());
        identity.setEmail(profile.email());
        identity.setName(profile.name());
        identity.setAvatarUrl(profile.avatarUrl());
        identity.setAccessTokenExpiresAt(profile.accessTokenExpiresAt());
        identity.setLastLoginAt(now);
        identity.setCreatedAt(now);
        identity.setUpdatedAt(now);
        try {
            // 立即 flush，讓唯一索引衝突在這裡就浮出來
            identity = identities.saveAndFlush(identity);
        } catch (DataIntegrityViolationException e) {
            // 只有 (provider, subject) 撞唯一索引才是競態；欄位過長等其他錯誤原樣往上丟
            if (!isIdentityRace(e)) throw e;
            throw new AuthException(AuthErrorCode.PROVISIONING_CONFLICT,
                    AuthErrorCode.PROVISIONING_CONFLICT.defaultMessage(), e);
        }

        log.info("identity provisioned: provider={} userId={} budgetId={} keyId={}",
                profile.provider(), user.getUserId(), budget.getBudgetId(), issued.key().getId());

        return new ProvisionedIdentity(ProvisionedIdentity.Outcome.CREATED,
                user, budget, identity, issued.key(), issued.plaintext());
    }

    /** 沿 cause 鏈找 (provider, provider_user_id) 唯一索引的名字；H2 / MySQL 的訊息都會帶 */
    static boolean isIdentityRace(Throwable e) {
        for (Throwable t = e; t != null; t = (t.getCause() == t) ? null : t.getCause()) {
            String msg = t.getMessage();
            if (msg != null && msg.toLowerCase(Locale.ROOT).contains(ProviderIdentity.UX_PROVIDER_SUBJECT)) {
                return true;
            }
        }
        return false;
    }

    private static Map<String, Object> sourceMeta(VerifiedProfile profile) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("source", "social-login");
        m.put("provider", profile.provider());
        return m;
    }

    private static boolean notBlank(String s) {
        return s != null && !s.isBlank();
    }
}
