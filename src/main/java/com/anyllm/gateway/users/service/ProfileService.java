package com.anyllm.gateway.users.service;

import com.anyllm.gateway.auth.dto.BudgetView;
import com.anyllm.gateway.auth.dto.UserView;
import com.anyllm.gateway.auth.entity.Budget;
import com.anyllm.gateway.auth.entity.GatewayUser;
import com.anyllm.gateway.auth.repo.ApiKeyRepo;
import com.anyllm.gateway.auth.repo.BudgetRepo;
import com.anyllm.gateway.auth.repo.GatewayUserRepo;
import com.anyllm.gateway.auth.repo.ProviderIdentityRepo;
import com.anyllm.gateway.auth.web.AuthErrorCode;
import com.anyllm.gateway.auth.web.AuthException;
import com.anyllm.gateway.usage.config.UsageProperties;
import com.anyllm.gateway.usage.dto.UsageLogView;
import com.anyllm.gateway.usage.dto.UsageWindow;
import com.anyllm.gateway.usage.repo.UsageLogRepository;
import com.anyllm.gateway.users.dto.ApiKeyView;
import com.anyllm.gateway.users.dto.ProfileResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.PageRequest;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.server.ResponseStatusException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

@Service
@RequiredArgsConstructor
public class ProfileService {

    public static final int MAX_RECENT_LIMIT = 100;

    private final GatewayUserRepo users;
    private final BudgetRepo budgets;
    private final ProviderIdentityRepo identities;
    private final ApiKeyRepo apiKeys;
    private final UsageLogRepository usageLogs;
    private final UsageProperties usageProps;
    private final Clock clock;

    @Transactional(readOnly = true)
    public ProfileResponse profile(String userId, Integer requestedLimit) {
        int recentLimit = (requestedLimit == null) ? usageProps.getDefaultRecentLimit() : requestedLimit;
        if (recentLimit < 0 || recentLimit > MAX_RECENT_LIMIT) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "RECENT_LIMIT_OUT_OF_RANGE");
        }

        GatewayUser user = requireUser(userId);
        Budget budget = budgets.findById(user.getBudgetId())
                .orElseThrow(() -> new IllegalStateException("BUDGET_MISSING userId=" + userId));
        var identity = identities.findByUserId(userId).orElse(null);

        Instant now = clock.instant();
        var usage = new ProfileResponse.Usage(
                window(userId, now.minus(Duration.ofHours(24))),
                window(userId, now.minus(Duration.ofDays(7))),
                window(userId, now.minus(Duration.ofDays(30)))
        );

        List<UsageLogView> recent = (recentLimit == 0)
                ? List.of()
                : usageLogs.findByUserIdOrderByTimestampDesc(userId, PageRequest.of(0, recentLimit))
                        .stream().map(UsageLogView::of).toList();

        return new ProfileResponse(UserView.of(user, identity), BudgetView.of(budget, user), usage, recent);
    }

    @Transactional(readOnly = true)
    public List<ApiKeyView> keys(String userId) {
        requireUser(userId);
        return apiKeys.findByUserIdOrderByCreatedAtAsc(userId).stream().map(ApiKeyView::of).toList();
    }

    @Transactional(readOnly = true)
    public GatewayUser requireUser(String userId) {
        return users.findById(userId)
                .orElseThrow(() -> new AuthException(AuthErrorCode.USER_NOT_FOUND));
    }

    private UsageWindow window(String userId, Instant since) {
        return UsageWindow.of(usageLogs.aggregateSince(userId, since));
    }
}
