package com.anyllm.gateway.usage.service;

import com.anyllm.gateway.auth.entity.Budget;
import com.anyllm.gateway.auth.entity.GatewayUser;
import com.anyllm.gateway.auth.repo.BudgetRepo;
import com.anyllm.gateway.auth.repo.GatewayUserRepo;
import com.anyllm.gateway.auth.web.AuthErrorCode;
import com.anyllm.gateway.auth.web.AuthException;
import com.anyllm.gateway.usage.dto.BudgetStatus;
import com.anyllm.gateway.usage.dto.UsageEventRequest;
import com.anyllm.gateway.usage.entity.BudgetResetLog;
import com.anyllm.gateway.usage.entity.UsageLog;
import com.anyllm.gateway.usage.repo.BudgetResetLogRepository;
import com.anyllm.gateway.usage.repo.UsageLogRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;

/**
 * 預算檢查與用量入帳。spend 只用單一 UPDATE 累加；到期重置採 lazy + BudgetResetJob 兩條路，規則相同。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class UsageLedger {

    public static final String STATUS_SUCCESS = "success";

    private final GatewayUserRepo users;
    private final BudgetRepo budgets;
    private final UsageLogRepository usageLogs;
    private final BudgetResetLogRepository resetLogs;
    private final Clock clock;

    @Transactional
    public BudgetStatus checkBudget(String userId) {
        Instant now = clock.instant();
        GatewayUser user = requireUser(userId);
        if (user.isBlocked()) throw new AuthException(AuthErrorCode.USER_BLOCKED);

        user = applyResetIfDue(user, now);
        Budget budget = budgets.findById(user.getBudgetId()).orElse(null);
        BigDecimal max = (budget == null) ? null : budget.getMaxBudget();
        BigDecimal spend = user.getSpend() == null ? BigDecimal.ZERO : user.getSpend();

        if (max != null && spend.compareTo(max) >= 0) {
            log.info("budget exceeded: userId={} spend={} max={}", userId, spend, max);
            throw new AuthException(AuthErrorCode.BUDGET_EXCEEDED,
                    "Budget exceeded: spend=" + spend.toPlainString() + " max_budget=" + max.toPlainString());
        }

        BigDecimal remaining = (max == null) ? null : max.subtract(spend);
        return new BudgetStatus(userId, true, spend, max, remaining, user.getNextBudgetResetAt());
    }

    @Transactional
    public UsageLog recordUsage(String userId, String apiKeyId, UsageEventRequest entry) {
        Instant now = clock.instant();
        GatewayUser user = requireUser(userId);
        // 先把到期的窗口歸零，這筆才會記到新窗口
        applyResetIfDue(user, now);

        long prompt = entry.promptTokens() == null ? 0L : entry.promptTokens();
        long completion = entry.completionTokens() == null ? 0L : entry.completionTokens();
        BigDecimal cost = entry.cost() == null ? BigDecimal.ZERO : entry.cost();

        UsageLog row = new UsageLog();
        row.setUserId(userId);
        row.setApiKeyId(apiKeyId);
        row.setTimestamp(now);
        row.setModel(entry.model());
        row.setProvider(entry.provider());
        row.setEndpoint(entry.endpoint());
        row.setPromptTokens(prompt);
        row.setCompletionTokens(completion);
        row.setTotalTokens(entry.totalTokens() == null ? prompt + completion : entry.totalTokens());
        row.setCost(cost);
        row.setStatus(entry.status() == null || entry.status().isBlank() ? STATUS_SUCCESS : entry.status());
        row.setErrorMessage(entry.errorMessage());
        row = usageLogs.save(row);

        if (cost.signum() > 0) {
            users.accrueSpend(userId, cost, now);
        }
        return row;
    }

    /** BudgetResetJob 用；回傳這次是否真的重置 */
    @Transactional
    public boolean resetIfDue(String userId) {
        return users.findById(userId)
                .map(u -> resetSpend(u, clock.instant()) > 0)
                .orElse(false);
    }

    /** 到期就歸零並排下一次重置；回傳重新讀取後的 user */
    private GatewayUser applyResetIfDue(GatewayUser user, Instant now) {
        return resetSpend(user, now) > 0 ? requireUser(user.getUserId()) : user;
    }

    // resetSpendIfDue 的 where 條件保證同一個窗口只會重置一次
    private int resetSpend(GatewayUser user, Instant now) {
        Instant next = user.getNextBudgetResetAt();
        if (next == null || next.isAfter(now)) return 0;

        Long duration = budgets.findById(user.getBudgetId())
                .map(Budget::getBudgetDurationSec)
                .orElse(null);
        Instant nextReset = (duration == null) ? null : now.plusSeconds(duration);

        int n = users.resetSpendIfDue(user.getUserId(), now, nextReset);
        if (n > 0) {
            BudgetResetLog entry = new BudgetResetLog();
            entry.setUserId(user.getUserId());
            entry.setBudgetId(user.getBudgetId());
            entry.setPreviousSpend(user.getSpend() == null ? BigDecimal.ZERO : user.getSpend());
            entry.setResetAt(now);
            entry.setNextResetAt(nextReset);
            resetLogs.save(entry);
            log.info("budget reset: userId={} previousSpend={} nextReset={}",
                    user.getUserId(), entry.getPreviousSpend(), nextReset);
        }
        return n;
    }

    private GatewayUser requireUser(String userId) {
        return users.findById(userId)
                .orElseThrow(() -> new AuthException(AuthErrorCode.USER_NOT_FOUND));
    }
}
