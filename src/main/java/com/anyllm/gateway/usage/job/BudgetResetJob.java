package com.anyllm.gateway.usage.job;

import com.anyllm.gateway.auth.repo.GatewayUserRepo;
import com.anyllm.gateway.usage.config.UsageProperties;
import com.anyllm.gateway.usage.service.UsageLedger;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.domain.PageRequest;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.List;

/**
 * 定期把 next_budget_reset_at 已過的 user 歸零（與 UsageLedger 的 lazy 重置同規則）。
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "app.usage.budget-reset", name = "enabled", havingValue = "true", matchIfMissing = true)
public class BudgetResetJob {

    private final UsageProperties props;
    private final GatewayUserRepo users;
    private final UsageLedger ledger;
    private final Clock clock;

    @Scheduled(fixedDelayString = "${app.usage.budget-reset.fixed-delay:PT5M}", initialDelayString = "PT30S")
    public void runOnce() {
        List<String> due = users.findIdsDueForReset(clock.instant(),
                PageRequest.of(0, props.getBudgetReset().getBatchSize()));
        if (due.isEmpty()) return;

        int reset = 0;
        for (String userId : due) {
            try {
                if (ledger.resetIfDue(userId)) reset++;
            } catch (Exception e) {
                // 單一 user 失敗不影響其他人，下一輪會再撿到
                log.warn("budget reset failed. userId={}", userId, e);
            }
        }
        log.info("budget reset sweep: due={} reset={}", due.size(), reset);
    }
}
