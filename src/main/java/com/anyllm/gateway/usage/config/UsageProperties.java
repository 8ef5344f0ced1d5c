package com.anyllm.gateway.usage.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "app.usage")
public class UsageProperties {

    private BudgetReset budgetReset = new BudgetReset();

    /** /v1/profile 預設回幾筆最近紀錄 */
    private int defaultRecentLimit = 10;

    @Data
    public static class BudgetReset {
        private boolean enabled = true;

        /** 每輪最多重置幾個 user */
        private int batchSize = 200;
    }
}
