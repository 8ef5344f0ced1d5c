package com.anyllm.gateway.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Data
@ConfigurationProperties(prefix = "app.auth")
public class GatewayAuthProperties {

    /** 管理者用的靜態金鑰（constant-time 比對） */
    private String masterKey;

    /** access token 簽章用；沒設就退回 masterKey */
    private String jwtSecret;

    /** access token 有效期（預設 15 分） */
    private Duration accessTtl = Duration.ofMinutes(15);

    /** refresh token 有效期（預設 30 天） */
    private Duration refreshTtl = Duration.ofDays(30);

    /** 外部 profile 驗證的上限時間 */
    private Duration verificationTimeout = Duration.ofSeconds(5);

    /** refresh token 重放時要撤銷的範圍 */
    private ReuseRevocationScope reuseRevocation = ReuseRevocationScope.USER_KEY;

    /** 首次登入自動建立的 api key 名稱 */
    private String socialKeyName = "social-login";

    private DefaultBudget defaultBudget = new DefaultBudget();

    private Google google = new Google();

    public enum ReuseRevocationScope {
        /** 同一條登入鏈 */
        FAMILY,
        /** 同 user + 同 api key 底下所有仍有效的 session */
        USER_KEY
    }

    @Data
    public static class DefaultBudget {
        /** null = 無上限 */
        private BigDecimal maxBudget;
        /** null = 不重置 */
        private Long durationSec;
    }

    @Data
    public static class Google {
        private boolean enabled = false;
        private List<String> clientIds = new ArrayList<>();
    }
}
