package com.anyllm.gateway.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskExecutor;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
@EnableAsync
public class AsyncSchedulingConfig {

    /** last_used_at 回寫（best-effort，佇列滿了直接丟棄） */
    @Bean("touchExecutor")
    public TaskExecutor touchExecutor() {
        ThreadPoolTaskExecutor ex = new ThreadPoolTaskExecutor();
        ex.setCorePoolSize(2);
        ex.setMaxPoolSize(4);
        ex.setQueueCapacity(1000);
        ex.setThreadNamePrefix("touch-");
        ex.setRejectedExecutionHandler(new java.util.concurrent.ThreadPoolExecutor.DiscardPolicy());
        ex.initialize();
        return ex;
    }

    /** 外部 profile 驗證（Google 等），搭配 app.auth.verification-timeout 截斷 */
    @Bean("verificationExecutor")
    public TaskExecutor verificationExecutor() {
        ThreadPoolTaskExecutor ex = new ThreadPoolTaskExecutor();
        ex.setCorePoolSize(4);
        ex.setMaxPoolSize(16);
        ex.setQueueCapacity(200);
        ex.setThreadNamePrefix("verify-");
        ex.initialize();
        return ex;
    }
}
