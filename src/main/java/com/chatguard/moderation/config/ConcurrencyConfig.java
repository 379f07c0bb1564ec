package com.chatguard.moderation.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;

/**
 * Thread pools for the two fan-out paths (check execution and per-community
 * enforcement) plus the default pool behind {@code @Async}.
 */
@Configuration
public class ConcurrencyConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean(name = "taskExecutor")
    public ThreadPoolTaskExecutor taskExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(2);
        executor.setMaxPoolSize(4);
        executor.setQueueCapacity(500);
        executor.setThreadNamePrefix("async-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
        return executor;
    }

    @Bean(name = "checkExecutor")
    public ThreadPoolTaskExecutor checkExecutor(DetectionConfig detectionConfig) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(detectionConfig.getMaxConcurrentChecks());
        executor.setMaxPoolSize(detectionConfig.getMaxConcurrentChecks());
        executor.setQueueCapacity(1000);
        executor.setThreadNamePrefix("check-");
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.initialize();
        return executor;
    }

    @Bean(name = "enforcementExecutor")
    public ThreadPoolTaskExecutor enforcementExecutor(ModerationConfig moderationConfig) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(moderationConfig.getMaxConcurrentCommunities());
        executor.setMaxPoolSize(moderationConfig.getMaxConcurrentCommunities());
        executor.setQueueCapacity(1000);
        executor.setThreadNamePrefix("enforce-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
        return executor;
    }
}
