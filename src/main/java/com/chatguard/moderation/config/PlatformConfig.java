package com.chatguard.moderation.config;

import com.chatguard.moderation.platform.DryRunPlatformGateway;
import com.chatguard.moderation.platform.PlatformGateway;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class PlatformConfig {

    private static final Logger log = LoggerFactory.getLogger(PlatformConfig.class);

    @Bean
    @ConditionalOnMissingBean(PlatformGateway.class)
    public PlatformGateway dryRunPlatformGateway() {
        log.warn("No platform adapter registered, enforcement runs in DRY-RUN mode.");
        return new DryRunPlatformGateway();
    }
}
