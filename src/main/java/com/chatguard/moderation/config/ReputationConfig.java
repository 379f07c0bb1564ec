package com.chatguard.moderation.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Data
@Configuration
@ConfigurationProperties(prefix = "reputation")
public class ReputationConfig {

    private boolean enabled = false;
    private String baseUrl = "https://www.virustotal.com/api/v3";
    private String apiKey;
    private long timeoutMs = 4000;

    // Provider quota: lookups beyond either cap are skipped (fail open)
    private long dailyLimit = 500;
    private long perMinuteLimit = 4;

    // Engines flagging the URL as malicious before it counts as spam
    private int maliciousEngineThreshold = 2;
}
