package com.chatguard.moderation.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

@Data
@Configuration
@ConfigurationProperties(prefix = "moderation")
public class ModerationConfig {

    // Upper bound on concurrent per-community platform calls for one action
    private int maxConcurrentCommunities = 10;

    private long communityCallTimeoutMs = 5000;

    // Bounding deadline for one whole Execute call
    private long executeDeadlineMs = 30000;

    private long notificationTimeoutMs = 5000;

    // System accounts that can never be restricted (platform service accounts, the bot itself)
    private List<String> protectedAccountIds = new ArrayList<>(List.of("777000"));

    // Delete the offending message when an automatic ban fires
    private boolean deleteMessageOnAutoBan = true;

    private int auditWriteAttempts = 3;

    private int retentionDays = 90;

    private Expiry expiry = new Expiry();

    @Data
    public static class Expiry {
        private int sweepIntervalSeconds = 60;
        private int claimLeaseSeconds = 300;
        private boolean notifyAccount = true;
    }
}
