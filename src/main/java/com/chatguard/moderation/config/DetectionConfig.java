package com.chatguard.moderation.config;

import com.chatguard.moderation.model.AggregationPolicy;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.List;

@Data
@Configuration
@ConfigurationProperties(prefix = "detection")
public class DetectionConfig {

    // Net confidence at or above which the author is banned automatically
    private int autoBanThreshold = 80;

    // Net confidence at or above which the message is routed to human review
    private int reviewQueueThreshold = 50;

    // Below this confidence, short messages are never acted on automatically
    private int maxConfidenceVetoThreshold = 95;

    // Messages shorter than this are subject to the veto
    private int minMessageLength = 10;

    // Global training mode: decisions are recorded but never enforced
    private boolean trainingMode = false;

    private AggregationPolicy aggregationPolicy = AggregationPolicy.WEIGHTED_MAX;

    // When true, checks that only ran because of always-run also vote for enforcement
    private boolean alwaysRunVotes = false;

    // Per-check timeout used when the check config does not carry its own
    private long checkTimeoutMs = 5000;

    // Bounding deadline for one whole evaluation
    private long evaluationDeadlineMs = 15000;

    private int maxConcurrentChecks = 8;

    // How often (in seconds) to refresh the in-memory check config cache from Aerospike.
    private int configCacheRefreshSeconds = 60;

    private CheckDefaults checkDefaults = new CheckDefaults();

    @Data
    public static class CheckDefaults {
        private List<String> stopWords = List.of(
                "crypto", "airdrop", "giveaway", "investment", "profit", "earn",
                "casino", "bonus", "whatsapp", "dm me", "guaranteed", "forex");
        private int stopWordsConfidencePerMatch = 35;
        private double spacingRatioThreshold = 0.7;
        private int spacingMinWords = 5;
        private int spacingMinLength = 20;
        private int invisibleCharsMinCount = 1;
        private double similarityThreshold = 0.5;
        private int similarityShingleSize = 3;
        private double bayesMinSpamProbability = 0.5;
        private int bayesMinSamplesPerClass = 10;
    }
}
