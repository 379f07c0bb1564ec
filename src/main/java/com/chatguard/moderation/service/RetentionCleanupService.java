package com.chatguard.moderation.service;

import com.chatguard.moderation.config.ModerationConfig;
import com.chatguard.moderation.repository.ActionRecordRepository;
import com.chatguard.moderation.repository.AuditLogRepository;
import com.chatguard.moderation.repository.DetectionDecisionRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;

/**
 * Daily deletion of decisions, finished action records and audit entries
 * older than {@code moderation.retention-days}. Active permanent actions are kept.
 */
@Service
public class RetentionCleanupService {

    private static final Logger log = LoggerFactory.getLogger(RetentionCleanupService.class);

    private final DetectionDecisionRepository decisionRepository;
    private final ActionRecordRepository actionRecordRepository;
    private final AuditLogRepository auditLogRepository;
    private final ModerationConfig config;
    private final Clock clock;

    public RetentionCleanupService(DetectionDecisionRepository decisionRepository,
                                   ActionRecordRepository actionRecordRepository,
                                   AuditLogRepository auditLogRepository,
                                   ModerationConfig config,
                                   Clock clock) {
        this.decisionRepository = decisionRepository;
        this.actionRecordRepository = actionRecordRepository;
        this.auditLogRepository = auditLogRepository;
        this.config = config;
        this.clock = clock;
    }

    @Scheduled(cron = "${moderation.retention-cron:0 30 3 * * *}")
    public void cleanup() {
        long cutoff = clock.millis() - Duration.ofDays(config.getRetentionDays()).toMillis();
        try {
            int decisions = decisionRepository.deleteEvaluatedBefore(cutoff);
            int actions = actionRecordRepository.deleteRetired(cutoff);
            int audit = auditLogRepository.deleteOlderThan(cutoff);
            log.info("Retention cleanup removed {} decisions, {} action records, {} audit entries older than {} days",
                    decisions, actions, audit, config.getRetentionDays());
        } catch (Exception e) {
            log.error("Retention cleanup failed", e);
        }
    }
}
