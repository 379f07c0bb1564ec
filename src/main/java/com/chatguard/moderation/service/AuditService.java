package com.chatguard.moderation.service;

import com.aerospike.client.AerospikeException;
import com.aerospike.client.ResultCode;
import com.chatguard.moderation.config.MetricsConfig;
import com.chatguard.moderation.config.ModerationConfig;
import com.chatguard.moderation.model.Actor;
import com.chatguard.moderation.model.AuditAction;
import com.chatguard.moderation.model.AuditEntry;
import com.chatguard.moderation.model.PagedResponse;
import com.chatguard.moderation.repository.AuditLogRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.UUID;

/**
 * Append-only audit trail. A failed write is retried a bounded number of
 * times and then logged and counted; it never fails the action being audited.
 * Entries are written create-only under a fixed id, so a retry that finds the
 * entry already present means an earlier attempt landed.
 */
@Service
public class AuditService {

    private static final Logger log = LoggerFactory.getLogger(AuditService.class);

    private final AuditLogRepository auditLogRepository;
    private final ModerationConfig config;
    private final MetricsConfig metricsConfig;
    private final Clock clock;

    public AuditService(AuditLogRepository auditLogRepository,
                        ModerationConfig config,
                        MetricsConfig metricsConfig,
                        Clock clock) {
        this.auditLogRepository = auditLogRepository;
        this.config = config;
        this.metricsConfig = metricsConfig;
        this.clock = clock;
    }

    public void record(Actor actor, String target, AuditAction action, String outcome,
                       String details, String communityId) {
        AuditEntry entry = AuditEntry.builder()
                .entryId(UUID.randomUUID().toString())
                .actor(actor.asString())
                .target(target)
                .action(action)
                .outcome(outcome)
                .details(details)
                .communityId(communityId)
                .timestamp(clock.millis())
                .build();

        int attempts = Math.max(1, config.getAuditWriteAttempts());
        for (int attempt = 1; attempt <= attempts; attempt++) {
            try {
                auditLogRepository.append(entry);
                return;
            } catch (Exception e) {
                if (attempt > 1 && alreadyStored(e)) {
                    log.debug("Audit entry {} already stored by an earlier attempt", entry.getEntryId());
                    return;
                }
                if (attempt == attempts) {
                    metricsConfig.recordAuditFailure();
                    log.error("Dropping audit entry {} {} on {} after {} attempts",
                            action, outcome, target, attempts, e);
                } else {
                    log.warn("Audit write attempt {} failed for {} on {}: {}", attempt, action, target, e.getMessage());
                }
            }
        }
    }

    private static boolean alreadyStored(Exception e) {
        return e instanceof AerospikeException ae && ae.getResultCode() == ResultCode.KEY_EXISTS_ERROR;
    }

    public PagedResponse<AuditEntry> findByTarget(String target, AuditAction action, int limit, Long before) {
        return auditLogRepository.findByTarget(target, action, limit, before);
    }
}
