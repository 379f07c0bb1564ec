package com.chatguard.moderation.service;

import com.chatguard.moderation.config.MetricsConfig;
import com.chatguard.moderation.config.ModerationConfig;
import com.chatguard.moderation.model.ActionKind;
import com.chatguard.moderation.model.ActionRecord;
import com.chatguard.moderation.model.Actor;
import com.chatguard.moderation.model.AuditAction;
import com.chatguard.moderation.model.FanoutResult;
import com.chatguard.moderation.platform.PlatformGateway;
import com.chatguard.moderation.repository.ActionRecordRepository;
import com.chatguard.moderation.repository.MembershipRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Lifts timed restrictions whose expiry has passed.
 *
 * Each due record is claimed with a generation-checked write first, so two
 * instances sweeping at once never both lift the same record. A record whose
 * lift failed everywhere keeps its claim until the lease runs out and is
 * retried by a later sweep.
 *
 * The check and the lift run under the account's lock, the same one moderation
 * commands take. A record that a newer active restriction of the same family
 * has replaced is closed without touching the platform.
 */
@Service
public class ExpiryReconcilerService {

    private static final Logger log = LoggerFactory.getLogger(ExpiryReconcilerService.class);

    static final Actor RECONCILER = Actor.system("expiry-reconciler");

    private final ActionRecordRepository actionRecordRepository;
    private final MembershipRepository membershipRepository;
    private final PlatformGateway platformGateway;
    private final CommunityFanoutExecutor fanoutExecutor;
    private final NotificationDeliveryService notificationService;
    private final AuditService auditService;
    private final AccountLocks accountLocks;
    private final ModerationConfig config;
    private final MetricsConfig metricsConfig;
    private final Clock clock;
    private final String instanceId = UUID.randomUUID().toString();

    public ExpiryReconcilerService(ActionRecordRepository actionRecordRepository,
                                   MembershipRepository membershipRepository,
                                   PlatformGateway platformGateway,
                                   CommunityFanoutExecutor fanoutExecutor,
                                   NotificationDeliveryService notificationService,
                                   AuditService auditService,
                                   AccountLocks accountLocks,
                                   ModerationConfig config,
                                   MetricsConfig metricsConfig,
                                   Clock clock) {
        this.actionRecordRepository = actionRecordRepository;
        this.membershipRepository = membershipRepository;
        this.platformGateway = platformGateway;
        this.fanoutExecutor = fanoutExecutor;
        this.notificationService = notificationService;
        this.auditService = auditService;
        this.accountLocks = accountLocks;
        this.config = config;
        this.metricsConfig = metricsConfig;
        this.clock = clock;
    }

    @Scheduled(fixedRateString = "${moderation.expiry.sweep-interval-seconds:60}",
               timeUnit = TimeUnit.SECONDS,
               initialDelayString = "30")
    public void scheduledSweep() {
        try {
            sweep();
        } catch (Exception e) {
            log.error("Expiry sweep failed", e);
        }
    }

    /**
     * @return number of records reversed by this sweep
     */
    public int sweep() {
        long now = clock.millis();
        long leaseMs = TimeUnit.SECONDS.toMillis(config.getExpiry().getClaimLeaseSeconds());
        List<ActionRecord> due = actionRecordRepository.findExpiredUnreversed(now);
        int reversed = 0;

        for (ActionRecord record : due) {
            if (record.getKind() != ActionKind.MUTE && record.getKind() != ActionKind.TEMP_BAN) {
                continue;
            }
            if (!actionRecordRepository.tryClaim(record, instanceId, now, leaseMs)) {
                log.debug("Action record {} claimed elsewhere, skipping", record.getRecordId());
                continue;
            }
            ReentrantLock lock = accountLocks.lockFor(record.getAccountId());
            try {
                lock.lockInterruptibly();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Expiry sweep interrupted after lifting {} records", reversed);
                break;
            }
            try {
                if (reconcile(record.getRecordId(), now)) {
                    reversed++;
                }
            } catch (Exception e) {
                log.error("Failed to lift {} record {} for {}", record.getKind(), record.getRecordId(),
                        record.getAccountId(), e);
            } finally {
                lock.unlock();
            }
        }

        if (reversed > 0) {
            log.info("Expiry sweep lifted {} of {} due restrictions", reversed, due.size());
        }
        return reversed;
    }

    private boolean reconcile(String recordId, long now) {
        ActionRecord record = actionRecordRepository.findById(recordId);
        if (record == null || record.getReversedAt() > 0 || !instanceId.equals(record.getClaimedBy())) {
            log.debug("Action record {} changed after the claim, skipping", recordId);
            return false;
        }

        List<ActionKind> family = record.getKind() == ActionKind.MUTE
                ? List.of(ActionKind.MUTE)
                : List.of(ActionKind.BAN, ActionKind.TEMP_BAN);
        List<ActionRecord> newer = actionRecordRepository.findActive(record.getAccountId(), family, now);
        if (!newer.isEmpty()) {
            return closeSuperseded(record, newer.get(0), now);
        }
        return lift(record, now);
    }

    private boolean closeSuperseded(ActionRecord record, ActionRecord newer, long now) {
        record.reverse(RECONCILER.asString(), now);
        if (!actionRecordRepository.markReversed(record)) {
            return false;
        }
        log.info("{} record {} for {} expired under active {} record {}, closed without lifting",
                record.getKind(), record.getRecordId(), record.getAccountId(), newer.getKind(), newer.getRecordId());
        metricsConfig.recordReversal(record.getKind().name());
        auditService.record(RECONCILER, record.getAccountId(), AuditAction.EXPIRY_REVERSAL, "SUPERSEDED",
                String.format("%s record %s superseded by %s record %s",
                        record.getKind(), record.getRecordId(), newer.getKind(), newer.getRecordId()),
                null);
        return true;
    }

    private boolean lift(ActionRecord record, long now) {
        String accountId = record.getAccountId();
        List<String> communities = membershipRepository.findCommunityIds(accountId);

        FanoutResult fanout = fanoutExecutor.execute(communities, communityId -> {
            if (record.getKind() == ActionKind.MUTE) {
                platformGateway.unrestrictMember(communityId, accountId);
            } else {
                platformGateway.unbanMember(communityId, accountId);
            }
        });

        if (fanout.allFailed() || fanout.cancelled()) {
            log.warn("Could not lift {} for {} ({}), will retry after the claim lease",
                    record.getKind(), accountId, fanout.firstError());
            return false;
        }

        record.reverse(RECONCILER.asString(), now);
        if (!actionRecordRepository.markReversed(record)) {
            // reversed by someone else in the meantime; they own the notice
            return false;
        }

        metricsConfig.recordReversal(record.getKind().name());
        auditService.record(RECONCILER, accountId, AuditAction.EXPIRY_REVERSAL, "SUCCEEDED",
                String.format("%s record %s lifted in %d communities (%d failed)",
                        record.getKind(), record.getRecordId(), fanout.successCount(), fanout.failureCount()),
                null);

        if (config.getExpiry().isNotifyAccount()) {
            String fallback = fanout.succeeded().isEmpty() ? null : fanout.succeeded().get(0);
            String text = record.getKind() == ActionKind.MUTE
                    ? "Your mute has expired. You can post again."
                    : "Your temporary ban has expired. You may rejoin.";
            notificationService.deliver(accountId, fallback, null, text);
        }
        return true;
    }
}
