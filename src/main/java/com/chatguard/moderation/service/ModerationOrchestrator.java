package com.chatguard.moderation.service;

import com.chatguard.moderation.config.MetricsConfig;
import com.chatguard.moderation.config.ModerationConfig;
import com.chatguard.moderation.model.AccountMembership;
import com.chatguard.moderation.model.ActionKind;
import com.chatguard.moderation.model.ActionOutcome;
import com.chatguard.moderation.model.ActionRecord;
import com.chatguard.moderation.model.AuditAction;
import com.chatguard.moderation.model.DeliveryResult;
import com.chatguard.moderation.model.EnforcementIntent;
import com.chatguard.moderation.model.FanoutResult;
import com.chatguard.moderation.model.OutcomeStatus;
import com.chatguard.moderation.platform.PlatformGateway;
import com.chatguard.moderation.repository.ActionRecordRepository;
import com.chatguard.moderation.repository.MembershipRepository;
import io.micrometer.observation.annotation.Observed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Applies one moderation command across every community the account is in.
 *
 * Flow:
 * 1. Validate the intent; protected targets are rejected before any platform call
 * 2. Take the account's lock, so status reads and writes are one critical section
 * 3. Fan the platform primitive out per community, collecting failures
 * 4. Persist the action record unless every community failed
 * 5. Notify the account once (BAN, TEMP_BAN, MUTE) and write the audit entry
 *
 * Trust is global: one grant per account. BAN and TEMP_BAN revoke it.
 */
@Service
public class ModerationOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(ModerationOrchestrator.class);

    private static final List<ActionKind> BAN_KINDS = List.of(ActionKind.BAN, ActionKind.TEMP_BAN);
    private static final List<ActionKind> TRUST_KINDS = List.of(ActionKind.TRUST);
    private static final List<ActionKind> MUTE_KINDS = List.of(ActionKind.MUTE);

    private final PlatformGateway platformGateway;
    private final MembershipRepository membershipRepository;
    private final ActionRecordRepository actionRecordRepository;
    private final CommunityFanoutExecutor fanoutExecutor;
    private final NotificationDeliveryService notificationService;
    private final AuditService auditService;
    private final AccountLocks accountLocks;
    private final ModerationConfig config;
    private final MetricsConfig metricsConfig;
    private final Clock clock;

    public ModerationOrchestrator(PlatformGateway platformGateway,
                                  MembershipRepository membershipRepository,
                                  ActionRecordRepository actionRecordRepository,
                                  CommunityFanoutExecutor fanoutExecutor,
                                  NotificationDeliveryService notificationService,
                                  AuditService auditService,
                                  AccountLocks accountLocks,
                                  ModerationConfig config,
                                  MetricsConfig metricsConfig,
                                  Clock clock) {
        this.platformGateway = platformGateway;
        this.membershipRepository = membershipRepository;
        this.actionRecordRepository = actionRecordRepository;
        this.fanoutExecutor = fanoutExecutor;
        this.notificationService = notificationService;
        this.auditService = auditService;
        this.accountLocks = accountLocks;
        this.config = config;
        this.metricsConfig = metricsConfig;
        this.clock = clock;
    }

    @Observed(name = "moderation.execute", contextualName = "execute-moderation-action")
    public ActionOutcome execute(EnforcementIntent intent) {
        String rejection = validate(intent);
        if (rejection != null) {
            log.info("Rejected {} against {}: {}", intent.getKind(), intent.getTargetAccountId(), rejection);
            return finish(intent, ActionOutcome.rejected(intent, rejection));
        }

        ReentrantLock lock = accountLocks.lockFor(intent.getTargetAccountId());
        try {
            lock.lockInterruptibly();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return finish(intent, outcome(intent, OutcomeStatus.CANCELLED).errorDetail("Interrupted").build());
        }

        try {
            ActionOutcome outcome;
            switch (intent.getKind()) {
                case TRUST:
                    outcome = trust(intent);
                    break;
                case UNTRUST:
                    outcome = untrust(intent);
                    break;
                case UNBAN:
                    outcome = unban(intent);
                    break;
                default:
                    outcome = restrict(intent);
                    break;
            }
            return finish(intent, outcome);
        } finally {
            lock.unlock();
        }
    }

    private String validate(EnforcementIntent intent) {
        if (intent.getKind() == null) {
            return "Action kind is required";
        }
        if (intent.getTargetAccountId() == null || intent.getTargetAccountId().isBlank()) {
            return "Target account is required";
        }
        if (intent.getExecutor() == null) {
            return "Executor is required";
        }
        Duration duration = intent.getDuration();
        if (intent.getKind().isTimed()) {
            if (duration == null || duration.isZero() || duration.isNegative()) {
                return intent.getKind() + " requires a positive duration";
            }
        } else if (duration != null && !duration.isZero()) {
            return intent.getKind() + " does not take a duration";
        }

        if (intent.getKind().exemptsAdmins()) {
            if (config.getProtectedAccountIds().contains(intent.getTargetAccountId())) {
                return "Account " + intent.getTargetAccountId() + " is a protected system account";
            }
            if (membershipRepository.findByAccountId(intent.getTargetAccountId()).isAdminAnywhere()) {
                return "Account " + intent.getTargetAccountId() + " is an admin in a managed community";
            }
        }
        return null;
    }

    private ActionOutcome trust(EnforcementIntent intent) {
        long now = clock.millis();
        if (!actionRecordRepository.findActive(intent.getTargetAccountId(), TRUST_KINDS, now).isEmpty()) {
            return outcome(intent, OutcomeStatus.NO_OP).errorDetail("Account is already trusted").build();
        }
        ActionRecord record = newRecord(intent, now, 0);
        actionRecordRepository.save(record);
        return outcome(intent, OutcomeStatus.SUCCEEDED).actionRecordId(record.getRecordId()).build();
    }

    private ActionOutcome untrust(EnforcementIntent intent) {
        long now = clock.millis();
        if (!reverseActive(intent.getTargetAccountId(), TRUST_KINDS, intent.getExecutor().asString(), now)) {
            return outcome(intent, OutcomeStatus.NO_OP).errorDetail("Account is not trusted").build();
        }
        return outcome(intent, OutcomeStatus.SUCCEEDED).build();
    }

    private ActionOutcome restrict(EnforcementIntent intent) {
        String accountId = intent.getTargetAccountId();
        ActionKind kind = intent.getKind();
        long issuedAt = clock.millis();
        long expiresAt = kind.isTimed() ? issuedAt + intent.getDuration().toMillis() : 0;
        Instant until = Instant.ofEpochMilli(expiresAt);

        AccountMembership membership = membershipRepository.findByAccountId(accountId);
        List<String> communities = membership.communityIds();

        FanoutResult fanout = fanoutExecutor.execute(communities, communityId -> {
            switch (kind) {
                case BAN:
                    platformGateway.banMember(communityId, accountId);
                    break;
                case TEMP_BAN:
                    platformGateway.banMemberUntil(communityId, accountId, until);
                    break;
                case MUTE:
                    platformGateway.restrictMember(communityId, accountId, until);
                    break;
                default:
                    throw new IllegalStateException("Not a restriction: " + kind);
            }
        });
        recordFailures(kind, fanout);

        if (fanout.allFailed()) {
            log.error("{} of {} failed in all {} communities: {}",
                    kind, accountId, fanout.failureCount(), fanout.firstError());
            return outcome(intent, fanout.cancelled() ? OutcomeStatus.CANCELLED : OutcomeStatus.FAILED)
                    .chatsFailed(fanout.failureCount())
                    .errorDetail(fanout.firstError())
                    .build();
        }

        // the new restriction replaces any earlier one of the same family, including
        // an expired one the reconciler has not lifted yet
        String actor = intent.getExecutor().asString();
        reverseAll(accountId, actionRecordRepository.findUnreversed(accountId, kind.isBan() ? BAN_KINDS : MUTE_KINDS),
                actor, issuedAt);
        boolean trustRevoked = kind.isBan() && reverseActive(accountId, TRUST_KINDS, actor, issuedAt);

        ActionRecord record = newRecord(intent, issuedAt, expiresAt);
        actionRecordRepository.save(record);

        OutcomeStatus status;
        if (fanout.cancelled()) {
            status = OutcomeStatus.CANCELLED;
        } else if (fanout.failureCount() > 0) {
            status = OutcomeStatus.PARTIALLY_SUCCEEDED;
        } else {
            status = OutcomeStatus.SUCCEEDED;
        }

        ActionOutcome.ActionOutcomeBuilder builder = outcome(intent, status)
                .chatsAffected(fanout.successCount())
                .chatsFailed(fanout.failureCount())
                .errorDetail(fanout.firstError())
                .trustRevoked(trustRevoked)
                .expiresAt(expiresAt)
                .actionRecordId(record.getRecordId());

        if (status != OutcomeStatus.CANCELLED && kind.notifiesAccount()) {
            String fallback = intent.getOriginCommunityId() != null
                    ? intent.getOriginCommunityId()
                    : fanout.succeeded().isEmpty() ? null : fanout.succeeded().get(0);
            DeliveryResult delivery = notificationService.deliver(accountId, fallback,
                    intent.getOriginMessageId(), notificationText(kind, until, intent.getReason()));
            builder.notificationChannel(delivery.channel());
        }
        return builder.build();
    }

    private ActionOutcome unban(EnforcementIntent intent) {
        String accountId = intent.getTargetAccountId();
        long now = clock.millis();

        List<ActionRecord> bans = actionRecordRepository.findActive(accountId, BAN_KINDS, now);
        if (bans.isEmpty()) {
            return outcome(intent, OutcomeStatus.NO_OP).errorDetail("Account is not banned").build();
        }

        List<String> communities = membershipRepository.findCommunityIds(accountId);
        FanoutResult fanout = fanoutExecutor.execute(communities,
                communityId -> platformGateway.unbanMember(communityId, accountId));
        recordFailures(ActionKind.UNBAN, fanout);

        if (fanout.allFailed()) {
            return outcome(intent, fanout.cancelled() ? OutcomeStatus.CANCELLED : OutcomeStatus.FAILED)
                    .chatsFailed(fanout.failureCount())
                    .errorDetail(fanout.firstError())
                    .build();
        }

        String actor = intent.getExecutor().asString();
        reverseActive(accountId, BAN_KINDS, actor, now);

        boolean trustRestored = false;
        if (intent.isRestoreTrust()
                && actionRecordRepository.findActive(accountId, TRUST_KINDS, now).isEmpty()) {
            ActionRecord trust = ActionRecord.builder()
                    .recordId(UUID.randomUUID().toString())
                    .accountId(accountId)
                    .kind(ActionKind.TRUST)
                    .issuedBy(actor)
                    .issuedAt(now)
                    .expiresAt(0)
                    .reason("Trust restored on unban")
                    .build();
            actionRecordRepository.save(trust);
            trustRestored = true;
        }

        OutcomeStatus status = fanout.cancelled() ? OutcomeStatus.CANCELLED
                : fanout.failureCount() > 0 ? OutcomeStatus.PARTIALLY_SUCCEEDED
                : OutcomeStatus.SUCCEEDED;
        return outcome(intent, status)
                .chatsAffected(fanout.successCount())
                .chatsFailed(fanout.failureCount())
                .errorDetail(fanout.firstError())
                .trustRestored(trustRestored)
                .build();
    }

    /**
     * Reverse every active record of the given kinds.
     *
     * @return true if at least one record was active
     */
    private boolean reverseActive(String accountId, List<ActionKind> kinds, String by, long now) {
        return reverseAll(accountId, actionRecordRepository.findActive(accountId, kinds, now), by, now);
    }

    private boolean reverseAll(String accountId, List<ActionRecord> records, String by, long now) {
        for (ActionRecord record : records) {
            record.reverse(by, now);
            if (!actionRecordRepository.markReversed(record)) {
                log.warn("Could not store reversal of {} record {} for {}", record.getKind(), record.getRecordId(), accountId);
            }
        }
        return !records.isEmpty();
    }

    private ActionRecord newRecord(EnforcementIntent intent, long issuedAt, long expiresAt) {
        return ActionRecord.builder()
                .recordId(UUID.randomUUID().toString())
                .accountId(intent.getTargetAccountId())
                .kind(intent.getKind())
                .issuedBy(intent.getExecutor().asString())
                .issuedAt(issuedAt)
                .expiresAt(expiresAt)
                .reason(intent.getReason())
                .originMessageId(intent.getOriginMessageId())
                .build();
    }

    private void recordFailures(ActionKind kind, FanoutResult fanout) {
        for (int i = 0; i < fanout.failureCount(); i++) {
            metricsConfig.recordCommunityFailure(kind.name());
        }
    }

    private ActionOutcome finish(EnforcementIntent intent, ActionOutcome outcome) {
        metricsConfig.recordEnforcement(String.valueOf(intent.getKind()), outcome.getStatus().name());
        if (intent.getKind() != null && intent.getTargetAccountId() != null && intent.getExecutor() != null) {
            auditService.record(intent.getExecutor(), intent.getTargetAccountId(), AuditAction.of(intent.getKind()),
                    outcome.getStatus().name(), auditDetails(intent, outcome), intent.getOriginCommunityId());
        }
        if (outcome.getStatus() == OutcomeStatus.FAILED || outcome.getStatus() == OutcomeStatus.PARTIALLY_SUCCEEDED) {
            log.warn("{} of {} finished {}: {} affected, {} failed ({})", intent.getKind(), intent.getTargetAccountId(),
                    outcome.getStatus(), outcome.getChatsAffected(), outcome.getChatsFailed(), outcome.getErrorDetail());
        } else {
            log.info("{} of {} by {} finished {}: {} communities affected", intent.getKind(),
                    intent.getTargetAccountId(), intent.getExecutor() != null ? intent.getExecutor().asString() : null,
                    outcome.getStatus(), outcome.getChatsAffected());
        }
        return outcome;
    }

    private static String auditDetails(EnforcementIntent intent, ActionOutcome outcome) {
        StringBuilder sb = new StringBuilder();
        sb.append("affected=").append(outcome.getChatsAffected())
                .append(", failed=").append(outcome.getChatsFailed());
        if (intent.getDuration() != null) sb.append(", duration=").append(intent.getDuration());
        if (intent.getReason() != null) sb.append(", reason=").append(intent.getReason());
        if (outcome.isTrustRevoked()) sb.append(", trust revoked");
        if (outcome.isTrustRestored()) sb.append(", trust restored");
        if (outcome.getErrorDetail() != null) sb.append(", error=").append(outcome.getErrorDetail());
        return sb.toString();
    }

    private static ActionOutcome.ActionOutcomeBuilder outcome(EnforcementIntent intent, OutcomeStatus status) {
        return ActionOutcome.builder()
                .kind(intent.getKind())
                .accountId(intent.getTargetAccountId())
                .status(status);
    }

    static String notificationText(ActionKind kind, Instant until, String reason) {
        String suffix = reason != null && !reason.isBlank() ? " Reason: " + reason : "";
        switch (kind) {
            case BAN:
                return "You have been banned from all managed communities." + suffix;
            case TEMP_BAN:
                return "You have been banned from all managed communities until " + until + "." + suffix;
            case MUTE:
                return "You have been muted in all managed communities until " + until + "." + suffix;
            default:
                return "A moderation action was applied to your account." + suffix;
        }
    }
}
