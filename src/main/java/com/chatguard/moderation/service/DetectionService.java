package com.chatguard.moderation.service;

import com.chatguard.moderation.config.DetectionConfig;
import com.chatguard.moderation.config.MetricsConfig;
import com.chatguard.moderation.config.ModerationConfig;
import com.chatguard.moderation.engine.CheckContext;
import com.chatguard.moderation.engine.CheckEngine;
import com.chatguard.moderation.model.ActionKind;
import com.chatguard.moderation.model.ActionOutcome;
import com.chatguard.moderation.model.Actor;
import com.chatguard.moderation.model.AuditAction;
import com.chatguard.moderation.model.CheckConfigSnapshot;
import com.chatguard.moderation.model.CheckResult;
import com.chatguard.moderation.model.ContentMessage;
import com.chatguard.moderation.model.DetectionAction;
import com.chatguard.moderation.model.DetectionDecision;
import com.chatguard.moderation.model.EnforcementIntent;
import com.chatguard.moderation.model.OutcomeStatus;
import com.chatguard.moderation.model.ReviewQueueItem;
import com.chatguard.moderation.model.ReviewStatus;
import com.chatguard.moderation.platform.PlatformException;
import com.chatguard.moderation.platform.PlatformGateway;
import com.chatguard.moderation.repository.ActionRecordRepository;
import com.chatguard.moderation.repository.CheckConfigRepository;
import com.chatguard.moderation.repository.CommunityRepository;
import com.chatguard.moderation.repository.DetectionDecisionRepository;
import com.chatguard.moderation.repository.ReviewQueueRepository;
import io.micrometer.observation.annotation.Observed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;

/**
 * Main entry point for message evaluation.
 *
 * Flow:
 * 1. Snapshot the check configuration for the message's community
 * 2. Run the applicable checks via the CheckEngine (trusted authors get always-run checks only)
 * 3. Score the results into a decision via DecisionScoringService
 * 4. Persist the decision; an evaluation of an older edit is marked superseded, audited and not acted on
 * 5. Audit it and feed it to the training corpus
 * 6. Outside training mode: enqueue for review, or ban the author and delete the message
 */
@Service
public class DetectionService {

    private static final Logger log = LoggerFactory.getLogger(DetectionService.class);

    private final CheckEngine checkEngine;
    private final DecisionScoringService scoringService;
    private final CheckConfigRepository checkConfigRepository;
    private final DetectionDecisionRepository decisionRepository;
    private final ActionRecordRepository actionRecordRepository;
    private final CommunityRepository communityRepository;
    private final ReviewQueueRepository reviewQueueRepository;
    private final TrainingCorpusService corpusService;
    private final ModerationOrchestrator orchestrator;
    private final PlatformGateway platformGateway;
    private final AdminAlertService adminAlertService;
    private final AuditService auditService;
    private final DetectionConfig detectionConfig;
    private final ModerationConfig moderationConfig;
    private final MetricsConfig metricsConfig;
    private final Clock clock;

    public DetectionService(CheckEngine checkEngine,
                            DecisionScoringService scoringService,
                            CheckConfigRepository checkConfigRepository,
                            DetectionDecisionRepository decisionRepository,
                            ActionRecordRepository actionRecordRepository,
                            CommunityRepository communityRepository,
                            ReviewQueueRepository reviewQueueRepository,
                            TrainingCorpusService corpusService,
                            ModerationOrchestrator orchestrator,
                            PlatformGateway platformGateway,
                            AdminAlertService adminAlertService,
                            AuditService auditService,
                            DetectionConfig detectionConfig,
                            ModerationConfig moderationConfig,
                            MetricsConfig metricsConfig,
                            Clock clock) {
        this.checkEngine = checkEngine;
        this.scoringService = scoringService;
        this.checkConfigRepository = checkConfigRepository;
        this.decisionRepository = decisionRepository;
        this.actionRecordRepository = actionRecordRepository;
        this.communityRepository = communityRepository;
        this.reviewQueueRepository = reviewQueueRepository;
        this.corpusService = corpusService;
        this.orchestrator = orchestrator;
        this.platformGateway = platformGateway;
        this.adminAlertService = adminAlertService;
        this.auditService = auditService;
        this.detectionConfig = detectionConfig;
        this.moderationConfig = moderationConfig;
        this.metricsConfig = metricsConfig;
        this.clock = clock;
    }

    /**
     * Evaluate one message version.
     *
     * @throws com.chatguard.moderation.engine.EvaluationException if no check could produce a verdict
     */
    @Observed(name = "message.evaluate", contextualName = "evaluate-message")
    public DetectionDecision evaluate(ContentMessage message) {
        long now = clock.millis();

        // 1. Configuration for this evaluation, read once
        CheckConfigSnapshot snapshot = checkConfigRepository.snapshotFor(message.getCommunityId());
        boolean trusted = !actionRecordRepository
                .findActive(message.getAccountId(), List.of(ActionKind.TRUST), now).isEmpty();

        // 2. Run checks
        CheckContext context = CheckContext.of(message.getMessageId(), message.getCommunityId(),
                message.getAccountId(), message.getText());
        List<CheckResult> results = checkEngine.runChecks(context, snapshot, trusted);

        // 3. Score
        boolean trainingMode = detectionConfig.isTrainingMode()
                || communityRepository.isTrainingMode(message.getCommunityId());
        DetectionDecision decision = scoringService.computeDecision(message, results, trainingMode, now);
        decision.setTrainingEligible(corpusService.isAutomaticallyEligible(decision, message.getText()));

        // 4. Persist; only the newest edit version is acted on
        if (!decisionRepository.save(decision)) {
            decision.setSuperseded(true);
            log.info("Decision {} superseded by a later evaluation, not acting on it", decision.getDecisionId());
            auditService.record(Actor.autoDetection(), message.getAccountId(), AuditAction.DETECTION_DECISION,
                    "SUPERSEDED",
                    String.format("message=%s v%d verdict=%s net=%d", message.getMessageId(),
                            message.getEditVersion(), decision.getVerdict(), decision.getNetConfidence()),
                    message.getCommunityId());
            return decision;
        }

        // 5. Audit and training feed
        auditService.record(Actor.autoDetection(), message.getAccountId(), AuditAction.DETECTION_DECISION,
                decision.getAction().name(),
                String.format("message=%s v%d verdict=%s net=%d%s%s", message.getMessageId(),
                        message.getEditVersion(), decision.getVerdict(), decision.getNetConfidence(),
                        decision.isVetoed() ? " vetoed" : "", trainingMode ? " training-mode" : ""),
                message.getCommunityId());
        corpusService.record(decision, message.getText());
        metricsConfig.recordDecision(decision.getAction().name(), decision.getNetConfidence());

        if (decision.getAction() != DetectionAction.ALLOW) {
            log.warn("Spam detected: account={}, message={}, community={}, net={}, action={}{}",
                    message.getAccountId(), message.getMessageId(), message.getCommunityId(),
                    decision.getNetConfidence(), decision.getAction(), trainingMode ? " (training mode)" : "");
        }

        if (trainingMode) {
            return decision;
        }

        // 6. Act
        if (decision.getAction() == DetectionAction.REVIEW_QUEUE) {
            enqueueForReview(decision, message);
        } else if (decision.getAction() == DetectionAction.AUTO_BAN) {
            decision.setEnforcement(autoBan(decision, message));
        }
        return decision;
    }

    private void enqueueForReview(DetectionDecision decision, ContentMessage message) {
        List<String> spamChecks = decision.getCheckResults().stream()
                .filter(CheckResult::votesSpam)
                .map(r -> r.getCheckName().name())
                .toList();

        reviewQueueRepository.save(ReviewQueueItem.builder()
                .decisionId(decision.getDecisionId())
                .messageId(message.getMessageId())
                .communityId(message.getCommunityId())
                .accountId(message.getAccountId())
                .netConfidence(decision.getNetConfidence())
                .spamChecks(spamChecks)
                .text(message.getText())
                .enqueuedAt(decision.getEvaluatedAt())
                .status(ReviewStatus.PENDING)
                .reviewedAt(0)
                .build());
    }

    private ActionOutcome autoBan(DetectionDecision decision, ContentMessage message) {
        EnforcementIntent intent = EnforcementIntent.builder()
                .targetAccountId(message.getAccountId())
                .executor(Actor.autoDetection())
                .kind(ActionKind.BAN)
                .reason("Automatic spam detection (confidence " + decision.getNetConfidence() + "%)")
                .originMessageId(message.getMessageId())
                .originCommunityId(message.getCommunityId())
                .build();

        ActionOutcome outcome = orchestrator.execute(intent);
        if (outcome.getStatus() == OutcomeStatus.REJECTED) {
            return outcome;
        }

        if (moderationConfig.isDeleteMessageOnAutoBan()) {
            try {
                platformGateway.deleteMessage(message.getCommunityId(), message.getMessageId());
                outcome.setMessageDeleted(true);
                auditService.record(Actor.autoDetection(), message.getAccountId(), AuditAction.MESSAGE_DELETED,
                        "SUCCEEDED", "message=" + message.getMessageId(), message.getCommunityId());
            } catch (PlatformException e) {
                log.warn("Could not delete message {} in {}: {}",
                        message.getMessageId(), message.getCommunityId(), e.getMessage());
            }
        }

        if (outcome.isSuccess() && outcome.getStatus() != OutcomeStatus.NO_OP) {
            adminAlertService.alertAutoBan(decision, outcome);
        }
        return outcome;
    }
}
