package com.chatguard.moderation.service;

import com.chatguard.moderation.config.MetricsConfig;
import com.chatguard.moderation.model.ActionKind;
import com.chatguard.moderation.model.ActionOutcome;
import com.chatguard.moderation.model.Actor;
import com.chatguard.moderation.model.AuditAction;
import com.chatguard.moderation.model.EnforcementIntent;
import com.chatguard.moderation.model.PagedResponse;
import com.chatguard.moderation.model.ReviewFeedbackResult;
import com.chatguard.moderation.model.ReviewQueueDetail;
import com.chatguard.moderation.model.ReviewQueueItem;
import com.chatguard.moderation.model.ReviewStatus;
import com.chatguard.moderation.model.TrainingLabel;
import com.chatguard.moderation.repository.ActionRecordRepository;
import com.chatguard.moderation.repository.DetectionDecisionRepository;
import com.chatguard.moderation.repository.ReviewQueueRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

@Service
public class ReviewQueueService {

    private static final Logger log = LoggerFactory.getLogger(ReviewQueueService.class);

    private final ReviewQueueRepository reviewQueueRepo;
    private final DetectionDecisionRepository decisionRepo;
    private final ActionRecordRepository actionRecordRepo;
    private final TrainingCorpusService corpusService;
    private final ModerationOrchestrator orchestrator;
    private final AuditService auditService;
    private final MetricsConfig metricsConfig;
    private final Clock clock;

    public ReviewQueueService(ReviewQueueRepository reviewQueueRepo,
                              DetectionDecisionRepository decisionRepo,
                              ActionRecordRepository actionRecordRepo,
                              TrainingCorpusService corpusService,
                              ModerationOrchestrator orchestrator,
                              AuditService auditService,
                              MetricsConfig metricsConfig,
                              Clock clock) {
        this.reviewQueueRepo = reviewQueueRepo;
        this.decisionRepo = decisionRepo;
        this.actionRecordRepo = actionRecordRepo;
        this.corpusService = corpusService;
        this.orchestrator = orchestrator;
        this.auditService = auditService;
        this.metricsConfig = metricsConfig;
        this.clock = clock;
    }

    public PagedResponse<ReviewQueueItem> getQueueItems(ReviewStatus status, String communityId,
                                                        String accountId, int limit, Long before) {
        return reviewQueueRepo.findByFilters(status, communityId, accountId, limit, before);
    }

    public ReviewQueueDetail getQueueItemDetail(String decisionId) {
        ReviewQueueItem queueItem = reviewQueueRepo.findByDecisionId(decisionId);
        if (queueItem == null) return null;

        return ReviewQueueDetail.builder()
                .queueItem(queueItem)
                .decision(decisionRepo.findById(decisionId))
                .authorActions(actionRecordRepo.findByAccountId(queueItem.getAccountId()))
                .build();
    }

    /**
     * Resolve a pending item. The first reviewer wins; the verdict becomes an
     * explicit training label, and a spam verdict can ban the author.
     */
    public ReviewFeedbackResult submitFeedback(String decisionId, ReviewStatus status,
                                               String reviewerId, boolean banAuthor) {
        if (status != ReviewStatus.CONFIRMED_SPAM && status != ReviewStatus.CONFIRMED_HAM) {
            throw new IllegalArgumentException("Feedback status must be CONFIRMED_SPAM or CONFIRMED_HAM");
        }

        Actor reviewer = Actor.admin(reviewerId);
        boolean updated = reviewQueueRepo.resolve(decisionId, status, reviewer.asString(), clock.millis());
        ReviewQueueItem item = reviewQueueRepo.findByDecisionId(decisionId);
        if (!updated) {
            log.warn("Could not submit feedback for decision={}: item not found or already reviewed", decisionId);
            return new ReviewFeedbackResult(item, false, null);
        }

        metricsConfig.recordFeedback(status.name());
        log.info("Feedback submitted: decision={}, status={}, by={}", decisionId, status, reviewer.asString());

        TrainingLabel label = status == ReviewStatus.CONFIRMED_SPAM ? TrainingLabel.SPAM : TrainingLabel.HAM;
        corpusService.label(decisionId, item.getText(), label, item.getCommunityId(), reviewer.asString());
        auditService.record(reviewer, item.getAccountId(), AuditAction.REVIEW_FEEDBACK, status.name(),
                "decision=" + decisionId, item.getCommunityId());

        ActionOutcome enforcement = null;
        if (banAuthor && status == ReviewStatus.CONFIRMED_SPAM) {
            enforcement = orchestrator.execute(EnforcementIntent.builder()
                    .targetAccountId(item.getAccountId())
                    .executor(reviewer)
                    .kind(ActionKind.BAN)
                    .reason("Confirmed spam on review (decision " + decisionId + ")")
                    .originMessageId(item.getMessageId())
                    .originCommunityId(item.getCommunityId())
                    .build());
        }
        return new ReviewFeedbackResult(item, true, enforcement);
    }

    public Map<String, Integer> getQueueStats() {
        Map<ReviewStatus, Integer> counts = reviewQueueRepo.countByStatus();
        Map<String, Integer> stats = new LinkedHashMap<>();
        stats.put("pending", counts.getOrDefault(ReviewStatus.PENDING, 0));
        stats.put("confirmedSpam", counts.getOrDefault(ReviewStatus.CONFIRMED_SPAM, 0));
        stats.put("confirmedHam", counts.getOrDefault(ReviewStatus.CONFIRMED_HAM, 0));
        return stats;
    }
}
