package com.chatguard.moderation.service;

import com.chatguard.moderation.config.DetectionConfig;
import com.chatguard.moderation.model.AggregationPolicy;
import com.chatguard.moderation.model.CheckResult;
import com.chatguard.moderation.model.ContentMessage;
import com.chatguard.moderation.model.DetectionAction;
import com.chatguard.moderation.model.DetectionDecision;
import com.chatguard.moderation.model.Verdict;
import com.chatguard.moderation.repository.DetectionDecisionRepository;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Combines check results into one decision and applies the policy thresholds.
 *
 * Only SPAM votes contribute to the net confidence; abstaining results never do.
 * Results from checks that only ran because they are always-run count toward
 * the accuracy confidence, and toward the net confidence only when
 * {@code detection.always-run-votes} is set.
 *
 * Classification order: veto, auto-ban, review, allow. The veto demotes an
 * auto-ban to review for short messages whose net confidence is below the
 * veto threshold.
 */
@Service
public class DecisionScoringService {

    private final DetectionConfig config;

    public DecisionScoringService(DetectionConfig config) {
        this.config = config;
    }

    public DetectionDecision computeDecision(ContentMessage message, List<CheckResult> results,
                                             boolean trainingMode, long evaluatedAt) {
        AggregationPolicy policy = config.getAggregationPolicy();
        int net = netConfidence(results, policy, config.isAlwaysRunVotes());
        int accuracy = netConfidence(results, policy, true);

        int textLength = message.getText() != null ? message.getText().strip().length() : 0;
        DetectionAction action;
        boolean vetoed = false;

        if (net >= config.getAutoBanThreshold()) {
            if (textLength < config.getMinMessageLength() && net < config.getMaxConfidenceVetoThreshold()) {
                action = DetectionAction.REVIEW_QUEUE;
                vetoed = true;
            } else {
                action = DetectionAction.AUTO_BAN;
            }
        } else if (net >= config.getReviewQueueThreshold()) {
            action = DetectionAction.REVIEW_QUEUE;
        } else {
            action = DetectionAction.ALLOW;
        }

        return DetectionDecision.builder()
                .decisionId(DetectionDecisionRepository.decisionId(message.getMessageId(), message.getEditVersion()))
                .messageId(message.getMessageId())
                .communityId(message.getCommunityId())
                .accountId(message.getAccountId())
                .evaluatedAt(evaluatedAt)
                .verdict(net >= config.getReviewQueueThreshold() ? Verdict.SPAM : Verdict.CLEAN)
                .netConfidence(net)
                .accuracyConfidence(accuracy)
                .checkResults(List.copyOf(results))
                .source(message.getSource())
                .editVersion(message.getEditVersion())
                .action(action)
                .vetoed(vetoed)
                .trainingMode(trainingMode)
                .build();
    }

    /**
     * Net confidence of a result list under an aggregation policy, 0-100.
     */
    public int netConfidence(List<CheckResult> results, AggregationPolicy policy, boolean includeAccuracyOnly) {
        double max = 0.0;
        double sum = 0.0;
        double weightSum = 0.0;

        for (CheckResult r : results) {
            if (!r.votesSpam() || (r.isAccuracyOnly() && !includeAccuracyOnly)) {
                continue;
            }
            double weighted = r.getConfidence() * r.getWeight();
            max = Math.max(max, weighted);
            sum += weighted;
            weightSum += r.getWeight();
        }

        double net;
        switch (policy) {
            case ADDITIVE:
                net = sum;
                break;
            case WEIGHTED_AVERAGE:
                net = weightSum > 0 ? sum / weightSum : 0.0;
                break;
            case WEIGHTED_MAX:
            default:
                net = max;
                break;
        }
        return (int) Math.round(Math.max(0.0, Math.min(100.0, net)));
    }
}
