package com.chatguard.moderation.engine.checks;

import com.chatguard.moderation.config.MetricsConfig;
import com.chatguard.moderation.config.ReputationConfig;
import com.chatguard.moderation.engine.CheckContext;
import com.chatguard.moderation.engine.ContentCheck;
import com.chatguard.moderation.engine.reputation.ReputationClient;
import com.chatguard.moderation.engine.reputation.ReputationQuota;
import com.chatguard.moderation.engine.reputation.ReputationVerdict;
import com.chatguard.moderation.model.CheckConfig;
import com.chatguard.moderation.model.CheckName;
import com.chatguard.moderation.model.CheckResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Looks up every distinct URL in the message with the external reputation
 * provider.
 *
 * Scoring: a URL flagged by at least "maliciousEngines" engines makes the
 * message spam; confidence starts at 70 and grows by 10 per flagging engine.
 *
 * Quota: lookups are rate limited. When the quota runs out the check
 * abstains rather than blocking or failing the evaluation.
 *
 * Check params:
 *   - "maliciousEngines" (default: from config)
 *   - "maxUrls" (default 3) URLs looked up per message
 */
@Component
public class UrlReputationCheck implements ContentCheck {

    private static final Logger log = LoggerFactory.getLogger(UrlReputationCheck.class);

    private final ReputationClient reputationClient;
    private final ReputationQuota quota;
    private final ReputationConfig config;
    private final MetricsConfig metricsConfig;

    public UrlReputationCheck(ReputationClient reputationClient,
                              ReputationQuota quota,
                              ReputationConfig config,
                              MetricsConfig metricsConfig) {
        this.reputationClient = reputationClient;
        this.quota = quota;
        this.config = config;
        this.metricsConfig = metricsConfig;
    }

    @Override
    public CheckName getCheckName() {
        return CheckName.URL_REPUTATION;
    }

    @Override
    public CheckResult evaluate(CheckContext context, CheckConfig checkConfig) {
        if (!config.isEnabled()) {
            return CheckResult.clean(getCheckName(), "URL reputation lookups are disabled");
        }

        Set<String> urls = new LinkedHashSet<>(context.urls());
        if (urls.isEmpty()) {
            return CheckResult.clean(getCheckName(), "No URLs in message");
        }

        int maxUrls = checkConfig.intParam("maxUrls", 3);
        int threshold = checkConfig.intParam("maliciousEngines", config.getMaliciousEngineThreshold());

        ReputationVerdict worst = null;
        List<String> checked = new ArrayList<>();
        for (String url : urls) {
            if (checked.size() >= maxUrls) break;
            if (!quota.tryAcquire()) {
                metricsConfig.recordQuotaExhausted("url-reputation");
                log.warn("Reputation quota exhausted, skipping lookup for message {}", context.getMessageId());
                if (worst == null) {
                    return CheckResult.abstain(getCheckName(), "Reputation quota exhausted", 0);
                }
                break;
            }
            ReputationVerdict verdict = reputationClient.lookup(url);
            checked.add(url);
            if (worst == null || verdict.malicious() > worst.malicious()) {
                worst = verdict;
            }
        }

        if (worst == null || worst.malicious() < threshold) {
            return CheckResult.clean(getCheckName(), "No flagged URLs among " + checked.size() + " checked");
        }

        int confidence = Math.min(100, 70 + worst.malicious() * 10);
        String details = String.format("%s flagged malicious by %d engines (%d suspicious)",
                worst.url(), worst.malicious(), worst.suspicious());
        if (confidence < checkConfig.getConfidenceThreshold()) {
            return CheckResult.clean(getCheckName(), details + "; confidence " + confidence + " below threshold");
        }
        return CheckResult.spam(getCheckName(), confidence, details);
    }
}
