package com.chatguard.moderation.engine.checks;

import com.chatguard.moderation.config.DetectionConfig;
import com.chatguard.moderation.engine.CheckContext;
import com.chatguard.moderation.engine.ContentCheck;
import com.chatguard.moderation.model.CheckConfig;
import com.chatguard.moderation.model.CheckName;
import com.chatguard.moderation.model.CheckResult;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Flags messages containing known spam phrases.
 *
 * Logic: every configured stop word that occurs in the normalized text as a
 * whole word (or whole phrase) adds a fixed amount of confidence.
 *
 * Example: with 35 per match, "free crypto airdrop" matches "crypto" and
 * "airdrop" and scores 70.
 *
 * Check params:
 *   - "words" (default: from config) comma-separated stop words
 *   - "confidencePerMatch" (default: from config)
 */
@Component
public class StopWordsCheck implements ContentCheck {

    private final DetectionConfig config;

    public StopWordsCheck(DetectionConfig config) {
        this.config = config;
    }

    @Override
    public CheckName getCheckName() {
        return CheckName.STOP_WORDS;
    }

    @Override
    public CheckResult evaluate(CheckContext context, CheckConfig checkConfig) {
        String text = context.normalizedText();
        if (text.isEmpty()) {
            return CheckResult.clean(getCheckName(), "Empty message");
        }

        int perMatch = checkConfig.intParam("confidencePerMatch",
                config.getCheckDefaults().getStopWordsConfidencePerMatch());

        List<String> matched = new ArrayList<>();
        for (String word : stopWords(checkConfig)) {
            Pattern p = Pattern.compile("(?<![\\p{L}\\p{N}])" + Pattern.quote(word) + "(?![\\p{L}\\p{N}])");
            if (p.matcher(text).find()) {
                matched.add(word);
            }
        }

        if (matched.isEmpty()) {
            return CheckResult.clean(getCheckName(), "No stop words found");
        }

        int confidence = Math.min(100, matched.size() * perMatch);
        String details = "Matched stop words: " + String.join(", ", matched);
        if (confidence < checkConfig.getConfidenceThreshold()) {
            return CheckResult.clean(getCheckName(),
                    details + " (confidence " + confidence + " below threshold " + checkConfig.getConfidenceThreshold() + ")");
        }
        return CheckResult.spam(getCheckName(), confidence, details);
    }

    private List<String> stopWords(CheckConfig checkConfig) {
        String configured = checkConfig.getParams() != null ? checkConfig.getParams().get("words") : null;
        List<String> source = configured != null && !configured.isBlank()
                ? Arrays.asList(configured.split(","))
                : config.getCheckDefaults().getStopWords();

        List<String> words = new ArrayList<>();
        for (String w : source) {
            String normalized = w.trim().toLowerCase(Locale.ROOT).replaceAll("\\s+", " ");
            if (!normalized.isEmpty() && !words.contains(normalized)) {
                words.add(normalized);
            }
        }
        return words;
    }
}
