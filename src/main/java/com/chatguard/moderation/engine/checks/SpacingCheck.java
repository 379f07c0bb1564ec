package com.chatguard.moderation.engine.checks;

import com.chatguard.moderation.config.DetectionConfig;
import com.chatguard.moderation.engine.CheckContext;
import com.chatguard.moderation.engine.ContentCheck;
import com.chatguard.moderation.model.CheckConfig;
import com.chatguard.moderation.model.CheckName;
import com.chatguard.moderation.model.CheckResult;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Detects text broken up to evade word filters ("f r e e  c r y p t o").
 *
 * Logic: URLs and mentions are stripped, then the share of words with at
 * most two characters is computed. A ratio at or above the configured
 * threshold, or a run of four single letters separated by spaces, makes
 * the message suspicious.
 *
 * Check params:
 *   - "ratioThreshold" (default: from config)
 *   - "minWords" (default: from config) messages with fewer words are not judged
 */
@Component
public class SpacingCheck implements ContentCheck {

    private static final Pattern URL = Pattern.compile("(?i)https?://\\S+");
    private static final Pattern MENTION = Pattern.compile("@\\w+");
    private static final Pattern LETTER_SPACING =
            Pattern.compile("(?<![\\p{L}\\p{N}])\\p{L}\\s\\p{L}\\s\\p{L}\\s\\p{L}(?![\\p{L}\\p{N}])");
    private static final int SHORT_WORD_LENGTH = 2;

    private final DetectionConfig config;

    public SpacingCheck(DetectionConfig config) {
        this.config = config;
    }

    @Override
    public CheckName getCheckName() {
        return CheckName.SPACING;
    }

    @Override
    public CheckResult evaluate(CheckContext context, CheckConfig checkConfig) {
        DetectionConfig.CheckDefaults defaults = config.getCheckDefaults();
        String text = context.getText();
        if (text.strip().length() < defaults.getSpacingMinLength()) {
            return CheckResult.clean(getCheckName(), "Message too short for spacing analysis");
        }

        List<String> words = words(text);
        int minWords = checkConfig.intParam("minWords", defaults.getSpacingMinWords());
        if (words.size() < minWords) {
            return CheckResult.clean(getCheckName(), "Message too short for spacing analysis");
        }

        double ratioThreshold = checkConfig.doubleParam("ratioThreshold", defaults.getSpacingRatioThreshold());
        long shortWords = words.stream().filter(w -> w.length() <= SHORT_WORD_LENGTH).count();
        double shortWordRatio = (double) shortWords / words.size();
        boolean letterSpacing = LETTER_SPACING.matcher(text).find();

        if (shortWordRatio < ratioThreshold && !letterSpacing) {
            return CheckResult.clean(getCheckName(),
                    String.format("Short word ratio %.2f below %.2f", shortWordRatio, ratioThreshold));
        }

        int confidence = 0;
        if (shortWordRatio >= 0.9) {
            confidence += 60;
        } else if (shortWordRatio >= ratioThreshold) {
            confidence += 40;
        }
        if (letterSpacing) {
            confidence += 40;
        }
        confidence = Math.min(100, confidence);

        String details = String.format("Short word ratio %.2f (threshold %.2f)%s",
                shortWordRatio, ratioThreshold, letterSpacing ? "; letters artificially separated" : "");
        if (confidence < checkConfig.getConfidenceThreshold()) {
            return CheckResult.clean(getCheckName(), details + "; confidence " + confidence + " below threshold");
        }
        return CheckResult.spam(getCheckName(), confidence, details);
    }

    private static List<String> words(String text) {
        String cleaned = MENTION.matcher(URL.matcher(text).replaceAll(" ")).replaceAll(" ");
        List<String> words = new ArrayList<>();
        for (String token : cleaned.split("\\s+")) {
            // punctuation-only tokens are not words
            if (!token.isEmpty() && token.codePoints().anyMatch(Character::isLetterOrDigit)) {
                words.add(token);
            }
        }
        return words;
    }
}
