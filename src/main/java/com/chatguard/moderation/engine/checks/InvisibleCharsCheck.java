package com.chatguard.moderation.engine.checks;

import com.chatguard.moderation.config.DetectionConfig;
import com.chatguard.moderation.engine.CheckContext;
import com.chatguard.moderation.engine.ContentCheck;
import com.chatguard.moderation.model.CheckConfig;
import com.chatguard.moderation.model.CheckName;
import com.chatguard.moderation.model.CheckResult;
import org.springframework.stereotype.Component;

import java.util.Set;

/**
 * Detects zero-width and unusual space characters, which spammers insert to
 * split words without changing how the message looks.
 *
 * Check params:
 *   - "minCount" (default: from config) invisible characters needed to flag
 */
@Component
public class InvisibleCharsCheck implements ContentCheck {

    private static final Set<Integer> INVISIBLE = Set.of(
            0x200B, // zero width space
            0x200C, // zero width non-joiner
            0x200D, // zero width joiner
            0x2060, // word joiner
            0xFEFF, // zero width no-break space
            0x00AD  // soft hyphen
    );

    private static final Set<Integer> UNUSUAL_SPACES = Set.of(
            0x2000, 0x2001, 0x2002, 0x2003, 0x2009, 0x200A, 0x202F, 0x3000);

    private final DetectionConfig config;

    public InvisibleCharsCheck(DetectionConfig config) {
        this.config = config;
    }

    @Override
    public CheckName getCheckName() {
        return CheckName.INVISIBLE_CHARS;
    }

    @Override
    public CheckResult evaluate(CheckContext context, CheckConfig checkConfig) {
        String text = context.getText();
        long invisible = text.codePoints().filter(INVISIBLE::contains).count();
        long unusual = text.codePoints().filter(UNUSUAL_SPACES::contains).count();

        int minCount = checkConfig.intParam("minCount", config.getCheckDefaults().getInvisibleCharsMinCount());
        if (invisible < minCount) {
            return CheckResult.clean(getCheckName(), "No invisible characters");
        }

        int confidence = (int) Math.min(100, 50 + (invisible - 1) * 10 + (unusual > 0 ? 20 : 0));
        String details = "Invisible characters: " + invisible + (unusual > 0 ? ", unusual spaces: " + unusual : "");
        if (confidence < checkConfig.getConfidenceThreshold()) {
            return CheckResult.clean(getCheckName(), details + "; confidence " + confidence + " below threshold");
        }
        return CheckResult.spam(getCheckName(), confidence, details);
    }
}
