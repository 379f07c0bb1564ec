package com.chatguard.moderation.engine.checks;

import com.chatguard.moderation.config.DetectionConfig;
import com.chatguard.moderation.engine.CheckContext;
import com.chatguard.moderation.model.CheckConfig;
import com.chatguard.moderation.model.CheckName;
import com.chatguard.moderation.model.CheckResult;
import com.chatguard.moderation.model.Verdict;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static com.chatguard.moderation.testutil.TestDataFactory.createCheckConfig;
import static com.chatguard.moderation.testutil.TestDataFactory.withParams;
import static org.assertj.core.api.Assertions.assertThat;

class StopWordsCheckTest {

    private final StopWordsCheck check = new StopWordsCheck(new DetectionConfig());

    private CheckResult evaluate(String text, CheckConfig config) {
        return check.evaluate(CheckContext.of("M-1", "C-1", "A-1", text), config);
    }

    private CheckConfig config(int threshold, String words) {
        return withParams(createCheckConfig(CheckName.STOP_WORDS, null, true, threshold),
                Map.of("words", words, "confidencePerMatch", "35"));
    }

    @Test
    void evaluate_twoMatches_confidenceScalesPerMatch() {
        CheckResult result = evaluate("Earn CRYPTO fast, join us", config(0, "crypto, earn"));

        assertThat(result.getVerdict()).isEqualTo(Verdict.SPAM);
        assertThat(result.getConfidence()).isEqualTo(70);
        assertThat(result.getDetails()).contains("crypto").contains("earn");
    }

    @Test
    void evaluate_wordInsideLongerWord_doesNotMatch() {
        CheckResult result = evaluate("I study cryptography at university", config(0, "crypto"));

        assertThat(result.getVerdict()).isEqualTo(Verdict.CLEAN);
    }

    @Test
    void evaluate_multiWordPhrase_matchesAcrossWhitespace() {
        CheckResult result = evaluate("just   DM  me for details", config(0, "dm me"));

        assertThat(result.getVerdict()).isEqualTo(Verdict.SPAM);
        assertThat(result.getConfidence()).isEqualTo(35);
    }

    @Test
    void evaluate_belowConfidenceThreshold_isClean() {
        CheckResult result = evaluate("crypto news today", config(50, "crypto,forex"));

        assertThat(result.getVerdict()).isEqualTo(Verdict.CLEAN);
        assertThat(result.getDetails()).contains("below threshold");
    }

    @Test
    void evaluate_noWordsParam_usesDefaultVocabulary() {
        CheckResult result = evaluate("Huge casino bonus inside",
                createCheckConfig(CheckName.STOP_WORDS, null, true, 0));

        assertThat(result.getVerdict()).isEqualTo(Verdict.SPAM);
        assertThat(result.getConfidence()).isEqualTo(70);
    }

    @Test
    void evaluate_manyMatches_cappedAt100() {
        CheckResult result = evaluate("crypto forex casino bonus", config(0, "crypto,forex,casino,bonus"));

        assertThat(result.getConfidence()).isEqualTo(100);
    }
}
