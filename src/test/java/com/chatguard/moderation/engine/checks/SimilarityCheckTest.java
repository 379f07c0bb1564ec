package com.chatguard.moderation.engine.checks;

import com.chatguard.moderation.config.DetectionConfig;
import com.chatguard.moderation.engine.CheckContext;
import com.chatguard.moderation.model.*;
import com.chatguard.moderation.service.TrainingCorpusService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Set;
import java.util.stream.Stream;

import static com.chatguard.moderation.testutil.TestDataFactory.createCheckConfig;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SimilarityCheckTest {

    @Mock private TrainingCorpusService corpusService;

    private SimilarityCheck check;

    @BeforeEach
    void setUp() {
        check = new SimilarityCheck(corpusService, new DetectionConfig());
    }

    private CheckResult evaluate(String text) {
        return check.evaluate(CheckContext.of("M-1", "C-1", "A-1", text),
                createCheckConfig(CheckName.SIMILARITY, null, true, 0));
    }

    private void indexSpam(String... texts) {
        when(corpusService.samples(TrainingLabel.SPAM)).thenAnswer(inv -> Stream.of(texts)
                .map(t -> TrainingSample.builder().text(t).label(TrainingLabel.SPAM).build()));
        check.refreshModel();
    }

    @Test
    void evaluate_emptyIndex_isClean() {
        CheckResult result = evaluate("join my channel for free signals");

        assertThat(result.getVerdict()).isEqualTo(Verdict.CLEAN);
        assertThat(result.isAbstained()).isFalse();
    }

    @Test
    void evaluate_nearDuplicateOfKnownSpam_isSpam() {
        indexSpam("join my channel for free crypto signals every day");

        CheckResult result = evaluate("Join my channel for FREE crypto signals every day!");

        assertThat(check.indexSize()).isEqualTo(1);
        assertThat(result.getVerdict()).isEqualTo(Verdict.SPAM);
        assertThat(result.getConfidence()).isEqualTo(100);
    }

    @Test
    void evaluate_unrelatedText_isClean() {
        indexSpam("join my channel for free crypto signals every day");

        CheckResult result = evaluate("the release build failed on the integration server");

        assertThat(result.getVerdict()).isEqualTo(Verdict.CLEAN);
    }

    @Test
    void shingles_shortText_fallsBackToWords() {
        assertThat(SimilarityCheck.shingles("Hello world", 3)).containsExactlyInAnyOrder("hello", "world");
        assertThat(SimilarityCheck.shingles("one two three four", 3))
                .containsExactlyInAnyOrder("one two three", "two three four");
    }

    @Test
    void jaccard_computesOverlapRatio() {
        assertThat(SimilarityCheck.jaccard(Set.of("a", "b", "c"), Set.of("b", "c", "d"))).isEqualTo(0.5);
        assertThat(SimilarityCheck.jaccard(Set.of(), Set.of("a"))).isZero();
    }
}
