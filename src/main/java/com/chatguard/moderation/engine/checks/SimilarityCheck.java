package com.chatguard.moderation.engine.checks;

import com.chatguard.moderation.config.DetectionConfig;
import com.chatguard.moderation.engine.CheckContext;
import com.chatguard.moderation.engine.ContentCheck;
import com.chatguard.moderation.model.CheckConfig;
import com.chatguard.moderation.model.CheckName;
import com.chatguard.moderation.model.CheckResult;
import com.chatguard.moderation.model.TrainingLabel;
import com.chatguard.moderation.model.TrainingSample;
import com.chatguard.moderation.service.TrainingCorpusService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;

/**
 * Compares a message with known spam samples.
 *
 * Logic: both texts are cut into overlapping word shingles; the highest
 * Jaccard similarity against any spam sample becomes the confidence when it
 * reaches the similarity threshold.
 *
 * Check params:
 *   - "similarityThreshold" (default: from config) 0.0-1.0
 *
 * The spam sample index is rebuilt from the training corpus on the model
 * refresh schedule.
 */
@Component
public class SimilarityCheck implements ContentCheck {

    private static final Logger log = LoggerFactory.getLogger(SimilarityCheck.class);

    private final TrainingCorpusService corpusService;
    private final DetectionConfig config;
    private final AtomicReference<List<Set<String>>> spamShingles = new AtomicReference<>(Collections.emptyList());

    public SimilarityCheck(TrainingCorpusService corpusService, DetectionConfig config) {
        this.corpusService = corpusService;
        this.config = config;
    }

    @Override
    public CheckName getCheckName() {
        return CheckName.SIMILARITY;
    }

    @Scheduled(fixedRateString = "${training.model-refresh-minutes:30}", timeUnit = TimeUnit.MINUTES)
    public void refreshModel() {
        try {
            int size = config.getCheckDefaults().getSimilarityShingleSize();
            List<Set<String>> index = corpusService.samples(TrainingLabel.SPAM)
                    .map(TrainingSample::getText)
                    .map(t -> shingles(t, size))
                    .filter(s -> !s.isEmpty())
                    .collect(Collectors.toList());
            spamShingles.set(index);
            log.info("Similarity index rebuilt from {} spam samples", index.size());
        } catch (Exception e) {
            log.error("Failed to rebuild similarity index, keeping the previous one", e);
        }
    }

    @Override
    public CheckResult evaluate(CheckContext context, CheckConfig checkConfig) {
        List<Set<String>> index = spamShingles.get();
        if (index.isEmpty()) {
            return CheckResult.clean(getCheckName(), "No spam samples to compare against");
        }

        Set<String> message = shingles(context.getText(), config.getCheckDefaults().getSimilarityShingleSize());
        if (message.isEmpty()) {
            return CheckResult.clean(getCheckName(), "Message has no comparable words");
        }

        double best = 0.0;
        for (Set<String> sample : index) {
            best = Math.max(best, jaccard(message, sample));
            if (best >= 0.95) {
                break;
            }
        }

        double threshold = checkConfig.doubleParam("similarityThreshold",
                config.getCheckDefaults().getSimilarityThreshold());
        int confidence = (int) Math.round(best * 100);
        String details = String.format("Max similarity %.2f against %d spam samples (threshold %.2f)",
                best, index.size(), threshold);

        if (best < threshold || confidence < checkConfig.getConfidenceThreshold()) {
            return CheckResult.clean(getCheckName(), details);
        }
        return CheckResult.spam(getCheckName(), confidence, details);
    }

    int indexSize() {
        return spamShingles.get().size();
    }

    static Set<String> shingles(String text, int size) {
        if (text == null) return Collections.emptySet();
        List<String> words = new ArrayList<>();
        for (String w : text.toLowerCase(Locale.ROOT).split("[^\\p{L}\\p{N}]+")) {
            if (!w.isEmpty()) words.add(w);
        }
        Set<String> shingles = new HashSet<>();
        if (words.size() < size) {
            shingles.addAll(words);
            return shingles;
        }
        for (int i = 0; i + size <= words.size(); i++) {
            shingles.add(String.join(" ", words.subList(i, i + size)));
        }
        return shingles;
    }

    static double jaccard(Set<String> a, Set<String> b) {
        if (a.isEmpty() || b.isEmpty()) return 0.0;
        int intersection = 0;
        Set<String> smaller = a.size() <= b.size() ? a : b;
        Set<String> larger = smaller == a ? b : a;
        for (String s : smaller) {
            if (larger.contains(s)) intersection++;
        }
        return (double) intersection / (a.size() + b.size() - intersection);
    }
}
