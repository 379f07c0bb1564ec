package com.chatguard.moderation.engine.checks;

import com.chatguard.moderation.config.DetectionConfig;
import com.chatguard.moderation.engine.CheckContext;
import com.chatguard.moderation.engine.ContentCheck;
import com.chatguard.moderation.engine.bayes.NaiveBayesClassifier;
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

import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;

/**
 * Naive Bayes classifier trained from the training corpus.
 *
 * Scoring:
 *   The posterior spam probability (0.0-1.0) maps to confidence 0-100. The
 *   message counts as spam when the probability reaches "minSpamProbability".
 *   Until both labels have "minSamplesPerClass" samples the check reports clean.
 *
 * Check params:
 *   - "minSpamProbability" (default: from config)
 *   - "minSamplesPerClass" (default: from config)
 */
@Component
public class BayesCheck implements ContentCheck {

    private static final Logger log = LoggerFactory.getLogger(BayesCheck.class);

    private final TrainingCorpusService corpusService;
    private final DetectionConfig config;
    private final AtomicReference<NaiveBayesClassifier> model = new AtomicReference<>(NaiveBayesClassifier.empty());

    public BayesCheck(TrainingCorpusService corpusService, DetectionConfig config) {
        this.corpusService = corpusService;
        this.config = config;
    }

    @Override
    public CheckName getCheckName() {
        return CheckName.BAYES;
    }

    @Scheduled(fixedRateString = "${training.model-refresh-minutes:30}", timeUnit = TimeUnit.MINUTES)
    public void refreshModel() {
        try {
            List<String> spam = corpusService.samples(TrainingLabel.SPAM)
                    .map(TrainingSample::getText).collect(Collectors.toList());
            List<String> ham = corpusService.samples(TrainingLabel.HAM)
                    .map(TrainingSample::getText).collect(Collectors.toList());
            model.set(NaiveBayesClassifier.train(spam, ham));
            log.info("Bayes model retrained: {} spam, {} ham samples", spam.size(), ham.size());
        } catch (Exception e) {
            log.error("Failed to retrain Bayes model, keeping the previous one", e);
        }
    }

    @Override
    public CheckResult evaluate(CheckContext context, CheckConfig checkConfig) {
        NaiveBayesClassifier classifier = model.get();
        int minSamples = checkConfig.intParam("minSamplesPerClass",
                config.getCheckDefaults().getBayesMinSamplesPerClass());
        if (classifier.getSpamDocs() < minSamples || classifier.getHamDocs() < minSamples) {
            return CheckResult.clean(getCheckName(), String.format(
                    "Insufficient training data (%d spam, %d ham, need %d each)",
                    classifier.getSpamDocs(), classifier.getHamDocs(), minSamples));
        }

        double probability = classifier.spamProbability(context.getText());
        double minProbability = checkConfig.doubleParam("minSpamProbability",
                config.getCheckDefaults().getBayesMinSpamProbability());
        int confidence = (int) Math.round(probability * 100);
        String details = String.format("Spam probability %.3f (threshold %.2f)", probability, minProbability);

        if (probability < minProbability || confidence < checkConfig.getConfidenceThreshold()) {
            return CheckResult.clean(getCheckName(), details);
        }
        return CheckResult.spam(getCheckName(), confidence, details);
    }

    void useModel(NaiveBayesClassifier classifier) {
        model.set(classifier);
    }
}
