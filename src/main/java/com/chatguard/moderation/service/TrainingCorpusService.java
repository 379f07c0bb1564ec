package com.chatguard.moderation.service;

import com.chatguard.moderation.config.MetricsConfig;
import com.chatguard.moderation.config.TrainingConfig;
import com.chatguard.moderation.model.DetectionDecision;
import com.chatguard.moderation.model.DetectionSource;
import com.chatguard.moderation.model.SampleSource;
import com.chatguard.moderation.model.TrainingLabel;
import com.chatguard.moderation.model.TrainingSample;
import com.chatguard.moderation.model.Verdict;
import com.chatguard.moderation.repository.DetectionDecisionRepository;
import com.chatguard.moderation.repository.TrainingSampleRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Labelled examples for the learning checks.
 *
 * Only training-eligible decisions become samples. The set handed to the
 * checks is bounded: every explicit (human) sample plus the most recent
 * implicit ones, short texts dropped, duplicates removed. Checks pull on
 * their own schedule; nothing is pushed.
 */
@Service
public class TrainingCorpusService {

    private static final Logger log = LoggerFactory.getLogger(TrainingCorpusService.class);

    private final TrainingSampleRepository sampleRepository;
    private final DetectionDecisionRepository decisionRepository;
    private final TrainingConfig config;
    private final MetricsConfig metricsConfig;
    private final Clock clock;

    public TrainingCorpusService(TrainingSampleRepository sampleRepository,
                                 DetectionDecisionRepository decisionRepository,
                                 TrainingConfig config,
                                 MetricsConfig metricsConfig,
                                 Clock clock) {
        this.sampleRepository = sampleRepository;
        this.decisionRepository = decisionRepository;
        this.config = config;
        this.metricsConfig = metricsConfig;
        this.clock = clock;
    }

    /**
     * Whether an automatic decision is confident enough to train on without a human.
     */
    public boolean isAutomaticallyEligible(DetectionDecision decision, String text) {
        if (decision.getSource() != DetectionSource.AUTOMATIC) {
            return false;
        }
        if (text == null || text.strip().length() < config.getMinTextLength()) {
            return false;
        }
        if (decision.getVerdict() == Verdict.SPAM) {
            return decision.getNetConfidence() >= config.getAutoLabelMinConfidence();
        }
        return decision.getNetConfidence() == 0;
    }

    /**
     * Store an implicit sample for a stored decision. Ineligible decisions are ignored.
     */
    public void record(DetectionDecision decision, String text) {
        if (!decision.isTrainingEligible()) {
            return;
        }
        TrainingSample existing = sampleRepository.findByDecisionId(decision.getDecisionId());
        if (existing != null && existing.getSource() == SampleSource.EXPLICIT) {
            // a human label always wins
            return;
        }
        sampleRepository.save(TrainingSample.builder()
                .decisionId(decision.getDecisionId())
                .text(text)
                .label(decision.getVerdict() == Verdict.SPAM ? TrainingLabel.SPAM : TrainingLabel.HAM)
                .source(SampleSource.IMPLICIT)
                .communityId(decision.getCommunityId())
                .labeledBy(null)
                .createdAt(clock.millis())
                .build());
        log.debug("Recorded implicit {} sample for decision {}", decision.getVerdict(), decision.getDecisionId());
    }

    /**
     * Store a human label for a decision, replacing any implicit sample, and
     * mark the decision training-eligible.
     */
    public TrainingSample label(String decisionId, String text, TrainingLabel label,
                                String communityId, String labeledBy) {
        TrainingSample sample = TrainingSample.builder()
                .decisionId(decisionId)
                .text(text)
                .label(label)
                .source(SampleSource.EXPLICIT)
                .communityId(communityId)
                .labeledBy(labeledBy)
                .createdAt(clock.millis())
                .build();
        sampleRepository.save(sample);
        decisionRepository.updateTrainingEligible(decisionId, true);
        log.info("Decision {} labelled {} by {}", decisionId, label, labeledBy);
        return sample;
    }

    /**
     * Flip a decision's training eligibility. Withdrawing eligibility removes its sample.
     *
     * @return false if the decision does not exist
     */
    public boolean setEligibility(String decisionId, boolean eligible) {
        if (!decisionRepository.updateTrainingEligible(decisionId, eligible)) {
            return false;
        }
        if (!eligible && sampleRepository.delete(decisionId)) {
            log.info("Removed training sample for decision {}", decisionId);
        }
        return true;
    }

    /**
     * Bounded, de-duplicated samples for one label: explicit samples first, then
     * the most recent implicit ones.
     */
    public Stream<TrainingSample> samples(TrainingLabel label) {
        List<TrainingSample> all = sampleRepository.findByLabel(label);

        Stream<TrainingSample> explicit = all.stream()
                .filter(s -> s.getSource() == SampleSource.EXPLICIT)
                .sorted(Comparator.comparingLong(TrainingSample::getCreatedAt).reversed());
        Stream<TrainingSample> implicit = all.stream()
                .filter(s -> s.getSource() == SampleSource.IMPLICIT)
                .sorted(Comparator.comparingLong(TrainingSample::getCreatedAt).reversed())
                .limit(config.getMaxImplicitSamples());

        Set<String> seen = new HashSet<>();
        return Stream.concat(explicit, implicit)
                .filter(s -> s.getText() != null && s.getText().strip().length() >= config.getMinTextLength())
                .filter(s -> seen.add(normalize(s.getText())));
    }

    /**
     * Sample counts per label and source, as handed to the checks.
     */
    public Map<String, Object> stats() {
        Map<TrainingLabel, Map<SampleSource, Long>> counts = new EnumMap<>(TrainingLabel.class);
        int total = 0;
        for (TrainingLabel label : TrainingLabel.values()) {
            List<TrainingSample> samples = samples(label).collect(Collectors.toList());
            total += samples.size();
            counts.put(label, samples.stream()
                    .collect(Collectors.groupingBy(TrainingSample::getSource,
                            () -> new EnumMap<>(SampleSource.class), Collectors.counting())));
        }
        metricsConfig.updateTrainingCorpusSize(total);
        return Map.of(
                "total", total,
                "byLabel", counts,
                "maxImplicitSamples", config.getMaxImplicitSamples(),
                "minTextLength", config.getMinTextLength());
    }

    static String normalize(String text) {
        return text.toLowerCase(Locale.ROOT).replaceAll("\\s+", " ").strip();
    }
}
