package com.chatguard.moderation.config;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.observation.ObservationRegistry;
import io.micrometer.observation.aop.ObservedAspect;
import org.springframework.context.annotation.Bean;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

@Component
public class MetricsConfig {

    private final MeterRegistry registry;
    private final AtomicInteger trainingCorpusSize;

    public MetricsConfig(MeterRegistry registry) {
        this.registry = registry;
        this.trainingCorpusSize = registry.gauge("training.corpus.size", new AtomicInteger(0));
    }

    @Bean
    public ObservedAspect observedAspect(ObservationRegistry observationRegistry) {
        return new ObservedAspect(observationRegistry);
    }

    public void recordDecision(String action, int netConfidence) {
        Counter.builder("detection.decision.count")
                .tag("action", action)
                .register(registry)
                .increment();

        DistributionSummary.builder("detection.net_confidence")
                .tag("action", action)
                .register(registry)
                .record(netConfidence);
    }

    public void recordCheck(String checkName, String outcome, long durationMs) {
        Timer.builder("detection.check.duration")
                .tag("check", checkName)
                .tag("outcome", outcome)
                .register(registry)
                .record(durationMs, TimeUnit.MILLISECONDS);
    }

    public void recordEnforcement(String kind, String status) {
        Counter.builder("moderation.action.count")
                .tag("kind", kind)
                .tag("status", status)
                .register(registry)
                .increment();
    }

    public void recordCommunityFailure(String kind) {
        Counter.builder("moderation.community.failure.count")
                .tag("kind", kind)
                .register(registry)
                .increment();
    }

    public void recordNotification(String channel, String status) {
        Counter.builder("notification.sent.count")
                .tag("channel", channel)
                .tag("status", status)
                .register(registry)
                .increment();
    }

    public void recordReversal(String kind) {
        Counter.builder("moderation.expiry.reversed.count")
                .tag("kind", kind)
                .register(registry)
                .increment();
    }

    public void recordQuotaExhausted(String service) {
        Counter.builder("reputation.quota.exhausted.count")
                .tag("service", service)
                .register(registry)
                .increment();
    }

    public void recordAuditFailure() {
        registry.counter("audit.write.failure.count").increment();
    }

    public void recordFeedback(String status) {
        Counter.builder("review.feedback.count")
                .tag("status", status)
                .register(registry)
                .increment();
    }

    public void updateTrainingCorpusSize(int size) {
        trainingCorpusSize.set(size);
    }
}
