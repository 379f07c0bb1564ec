package com.chatguard.moderation.engine;

import com.chatguard.moderation.config.DetectionConfig;
import com.chatguard.moderation.config.MetricsConfig;
import com.chatguard.moderation.model.CheckConfig;
import com.chatguard.moderation.model.CheckConfigSnapshot;
import com.chatguard.moderation.model.CheckName;
import com.chatguard.moderation.model.CheckResult;
import io.micrometer.observation.annotation.Observed;
import io.micrometer.tracing.Span;
import io.micrometer.tracing.Tracer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs the content checks that apply to a message.
 *
 * Each CheckName is handled by one registered ContentCheck. Checks run in
 * parallel on the bounded check executor; each has its own timeout and the
 * whole run a deadline. A check that throws or times out yields a neutral,
 * abstaining result instead of failing the run.
 */
@Component
public class CheckEngine {

    private static final Logger log = LoggerFactory.getLogger(CheckEngine.class);

    private final Map<CheckName, ContentCheck> checkMap;
    private final ScopeResolver scopeResolver;
    private final ThreadPoolTaskExecutor checkExecutor;
    private final DetectionConfig detectionConfig;
    private final Tracer tracer;
    private final MetricsConfig metricsConfig;

    public CheckEngine(List<ContentCheck> checks,
                       ScopeResolver scopeResolver,
                       @Qualifier("checkExecutor") ThreadPoolTaskExecutor checkExecutor,
                       DetectionConfig detectionConfig,
                       Tracer tracer,
                       MetricsConfig metricsConfig) {
        this.checkMap = new EnumMap<>(CheckName.class);
        this.scopeResolver = scopeResolver;
        this.checkExecutor = checkExecutor;
        this.detectionConfig = detectionConfig;
        this.tracer = tracer;
        this.metricsConfig = metricsConfig;

        for (ContentCheck check : checks) {
            ContentCheck previous = checkMap.put(check.getCheckName(), check);
            if (previous != null) {
                throw new IllegalStateException("Two content checks registered for " + check.getCheckName()
                        + ": " + previous.getClass().getSimpleName() + " and " + check.getClass().getSimpleName());
            }
            log.info("Registered content check: {} -> {}",
                    check.getCheckName(), check.getClass().getSimpleName());
        }
    }

    /**
     * Run every applicable check against a message.
     *
     * @param context        the message
     * @param snapshot       global and community configuration for this evaluation
     * @param trustedAccount trusted authors only get always-run checks
     * @return one result per executed check, in CheckName order
     * @throws EvaluationException          if no check could run, or every check failed
     * @throws EvaluationCancelledException if the calling thread is interrupted
     */
    @Observed(name = "checks.run_all", contextualName = "run-content-checks")
    public List<CheckResult> runChecks(CheckContext context, CheckConfigSnapshot snapshot, boolean trustedAccount) {
        List<PlannedCheck> plan = plan(snapshot, trustedAccount);
        if (plan.isEmpty()) {
            if (trustedAccount) {
                return Collections.emptyList();
            }
            throw new EvaluationException("No content checks are enabled for community " + context.getCommunityId());
        }

        long startNanos = System.nanoTime();
        long deadlineNanos = startNanos + TimeUnit.MILLISECONDS.toNanos(detectionConfig.getEvaluationDeadlineMs());

        List<Future<CheckResult>> futures = new ArrayList<>(plan.size());
        for (PlannedCheck planned : plan) {
            try {
                futures.add(checkExecutor.submit(() -> runOne(planned, context)));
            } catch (TaskRejectedException e) {
                log.warn("Check executor rejected {} for message {}", planned.check().getCheckName(), context.getMessageId());
                futures.add(null);
            }
        }

        List<CheckResult> results = new ArrayList<>(plan.size());
        try {
            for (int i = 0; i < plan.size(); i++) {
                results.add(await(plan.get(i), futures.get(i), startNanos, deadlineNanos, context));
            }
        } catch (InterruptedException e) {
            futures.stream().filter(f -> f != null).forEach(f -> f.cancel(true));
            Thread.currentThread().interrupt();
            throw new EvaluationCancelledException("Evaluation of message " + context.getMessageId() + " was cancelled");
        }

        if (results.stream().allMatch(CheckResult::isAbstained)) {
            throw new EvaluationException("All " + results.size() + " content checks failed for message "
                    + context.getMessageId());
        }
        return results;
    }

    private List<PlannedCheck> plan(CheckConfigSnapshot snapshot, boolean trustedAccount) {
        List<PlannedCheck> plan = new ArrayList<>();
        for (Map.Entry<CheckName, ContentCheck> entry : checkMap.entrySet()) {
            Optional<CheckConfig> resolved = scopeResolver.resolve(entry.getKey(), snapshot);
            if (resolved.isEmpty()) {
                continue;
            }
            CheckConfig config = resolved.get();
            if (!config.isEnabled() && !config.isAlwaysRun()) {
                continue;
            }
            if (trustedAccount && !config.isAlwaysRun()) {
                continue;
            }
            plan.add(new PlannedCheck(entry.getValue(), config, !config.isEnabled()));
        }
        return plan;
    }

    private CheckResult runOne(PlannedCheck planned, CheckContext context) {
        CheckName name = planned.check().getCheckName();
        Span span = tracer.nextSpan()
                .name("check.evaluate." + name)
                .tag("check.name", name.name())
                .tag("message.id", String.valueOf(context.getMessageId()))
                .start();
        long start = System.nanoTime();

        try (Tracer.SpanInScope ws = tracer.withSpan(span)) {
            CheckResult result = planned.check().evaluate(context, planned.config());
            span.tag("check.verdict", result.getVerdict().name());
            span.tag("check.confidence", String.valueOf(result.getConfidence()));
            return result.toBuilder()
                    .checkName(name)
                    .durationMs(elapsedMs(start))
                    .weight(planned.config().getWeight())
                    .accuracyOnly(planned.accuracyOnly())
                    .build();
        } catch (Exception e) {
            span.error(e);
            log.error("Error running check {} for message {}: {}",
                    name, context.getMessageId(), e.getMessage(), e);
            // one broken check must never block the decision
            return abstain(planned, "Check failed: " + e.getMessage(), elapsedMs(start));
        } finally {
            span.end();
        }
    }

    private CheckResult await(PlannedCheck planned, Future<CheckResult> future,
                              long startNanos, long deadlineNanos, CheckContext context) throws InterruptedException {
        CheckName name = planned.check().getCheckName();
        if (future == null) {
            return record(abstain(planned, "Check was not scheduled: executor saturated", 0));
        }

        long timeoutMs = planned.config().getTimeoutMs() > 0
                ? planned.config().getTimeoutMs()
                : detectionConfig.getCheckTimeoutMs();
        long checkDeadlineNanos = Math.min(startNanos + TimeUnit.MILLISECONDS.toNanos(timeoutMs), deadlineNanos);
        long waitNanos = Math.max(0, checkDeadlineNanos - System.nanoTime());

        try {
            return record(future.get(waitNanos, TimeUnit.NANOSECONDS));
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("Check {} timed out after {}ms for message {}", name, timeoutMs, context.getMessageId());
            return record(abstain(planned, "Check timed out after " + timeoutMs + "ms", elapsedMs(startNanos)));
        } catch (ExecutionException e) {
            log.error("Check {} failed for message {}", name, context.getMessageId(), e.getCause());
            return record(abstain(planned, "Check failed: " + e.getCause().getMessage(), elapsedMs(startNanos)));
        } catch (CancellationException e) {
            return record(abstain(planned, "Check was cancelled", elapsedMs(startNanos)));
        }
    }

    private CheckResult abstain(PlannedCheck planned, String details, long durationMs) {
        return CheckResult.abstain(planned.check().getCheckName(), details, durationMs)
                .toBuilder()
                .weight(planned.config().getWeight())
                .accuracyOnly(planned.accuracyOnly())
                .build();
    }

    private CheckResult record(CheckResult result) {
        String outcome = result.isAbstained() ? "abstained" : result.getVerdict().name().toLowerCase();
        metricsConfig.recordCheck(result.getCheckName().name(), outcome, result.getDurationMs());
        return result;
    }

    private static long elapsedMs(long startNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }

    private record PlannedCheck(ContentCheck check, CheckConfig config, boolean accuracyOnly) {}
}
