package com.chatguard.moderation.service;

import com.chatguard.moderation.config.ModerationConfig;
import com.chatguard.moderation.model.FanoutResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs one platform call per community on the enforcement pool.
 *
 * Communities are independent: a failure in one is recorded and the rest
 * carry on; nothing is rolled back. Each call gets its own timeout, the
 * whole fan-out a deadline. Interrupting the caller cancels outstanding calls.
 */
@Component
public class CommunityFanoutExecutor {

    private static final Logger log = LoggerFactory.getLogger(CommunityFanoutExecutor.class);

    @FunctionalInterface
    public interface CommunityCall {
        void apply(String communityId);
    }

    private final ThreadPoolTaskExecutor enforcementExecutor;
    private final ModerationConfig config;

    public CommunityFanoutExecutor(@Qualifier("enforcementExecutor") ThreadPoolTaskExecutor enforcementExecutor,
                                   ModerationConfig config) {
        this.enforcementExecutor = enforcementExecutor;
        this.config = config;
    }

    public FanoutResult execute(List<String> communityIds, CommunityCall call) {
        long deadlineNanos = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(config.getExecuteDeadlineMs());

        List<Future<?>> futures = new ArrayList<>(communityIds.size());
        for (String communityId : communityIds) {
            try {
                futures.add(enforcementExecutor.submit(() -> call.apply(communityId)));
            } catch (TaskRejectedException e) {
                futures.add(null);
            }
        }

        List<String> succeeded = new ArrayList<>();
        List<String> failed = new ArrayList<>();
        String firstError = null;

        for (int i = 0; i < communityIds.size(); i++) {
            String communityId = communityIds.get(i);
            Future<?> future = futures.get(i);
            String error;

            if (future == null) {
                error = "enforcement pool saturated";
            } else {
                long waitNanos = Math.min(TimeUnit.MILLISECONDS.toNanos(config.getCommunityCallTimeoutMs()),
                        Math.max(0, deadlineNanos - System.nanoTime()));
                try {
                    future.get(waitNanos, TimeUnit.NANOSECONDS);
                    succeeded.add(communityId);
                    continue;
                } catch (InterruptedException e) {
                    futures.stream().filter(f -> f != null).forEach(f -> f.cancel(true));
                    Thread.currentThread().interrupt();
                    log.warn("Fan-out interrupted after {} of {} communities", succeeded.size(), communityIds.size());
                    return new FanoutResult(succeeded, failed, firstError, true);
                } catch (TimeoutException e) {
                    future.cancel(true);
                    error = "timed out";
                } catch (ExecutionException e) {
                    Throwable cause = e.getCause() != null ? e.getCause() : e;
                    error = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
                } catch (CancellationException e) {
                    error = "cancelled";
                }
            }

            failed.add(communityId);
            log.warn("Community {} failed: {}", communityId, error);
            if (firstError == null) {
                firstError = communityId + ": " + error;
            }
        }

        return new FanoutResult(succeeded, failed, firstError, false);
    }
}
