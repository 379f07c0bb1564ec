package com.chatguard.moderation.service;

import com.chatguard.moderation.config.MetricsConfig;
import com.chatguard.moderation.config.ModerationConfig;
import com.chatguard.moderation.model.AccountMembership;
import com.chatguard.moderation.model.DeliveryResult;
import com.chatguard.moderation.model.NotificationChannel;
import com.chatguard.moderation.platform.PlatformGateway;
import com.chatguard.moderation.repository.MembershipRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Service;

import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Tells an account about an action taken against it.
 *
 * A private message is tried first, but only if the account has opened a
 * private chat with the bot. Otherwise, or if that fails, the account is
 * mentioned in the fallback community, as a reply to the originating message
 * when one is known. One attempt per channel, each bounded by a timeout.
 * A channel whose task the executor refuses counts as a failed attempt.
 */
@Service
public class NotificationDeliveryService {

    private static final Logger log = LoggerFactory.getLogger(NotificationDeliveryService.class);

    private final PlatformGateway platformGateway;
    private final MembershipRepository membershipRepository;
    private final ThreadPoolTaskExecutor executor;
    private final ModerationConfig config;
    private final MetricsConfig metricsConfig;

    public NotificationDeliveryService(PlatformGateway platformGateway,
                                       MembershipRepository membershipRepository,
                                       @Qualifier("enforcementExecutor") ThreadPoolTaskExecutor executor,
                                       ModerationConfig config,
                                       MetricsConfig metricsConfig) {
        this.platformGateway = platformGateway;
        this.membershipRepository = membershipRepository;
        this.executor = executor;
        this.config = config;
        this.metricsConfig = metricsConfig;
    }

    public DeliveryResult deliver(String accountId, String fallbackCommunityId, String replyToMessageId, String text) {
        String lastError = null;

        AccountMembership membership = membershipRepository.findByAccountId(accountId);
        if (membership.isPrivateChatOpen()) {
            lastError = attempt(NotificationChannel.PRIVATE_MESSAGE,
                    () -> platformGateway.sendPrivateMessage(accountId, text));
            if (lastError == null) {
                return DeliveryResult.delivered(NotificationChannel.PRIVATE_MESSAGE);
            }
            log.info("Private message to {} failed ({}), falling back to community mention", accountId, lastError);
        }

        if (fallbackCommunityId != null) {
            String mention = "@" + accountId + " " + text;
            lastError = attempt(NotificationChannel.COMMUNITY_MENTION,
                    () -> platformGateway.sendCommunityMessage(fallbackCommunityId, mention, replyToMessageId));
            if (lastError == null) {
                return DeliveryResult.delivered(NotificationChannel.COMMUNITY_MENTION);
            }
        } else if (lastError == null) {
            lastError = "no private chat and no fallback community";
        }

        log.warn("Could not notify account {}: {}", accountId, lastError);
        return DeliveryResult.undelivered(lastError);
    }

    private String attempt(NotificationChannel channel, Runnable send) {
        Future<?> future;
        try {
            future = executor.submit(send);
        } catch (TaskRejectedException e) {
            metricsConfig.recordNotification(channel.name(), "rejected");
            return channel + " rejected: executor saturated";
        }
        try {
            future.get(config.getNotificationTimeoutMs(), TimeUnit.MILLISECONDS);
            metricsConfig.recordNotification(channel.name(), "delivered");
            return null;
        } catch (TimeoutException e) {
            future.cancel(true);
            metricsConfig.recordNotification(channel.name(), "timeout");
            return channel + " timed out";
        } catch (ExecutionException e) {
            metricsConfig.recordNotification(channel.name(), "failed");
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            return channel + " failed: " + cause.getMessage();
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            metricsConfig.recordNotification(channel.name(), "cancelled");
            return channel + " interrupted";
        }
    }
}
