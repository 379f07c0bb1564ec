package com.chatguard.moderation.platform;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;

/**
 * Logs every primitive instead of calling the platform. Active until a real
 * platform adapter bean is registered.
 */
public class DryRunPlatformGateway implements PlatformGateway {

    private static final Logger log = LoggerFactory.getLogger(DryRunPlatformGateway.class);

    @Override
    public void banMember(String communityId, String accountId) {
        log.info("[dry-run] ban account={} community={}", accountId, communityId);
    }

    @Override
    public void banMemberUntil(String communityId, String accountId, Instant until) {
        log.info("[dry-run] ban account={} community={} until={}", accountId, communityId, until);
    }

    @Override
    public void unbanMember(String communityId, String accountId) {
        log.info("[dry-run] unban account={} community={}", accountId, communityId);
    }

    @Override
    public void restrictMember(String communityId, String accountId, Instant until) {
        log.info("[dry-run] restrict account={} community={} until={}", accountId, communityId, until);
    }

    @Override
    public void unrestrictMember(String communityId, String accountId) {
        log.info("[dry-run] unrestrict account={} community={}", accountId, communityId);
    }

    @Override
    public void deleteMessage(String communityId, String messageId) {
        log.info("[dry-run] delete message={} community={}", messageId, communityId);
    }

    @Override
    public void sendPrivateMessage(String accountId, String text) {
        log.info("[dry-run] private message to account={}: {}", accountId, text);
    }

    @Override
    public void sendCommunityMessage(String communityId, String text, String replyToMessageId) {
        log.info("[dry-run] community message community={} replyTo={}: {}", communityId, replyToMessageId, text);
    }
}
