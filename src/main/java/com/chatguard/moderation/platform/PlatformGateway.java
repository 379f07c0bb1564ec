package com.chatguard.moderation.platform;

import java.time.Instant;

/**
 * Enforcement and messaging primitives of the chat platform, one community at a time.
 * Implementations surface failures as {@link PlatformException}; callers do not
 * interpret them beyond logging and counting.
 */
public interface PlatformGateway {

    void banMember(String communityId, String accountId);

    /**
     * Ban that the platform lifts by itself at {@code until}. The expiry reconciler
     * still lifts it explicitly, so implementations may ignore the hint.
     */
    void banMemberUntil(String communityId, String accountId, Instant until);

    void unbanMember(String communityId, String accountId);

    /** Remove send permissions until {@code until}. */
    void restrictMember(String communityId, String accountId, Instant until);

    void unrestrictMember(String communityId, String accountId);

    void deleteMessage(String communityId, String messageId);

    void sendPrivateMessage(String accountId, String text);

    /**
     * Post into a community, as a reply to {@code replyToMessageId} when it is not null.
     */
    void sendCommunityMessage(String communityId, String text, String replyToMessageId);
}
