package com.chatguard.moderation.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;

/**
 * A request to apply one moderation action to an account in every community
 * it belongs to. Consumed by the orchestrator; never stored.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EnforcementIntent {
    private String targetAccountId;
    private Actor executor;
    private ActionKind kind;
    private Duration duration;
    private String reason;
    private String originMessageId;
    private String originCommunityId;
    // UNBAN only: grant trust again once the ban is lifted
    private boolean restoreTrust;
}
