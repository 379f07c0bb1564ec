package com.chatguard.moderation.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Result of executing one moderation action across communities")
public class ActionOutcome {

    @Schema(description = "Executed action", example = "BAN")
    private ActionKind kind;

    @Schema(description = "Target account", example = "584930211")
    private String accountId;

    @Schema(description = "Outcome status", example = "PARTIALLY_SUCCEEDED")
    private OutcomeStatus status;

    @Schema(description = "Communities where the platform call succeeded", example = "2")
    private int chatsAffected;

    @Schema(description = "Communities where the platform call failed or timed out", example = "1")
    private int chatsFailed;

    @Schema(description = "First error, or the rejection reason", example = "Community -100200: bot lacks ban rights")
    private String errorDetail;

    @Schema(description = "Whether an active trust grant was revoked by this action", example = "true")
    private boolean trustRevoked;

    @Schema(description = "Whether trust was granted again by an unban", example = "false")
    private boolean trustRestored;

    @Schema(description = "Whether the originating message was deleted", example = "false")
    private boolean messageDeleted;

    @Schema(description = "Channel the account notification went out on", example = "PRIVATE_MESSAGE")
    @Builder.Default
    private NotificationChannel notificationChannel = NotificationChannel.NONE;

    @Schema(description = "Expiry of timed actions in epoch milliseconds; 0 for permanent", example = "1739887064000")
    private long expiresAt;

    @Schema(description = "Persisted action record, if one was written", example = "5f0c7a52-7f0e-4d7c-9f1e-3b1b0b6f2a10")
    private String actionRecordId;

    public boolean isSuccess() {
        return status != null && status.isSuccess();
    }

    public static ActionOutcome rejected(EnforcementIntent intent, String reason) {
        return ActionOutcome.builder()
                .kind(intent.getKind())
                .accountId(intent.getTargetAccountId())
                .status(OutcomeStatus.REJECTED)
                .errorDetail(reason)
                .build();
    }
}
