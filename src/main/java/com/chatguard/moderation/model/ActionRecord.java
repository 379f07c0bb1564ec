package com.chatguard.moderation.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Durable record of one issued moderation action.
 *
 * State is derived, never stored: a record is REVERSED once {@code reversedAt}
 * is set, EXPIRED once its expiry has passed without a reversal, otherwise
 * ACTIVE. The only mutations are {@link #reverse} and the reconciler claim.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "An issued moderation action and its expiry/reversal state")
public class ActionRecord {

    @Schema(description = "Record identifier", example = "5f0c7a52-7f0e-4d7c-9f1e-3b1b0b6f2a10")
    private String recordId;

    @Schema(description = "Target account", example = "584930211")
    private String accountId;

    @Schema(description = "Action kind", example = "MUTE")
    private ActionKind kind;

    @Schema(description = "Issuer in TYPE:id form", example = "ADMIN:42")
    private String issuedBy;

    @Schema(description = "Issue time in epoch milliseconds", example = "1739886764000")
    private long issuedAt;

    @Schema(description = "Expiry in epoch milliseconds; 0 for permanent actions", example = "1739887064000")
    private long expiresAt;

    @Schema(description = "Reason given at issuance", example = "Spam links")
    private String reason;

    @Schema(description = "Message that triggered the action, if any", example = "-1001234567890:4521")
    private String originMessageId;

    @Schema(description = "Reversal time in epoch milliseconds; 0 while not reversed", example = "0")
    private long reversedAt;

    @Schema(description = "Who reversed the action", example = "SYSTEM:expiry-reconciler")
    private String reversedBy;

    @JsonIgnore
    private String claimedBy;

    @JsonIgnore
    private long claimedAt;

    // Aerospike record generation at read time, used for conditional writes
    @JsonIgnore
    private int generation;

    @JsonIgnore
    public boolean isPermanent() {
        return expiresAt <= 0;
    }

    public ActionState stateAt(long now) {
        if (reversedAt > 0) {
            return ActionState.REVERSED;
        }
        if (!isPermanent() && expiresAt <= now) {
            return ActionState.EXPIRED;
        }
        return ActionState.ACTIVE;
    }

    public boolean isActiveAt(long now) {
        return stateAt(now) == ActionState.ACTIVE;
    }

    /**
     * ACTIVE or EXPIRED to REVERSED.
     *
     * @throws IllegalStateException if the record is already reversed
     */
    public void reverse(String by, long at) {
        if (reversedAt > 0) {
            throw new IllegalStateException("Action record " + recordId + " already reversed by " + reversedBy);
        }
        this.reversedAt = at;
        this.reversedBy = by;
    }

    /** Whether a reconciler claim is held and still inside its lease. */
    public boolean isClaimedAt(long now, long leaseMs) {
        return claimedBy != null && !claimedBy.isEmpty() && claimedAt + leaseMs > now;
    }
}
