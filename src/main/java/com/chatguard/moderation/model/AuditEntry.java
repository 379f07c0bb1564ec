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
@Schema(description = "Append-only audit log entry")
public class AuditEntry {

    @Schema(description = "Entry identifier", example = "0b0f7c6e-1a55-4f39-a1c4-8c0e5a0d7c11")
    private String entryId;

    @Schema(description = "Actor in TYPE:id form", example = "AUTO_DETECTION:detection-engine")
    private String actor;

    @Schema(description = "Target account, or the config scope for config changes", example = "584930211")
    private String target;

    @Schema(description = "Audited action", example = "BAN")
    private AuditAction action;

    @Schema(description = "Outcome", example = "SUCCEEDED")
    private String outcome;

    @Schema(description = "Free-form details", example = "chatsAffected=3 reason=Automatic spam detection (confidence 90%)")
    private String details;

    @Schema(description = "Community involved, if any", example = "-1001234567890")
    private String communityId;

    @Schema(description = "Entry time in epoch milliseconds", example = "1739886764000")
    private long timestamp;
}
